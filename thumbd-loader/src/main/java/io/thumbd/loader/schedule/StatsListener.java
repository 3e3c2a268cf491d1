package io.thumbd.loader.schedule;

@FunctionalInterface
public interface StatsListener {

    void onStatsUpdated(SchedulerStats stats);
}
