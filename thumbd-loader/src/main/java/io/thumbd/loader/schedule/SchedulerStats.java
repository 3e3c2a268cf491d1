package io.thumbd.loader.schedule;

import io.thumbd.loader.DispatcherStats;

public record SchedulerStats(
    long totalRequests,
    long cacheHits,
    long cacheMisses,
    long preloadHits,
    double smoothedHitRate,
    double smoothedLoadMs,
    int preloadQueueSize,
    int variantQueueSize,
    long preloadDelayMillis,
    boolean paused,
    DispatcherStats dispatcher
) {

    public double hitRate() {
        return (double) cacheHits / Math.max(1, totalRequests);
    }
}
