package io.thumbd.loader.schedule;

import io.thumbd.loader.DispatcherStats;

/**
 * Additive increase / additive decrease around the dispatcher's pool size.
 *
 * <p>Shrinks by one when the pending backlog exceeds twice the active workers, grows by one
 * while the smoothed hit rate stays high. A decrease never goes
 * below {@code min(2, base)} and an increase never passes {@code base}.
 */
final class ConcurrencyController {

    static final double HIGH_HIT_RATE = 0.7;
    static final int FLOOR = 2;

    private final long intervalMillis;
    private long lastAdjustMillis = Long.MIN_VALUE / 2;

    ConcurrencyController(long intervalMillis) {
        this.intervalMillis = intervalMillis;
    }

    boolean isDue(long nowMillis) {
        return nowMillis - lastAdjustMillis >= intervalMillis;
    }

    int adjust(long nowMillis, DispatcherStats stats, double smoothedHitRate) {
        lastAdjustMillis = nowMillis;
        return target(stats, smoothedHitRate);
    }

    static int target(DispatcherStats stats, double smoothedHitRate) {
        int base = stats.baseMaxConcurrent();
        int current = stats.maxConcurrent();
        int floor = Math.min(FLOOR, base);

        if (stats.pending() > 2 * Math.max(1, stats.active())) {
            return current > floor ? current - 1 : current;
        }
        if (smoothedHitRate > HIGH_HIT_RATE && current < base) {
            return Math.min(base, current + 1);
        }
        return current;
    }
}
