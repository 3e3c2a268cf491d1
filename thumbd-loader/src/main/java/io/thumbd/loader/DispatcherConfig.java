package io.thumbd.loader;

import java.time.Duration;
import java.util.Objects;

public record DispatcherConfig(
    int baseMaxConcurrent,
    Duration minLaunchInterval
) {

    public static final int DEFAULT_MAX_CONCURRENT = 5;
    public static final Duration DEFAULT_MIN_LAUNCH_INTERVAL = Duration.ofMillis(30);

    public DispatcherConfig {
        Objects.requireNonNull(minLaunchInterval, "minLaunchInterval");
        if (baseMaxConcurrent <= 0) {
            throw new IllegalArgumentException("baseMaxConcurrent must be positive");
        }
        if (minLaunchInterval.isNegative()) {
            throw new IllegalArgumentException("minLaunchInterval must not be negative");
        }
    }

    public static DispatcherConfig defaults() {
        return new DispatcherConfig(DEFAULT_MAX_CONCURRENT, DEFAULT_MIN_LAUNCH_INTERVAL);
    }

    public DispatcherConfig withBaseMaxConcurrent(int baseMaxConcurrent) {
        return new DispatcherConfig(baseMaxConcurrent, minLaunchInterval);
    }

    public DispatcherConfig withMinLaunchInterval(Duration minLaunchInterval) {
        return new DispatcherConfig(baseMaxConcurrent, minLaunchInterval);
    }
}
