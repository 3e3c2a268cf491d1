package io.thumbd.cache;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

public record CacheConfig(
    Path cacheDirectory,
    Path thumbnailsDirectory,
    long maxMemoryBytes,
    long maxDiskBytes,
    double memoryEvictionTrigger,
    Duration sweepInterval
) {

    public static final long MIN_SIZE = 1024 * 1024;
    public static final long DEFAULT_MAX_MEMORY = 200L * 1024 * 1024;
    public static final long DEFAULT_MAX_DISK = 1000L * 1024 * 1024;
    public static final double DEFAULT_EVICTION_TRIGGER = 0.95;
    public static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofHours(1);

    public CacheConfig {
        Objects.requireNonNull(cacheDirectory, "cacheDirectory");
        Objects.requireNonNull(thumbnailsDirectory, "thumbnailsDirectory");
        Objects.requireNonNull(sweepInterval, "sweepInterval");
        if (maxMemoryBytes < MIN_SIZE) {
            throw new IllegalArgumentException("maxMemoryBytes must be at least 1MB");
        }
        if (maxDiskBytes < MIN_SIZE) {
            throw new IllegalArgumentException("maxDiskBytes must be at least 1MB");
        }
        if (memoryEvictionTrigger <= 0.5 || memoryEvictionTrigger > 1.0) {
            throw new IllegalArgumentException("memoryEvictionTrigger must be in (0.5, 1.0]");
        }
        if (sweepInterval.isNegative() || sweepInterval.isZero()) {
            throw new IllegalArgumentException("sweepInterval must be positive");
        }
        if (cacheDirectory.equals(thumbnailsDirectory)) {
            throw new IllegalArgumentException("thumbnailsDirectory must differ from cacheDirectory");
        }
    }

    public static CacheConfig defaults(Path root) {
        return new CacheConfig(
            root.resolve("cache"),
            root.resolve("thumbnail"),
            DEFAULT_MAX_MEMORY,
            DEFAULT_MAX_DISK,
            DEFAULT_EVICTION_TRIGGER,
            DEFAULT_SWEEP_INTERVAL
        );
    }

    public CacheConfig withMaxMemoryBytes(long maxMemoryBytes) {
        return new CacheConfig(cacheDirectory, thumbnailsDirectory, maxMemoryBytes, maxDiskBytes, memoryEvictionTrigger, sweepInterval);
    }

    public CacheConfig withMaxDiskBytes(long maxDiskBytes) {
        return new CacheConfig(cacheDirectory, thumbnailsDirectory, maxMemoryBytes, maxDiskBytes, memoryEvictionTrigger, sweepInterval);
    }

    public CacheConfig withMemoryEvictionTrigger(double memoryEvictionTrigger) {
        return new CacheConfig(cacheDirectory, thumbnailsDirectory, maxMemoryBytes, maxDiskBytes, memoryEvictionTrigger, sweepInterval);
    }

    public CacheConfig withSweepInterval(Duration sweepInterval) {
        return new CacheConfig(cacheDirectory, thumbnailsDirectory, maxMemoryBytes, maxDiskBytes, memoryEvictionTrigger, sweepInterval);
    }
}
