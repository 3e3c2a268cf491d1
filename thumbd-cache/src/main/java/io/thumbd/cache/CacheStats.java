package io.thumbd.cache;

public record CacheStats(
    int memoryCount,
    long memoryBytes,
    long maxMemoryBytes,
    int diskCount,
    long diskBytes,
    long maxDiskBytes,
    long hits,
    long misses,
    long evictions
) {

    public double hitRate() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }
}
