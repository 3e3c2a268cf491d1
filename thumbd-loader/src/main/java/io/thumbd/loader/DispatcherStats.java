package io.thumbd.loader;

public record DispatcherStats(
    int active,
    int pending,
    int maxConcurrent,
    int baseMaxConcurrent,
    long loadedCount,
    long cancelCount,
    long failedCount,
    double avgLoadMs
) {}
