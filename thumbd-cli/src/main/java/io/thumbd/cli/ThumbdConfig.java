package io.thumbd.cli;

import io.thumbd.cache.CacheConfig;
import io.thumbd.loader.DispatcherConfig;
import io.thumbd.loader.schedule.SchedulerConfig;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Properties;

/**
 * Settings for a command-line session, read from a {@code .properties} file.
 *
 * <p>Recognized keys: {@code thumbd.cache.dir}, {@code thumbd.thumbnails.dir},
 * {@code thumbd.cache.disk.max-mb}, {@code thumbd.cache.memory.max-mb} and
 * {@code thumbd.loader.max-concurrent}. Missing keys keep their defaults.
 */
public record ThumbdConfig(
    CacheConfig cache,
    DispatcherConfig dispatcher,
    SchedulerConfig scheduler
) {

    public static final String CACHE_DIR = "thumbd.cache.dir";
    public static final String THUMBNAILS_DIR = "thumbd.thumbnails.dir";
    public static final String DISK_MAX_MB = "thumbd.cache.disk.max-mb";
    public static final String MEMORY_MAX_MB = "thumbd.cache.memory.max-mb";
    public static final String MAX_CONCURRENT = "thumbd.loader.max-concurrent";

    private static final long MB = 1024 * 1024;

    public ThumbdConfig {
        Objects.requireNonNull(cache, "cache");
        Objects.requireNonNull(dispatcher, "dispatcher");
        Objects.requireNonNull(scheduler, "scheduler");
    }

    public static Path defaultRoot() {
        return Path.of(System.getProperty("user.home"), ".thumbd");
    }

    public static ThumbdConfig defaults(Path root) {
        return new ThumbdConfig(CacheConfig.defaults(root), DispatcherConfig.defaults(), SchedulerConfig.defaults());
    }

    public static ThumbdConfig load(Path file, Path root) throws IOException {
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            properties.load(reader);
        }
        return fromProperties(properties, root);
    }

    public static ThumbdConfig fromProperties(Properties properties, Path root) {
        CacheConfig defaults = CacheConfig.defaults(root);

        Path cacheDir = pathValue(properties, CACHE_DIR, defaults.cacheDirectory());
        Path thumbnailsDir = pathValue(properties, THUMBNAILS_DIR, defaults.thumbnailsDirectory());
        long diskBytes = longValue(properties, DISK_MAX_MB, defaults.maxDiskBytes() / MB) * MB;
        long memoryBytes = longValue(properties, MEMORY_MAX_MB, defaults.maxMemoryBytes() / MB) * MB;
        int maxConcurrent = (int) longValue(properties, MAX_CONCURRENT, DispatcherConfig.DEFAULT_MAX_CONCURRENT);

        CacheConfig cache = new CacheConfig(
            cacheDir,
            thumbnailsDir,
            memoryBytes,
            diskBytes,
            defaults.memoryEvictionTrigger(),
            defaults.sweepInterval()
        );
        DispatcherConfig dispatcher = DispatcherConfig.defaults().withBaseMaxConcurrent(maxConcurrent);
        return new ThumbdConfig(cache, dispatcher, SchedulerConfig.defaults());
    }

    private static Path pathValue(Properties properties, String key, Path fallback) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return Path.of(value.trim());
    }

    private static long longValue(Properties properties, String key, long fallback) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a valid integer, got: " + value);
        }
    }
}
