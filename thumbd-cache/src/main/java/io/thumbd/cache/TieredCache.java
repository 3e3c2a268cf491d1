package io.thumbd.cache;

import io.thumbd.common.CacheKey;
import io.thumbd.common.TaskScheduler;
import io.thumbd.common.ThumbnailSize;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Memory and disk cache for downloaded images, plus an identity-keyed thumbnail store.
 *
 * <p>The memory tier holds decoded images under base or variant keys. The disk tier holds
 * raw downloaded bytes under base keys only, swept oldest-first by modification time. Disk
 * failures never reach the caller: they are logged and reported as misses.
 */
public final class TieredCache implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TieredCache.class);

    public static final int DEFAULT_THUMBNAIL_QUALITY = 85;

    private final CacheConfig config;
    private final MemoryTier<BufferedImage> memory;
    private final DiskTier disk;
    private final ThumbnailStore thumbnails;
    private final TaskScheduler.Handle sweepTask;
    private final List<CacheListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private TieredCache(
        CacheConfig config,
        MemoryTier<BufferedImage> memory,
        DiskTier disk,
        ThumbnailStore thumbnails,
        TaskScheduler scheduler
    ) {
        this.config = config;
        this.memory = memory;
        this.disk = disk;
        this.thumbnails = thumbnails;
        this.sweepTask = scheduler.scheduleAtFixedRate(this::sweepDisk, config.sweepInterval().toMillis());
    }

    public static TieredCache open(CacheConfig config, TaskScheduler scheduler) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(scheduler, "scheduler");
        try {
            MemoryTier<BufferedImage> memory = new MemoryTier<>(
                config.maxMemoryBytes(),
                config.memoryEvictionTrigger(),
                Images::estimateBytes
            );
            DiskTier disk = DiskTier.open(config.cacheDirectory(), config.maxDiskBytes());
            ThumbnailStore thumbnails = ThumbnailStore.open(config.thumbnailsDirectory());

            TieredCache cache = new TieredCache(config, memory, disk, thumbnails, scheduler);
            log.atInfo()
                .addKeyValue("cacheDirectory", config.cacheDirectory())
                .addKeyValue("diskBytes", disk.sizeInBytes())
                .addKeyValue("maxDiskBytes", config.maxDiskBytes())
                .addKeyValue("maxMemoryBytes", config.maxMemoryBytes())
                .log("Cache opened");
            return cache;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to open cache at " + config.cacheDirectory(), e);
        }
    }

    public CacheKey keyOf(String url) {
        return CacheKey.of(url);
    }

    public CacheKey variantKeyOf(String url, ThumbnailSize size) {
        return CacheKey.variant(url, size);
    }

    public Optional<BufferedImage> getMemory(CacheKey key) {
        return memory.get(key);
    }

    public boolean containsMemory(CacheKey key) {
        return memory.contains(key);
    }

    public boolean putMemory(CacheKey key, BufferedImage image) {
        Objects.requireNonNull(image, "image");
        boolean cached = memory.put(key, image);
        if (!cached) {
            log.atDebug()
                .addKeyValue("key", key)
                .addKeyValue("bytes", Images.estimateBytes(image))
                .log("Image too large for memory cache");
        }
        return cached;
    }

    public Optional<byte[]> getDisk(CacheKey key) {
        return disk.get(key);
    }

    public boolean putDisk(CacheKey key, byte[] data) {
        Objects.requireNonNull(data, "data");
        return disk.put(key, data);
    }

    public boolean removeDisk(CacheKey key) {
        return disk.remove(key);
    }

    public void sweepDisk() {
        DiskTier.SweepResult result = disk.sweep();
        if (result.deletedFiles() > 0) {
            log.atInfo()
                .addKeyValue("deletedFiles", result.deletedFiles())
                .addKeyValue("freedBytes", result.freedBytes())
                .addKeyValue("remainingBytes", result.remainingBytes())
                .log("Disk cache swept");
        }
        fireCacheCleared();
    }

    public Optional<BufferedImage> getThumbnailById(String imageId) {
        return thumbnails.get(imageId);
    }

    public boolean putThumbnailById(String imageId, BufferedImage image) {
        return putThumbnailById(imageId, image, DEFAULT_THUMBNAIL_QUALITY);
    }

    public boolean putThumbnailById(String imageId, BufferedImage image, int quality) {
        Objects.requireNonNull(image, "image");
        if (quality < 1 || quality > 100) {
            throw new IllegalArgumentException("quality must be in [1, 100]");
        }
        return thumbnails.put(imageId, image, quality);
    }

    public boolean hasThumbnail(String imageId) {
        return thumbnails.contains(imageId);
    }

    public int clearThumbnails() {
        return thumbnails.clear();
    }

    public void clearMemory() {
        memory.clear();
    }

    public void clearAll() {
        memory.clear();
        disk.clear();
        log.info("Memory and disk cache cleared");
        fireCacheCleared();
    }

    public void setMaxMemoryBytes(long maxBytes) {
        if (maxBytes < CacheConfig.MIN_SIZE) {
            throw new IllegalArgumentException("maxBytes must be at least 1MB");
        }
        memory.resize(maxBytes);
    }

    public void setMaxDiskBytes(long maxBytes) {
        if (maxBytes < CacheConfig.MIN_SIZE) {
            throw new IllegalArgumentException("maxBytes must be at least 1MB");
        }
        disk.resize(maxBytes);
    }

    public CacheStats stats() {
        return new CacheStats(
            memory.count(),
            memory.sizeInBytes(),
            memory.maxSizeInBytes(),
            disk.entryCount(),
            disk.sizeInBytes(),
            disk.maxSizeInBytes(),
            memory.hits(),
            memory.misses(),
            memory.evictions()
        );
    }

    public CacheConfig config() {
        return config;
    }

    public void addListener(CacheListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(CacheListener listener) {
        listeners.remove(listener);
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        sweepTask.cancel();
        memory.clear();
    }

    private void fireCacheCleared() {
        for (CacheListener listener : listeners) {
            try {
                listener.onCacheCleared();
            } catch (RuntimeException e) {
                log.warn("Cache listener failed", e);
            }
        }
    }
}
