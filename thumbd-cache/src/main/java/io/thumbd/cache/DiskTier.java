package io.thumbd.cache;

import io.thumbd.common.CacheKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

final class DiskTier {

    private static final Logger log = LoggerFactory.getLogger(DiskTier.class);

    static final String EXTENSION = ".cache";
    private static final String TEMP_SUFFIX = ".tmp";
    private static final double SWEEP_TARGET_RATIO = 0.8;

    record SweepResult(int deletedFiles, long freedBytes, long remainingBytes) {}

    private record FileInfo(Path path, long modifiedMillis, long size) {}

    private final Path directory;
    private final ReentrantLock lock = new ReentrantLock();

    private volatile long maxBytes;
    private long sizeBytes;

    private DiskTier(Path directory, long maxBytes, long sizeBytes) {
        this.directory = directory;
        this.maxBytes = maxBytes;
        this.sizeBytes = sizeBytes;
    }

    static DiskTier open(Path directory, long maxBytes) throws IOException {
        Files.createDirectories(directory);
        DiskTier tier = new DiskTier(directory, maxBytes, 0);
        tier.deleteStaleTempFiles();
        tier.lock.lock();
        try {
            tier.sizeBytes = tier.listEntries().stream().mapToLong(FileInfo::size).sum();
        } finally {
            tier.lock.unlock();
        }
        return tier;
    }

    Optional<byte[]> get(CacheKey key) {
        Path path = pathOf(key);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        byte[] data;
        try {
            data = Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            log.atWarn()
                .addKeyValue("key", key)
                .addKeyValue("error", e.getMessage())
                .log("Unreadable disk cache entry, deleting");
            remove(key);
            return Optional.empty();
        }
        touch(path);
        return Optional.of(data);
    }

    boolean put(CacheKey key, byte[] data) {
        if (data.length > maxBytes) {
            log.atDebug()
                .addKeyValue("key", key)
                .addKeyValue("bytes", data.length)
                .log("Entry larger than disk cache, not stored");
            return false;
        }

        Path path = pathOf(key);
        Path temp = directory.resolve(key.fileName(EXTENSION + TEMP_SUFFIX));
        try {
            Files.write(temp, data);

            lock.lock();
            try {
                long cap = maxBytes;
                if (sizeBytes - sizeOf(path) + data.length > cap) {
                    sweepLocked(Math.min((long) (cap * SWEEP_TARGET_RATIO), cap - data.length));
                }
                long previous = sizeOf(path);
                if (sizeBytes - previous + data.length > cap) {
                    log.atWarn()
                        .addKeyValue("key", key)
                        .addKeyValue("bytes", data.length)
                        .addKeyValue("diskBytes", sizeBytes)
                        .log("Disk cache could not free enough space, entry not stored");
                    deleteQuietly(temp);
                    return false;
                }
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                sizeBytes += data.length - previous;
            } finally {
                lock.unlock();
            }
            return true;
        } catch (IOException e) {
            log.atWarn()
                .addKeyValue("key", key)
                .setCause(e)
                .log("Failed to write disk cache entry");
            deleteQuietly(temp);
            return false;
        }
    }

    boolean remove(CacheKey key) {
        Path path = pathOf(key);
        lock.lock();
        try {
            long size = sizeOf(path);
            if (Files.deleteIfExists(path)) {
                sizeBytes = Math.max(0, sizeBytes - size);
                return true;
            }
            return false;
        } catch (IOException e) {
            log.atWarn()
                .addKeyValue("key", key)
                .addKeyValue("error", e.getMessage())
                .log("Failed to delete disk cache entry");
            return false;
        } finally {
            lock.unlock();
        }
    }

    SweepResult sweep() {
        lock.lock();
        try {
            return sweepLocked((long) (maxBytes * SWEEP_TARGET_RATIO));
        } finally {
            lock.unlock();
        }
    }

    // Caller holds the lock. Deletes oldest entries until at most targetBytes remain.
    private SweepResult sweepLocked(long targetBytes) {
        List<FileInfo> files = listEntries();
        files.sort(Comparator.comparingLong(FileInfo::modifiedMillis)
            .thenComparing(f -> f.path().getFileName().toString()));

        long total = files.stream().mapToLong(FileInfo::size).sum();
        int deleted = 0;
        long freed = 0;

        for (FileInfo file : files) {
            if (total <= targetBytes) {
                break;
            }
            try {
                Files.deleteIfExists(file.path());
                total -= file.size();
                freed += file.size();
                deleted++;
            } catch (IOException e) {
                log.atWarn()
                    .addKeyValue("path", file.path())
                    .addKeyValue("error", e.getMessage())
                    .log("Failed to evict disk cache entry");
            }
        }

        sizeBytes = total;
        return new SweepResult(deleted, freed, total);
    }

    void clear() {
        lock.lock();
        try {
            for (FileInfo file : listEntries()) {
                try {
                    Files.deleteIfExists(file.path());
                } catch (IOException e) {
                    log.atWarn()
                        .addKeyValue("path", file.path())
                        .addKeyValue("error", e.getMessage())
                        .log("Failed to delete disk cache entry");
                }
            }
            sizeBytes = listEntries().stream().mapToLong(FileInfo::size).sum();
        } finally {
            lock.unlock();
        }
    }

    void resize(long newMaxBytes) {
        this.maxBytes = newMaxBytes;
    }

    long maxSizeInBytes() {
        return maxBytes;
    }

    long sizeInBytes() {
        lock.lock();
        try {
            return sizeBytes;
        } finally {
            lock.unlock();
        }
    }

    int entryCount() {
        lock.lock();
        try {
            return listEntries().size();
        } finally {
            lock.unlock();
        }
    }

    Path pathOf(CacheKey key) {
        return directory.resolve(key.fileName(EXTENSION));
    }

    private List<FileInfo> listEntries() {
        List<FileInfo> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + EXTENSION)) {
            for (Path path : stream) {
                try {
                    BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class);
                    if (!attrs.isRegularFile()) {
                        continue;
                    }
                    files.add(new FileInfo(path, attrs.lastModifiedTime().toMillis(), attrs.size()));
                } catch (IOException e) {
                    log.debug("Skipping unreadable cache file {}: {}", path, e.getMessage());
                }
            }
        } catch (IOException e) {
            log.atWarn()
                .addKeyValue("directory", directory)
                .addKeyValue("error", e.getMessage())
                .log("Failed to list disk cache");
        }
        return files;
    }

    private void deleteStaleTempFiles() {
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + TEMP_SUFFIX)) {
            for (Path path : stream) {
                deleteQuietly(path);
            }
        } catch (IOException e) {
            log.debug("Failed to scan for stale temp files in {}: {}", directory, e.getMessage());
        }
    }

    static boolean touch(Path path) {
        try {
            Files.setLastModifiedTime(path, FileTime.fromMillis(System.currentTimeMillis()));
            return true;
        } catch (IOException e) {
            log.debug("Could not refresh modification time of {}: {}", path, e.getMessage());
            return false;
        }
    }

    private static long sizeOf(Path path) {
        if (!Files.isRegularFile(path)) {
            return 0;
        }
        try {
            return Files.size(path);
        } catch (IOException e) {
            return 0;
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.debug("Failed to delete {}: {}", path, e.getMessage());
        }
    }
}
