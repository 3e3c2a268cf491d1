package io.thumbd.benchmark;

import io.thumbd.cache.CacheConfig;
import io.thumbd.cache.TieredCache;
import io.thumbd.common.CacheKey;
import io.thumbd.common.ManualTaskScheduler;
import org.openjdk.jmh.annotations.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

@BenchmarkMode({Mode.Throughput, Mode.SampleTime})
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Fork(1)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
public class DiskCacheBenchmark {

    private static final long MB = 1024 * 1024;

    @Param({"32768", "262144"})
    private int entryBytes;

    private Path tempDir;
    private ManualTaskScheduler scheduler;
    private TieredCache cache;
    private CacheKey[] existingKeys;
    private AtomicLong keyCounter;
    private byte[] data;

    @Setup(Level.Trial)
    public void setup() throws IOException {
        tempDir = Files.createTempDirectory("thumbd-disk-bench");
        scheduler = new ManualTaskScheduler();
        cache = TieredCache.open(CacheConfig.defaults(tempDir).withMaxDiskBytes(256 * MB), scheduler);
        existingKeys = new CacheKey[256];
        keyCounter = new AtomicLong();
        data = new byte[entryBytes];
        ThreadLocalRandom.current().nextBytes(data);

        for (int i = 0; i < existingKeys.length; i++) {
            existingKeys[i] = CacheKey.of("https://img.example.org/" + i);
            cache.putDisk(existingKeys[i], data);
        }
    }

    @TearDown(Level.Trial)
    public void tearDown() throws IOException {
        cache.close();
        scheduler.close();
        deleteDirectory(tempDir);
    }

    @Benchmark
    public Optional<byte[]> getExisting() {
        int index = ThreadLocalRandom.current().nextInt(existingKeys.length);
        return cache.getDisk(existingKeys[index]);
    }

    @Benchmark
    public boolean putWithSweep() {
        return cache.putDisk(CacheKey.of("https://img.example.org/new/" + keyCounter.incrementAndGet()), data);
    }

    private static void deleteDirectory(Path dir) throws IOException {
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder())
                .forEach(path -> {
                    try {
                        Files.delete(path);
                    } catch (IOException ignored) {}
                });
        }
    }
}
