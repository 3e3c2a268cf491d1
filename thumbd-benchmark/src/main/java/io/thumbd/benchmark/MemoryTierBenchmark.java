package io.thumbd.benchmark;

import io.thumbd.cache.MemoryTier;
import io.thumbd.common.CacheKey;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Fork(2)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
public class MemoryTierBenchmark {

    private static final long MAX_BYTES = 64L * 1024 * 1024;

    @Param({"1000", "10000"})
    private int entryCount;

    @Param({"16384", "262144"})
    private int entryBytes;

    private MemoryTier<byte[]> populated;
    private MemoryTier<byte[]> churn;
    private CacheKey[] existingKeys;
    private AtomicLong keyCounter;
    private byte[] value;

    @Setup(Level.Trial)
    public void setup() {
        populated = new MemoryTier<>(MAX_BYTES, 0.95, v -> v.length);
        churn = new MemoryTier<>(MAX_BYTES, 0.95, v -> v.length);
        existingKeys = new CacheKey[entryCount];
        keyCounter = new AtomicLong();
        value = new byte[entryBytes];

        for (int i = 0; i < entryCount; i++) {
            CacheKey key = CacheKey.of("https://img.example.org/" + i);
            existingKeys[i] = key;
            populated.put(key, value);
        }
    }

    @Benchmark
    public void putWithEviction() {
        churn.put(CacheKey.of("https://img.example.org/churn/" + keyCounter.incrementAndGet()), value);
    }

    @Benchmark
    public void getRecent(Blackhole bh) {
        int index = entryCount - 1 - ThreadLocalRandom.current().nextInt(Math.min(entryCount, 64));
        bh.consume(populated.get(existingKeys[index]));
    }

    @Benchmark
    public void getRandom(Blackhole bh) {
        int index = ThreadLocalRandom.current().nextInt(entryCount);
        bh.consume(populated.get(existingKeys[index]));
    }

    @Benchmark
    @Threads(4)
    public void getConcurrent(Blackhole bh) {
        int index = ThreadLocalRandom.current().nextInt(entryCount);
        bh.consume(populated.get(existingKeys[index]));
    }
}
