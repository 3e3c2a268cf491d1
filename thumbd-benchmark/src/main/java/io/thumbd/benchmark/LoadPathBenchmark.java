package io.thumbd.benchmark;

import io.thumbd.cache.CacheConfig;
import io.thumbd.cache.TieredCache;
import io.thumbd.common.CacheKey;
import io.thumbd.common.ManualTaskScheduler;
import io.thumbd.common.ThumbnailSize;
import io.thumbd.loader.DispatcherConfig;
import io.thumbd.loader.LoadDispatcher;
import io.thumbd.loader.LoadOutcome;
import io.thumbd.loader.schedule.SchedulerConfig;
import io.thumbd.loader.schedule.ThumbnailScheduler;
import org.openjdk.jmh.annotations.*;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Synchronous cache-hit paths of the dispatcher and scheduler. Misses would hit the network
 * and are not measured.
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Fork(2)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
public class LoadPathBenchmark {

    private static final int URL_COUNT = 200;
    private static final ThumbnailSize SIZE = ThumbnailSize.of(150, 150);

    private Path tempDir;
    private ManualTaskScheduler scheduler;
    private TieredCache cache;
    private LoadDispatcher dispatcher;
    private ThumbnailScheduler thumbnails;
    private String[] urls;

    @Setup(Level.Trial)
    public void setup() throws IOException {
        tempDir = Files.createTempDirectory("thumbd-load-bench");
        scheduler = new ManualTaskScheduler();
        cache = TieredCache.open(CacheConfig.defaults(tempDir), scheduler);
        dispatcher = new LoadDispatcher(
            cache,
            url -> {
                throw new IllegalStateException("Unexpected fetch: " + url);
            },
            scheduler,
            DispatcherConfig.defaults()
        );
        thumbnails = ThumbnailScheduler.create(cache, dispatcher, scheduler, SchedulerConfig.defaults());

        urls = new String[URL_COUNT];
        for (int i = 0; i < URL_COUNT; i++) {
            urls[i] = "https://img.example.org/" + i + ".jpg";
            cache.putMemory(CacheKey.of(urls[i]), new BufferedImage(600, 400, BufferedImage.TYPE_INT_RGB));
        }
        for (String url : urls) {
            thumbnails.loadThumbnail(url, SIZE);
        }
    }

    @TearDown(Level.Trial)
    public void tearDown() throws IOException {
        thumbnails.close();
        dispatcher.close();
        cache.close();
        scheduler.close();
        try (Stream<Path> paths = Files.walk(tempDir)) {
            paths.sorted(Comparator.reverseOrder())
                .forEach(path -> {
                    try {
                        Files.delete(path);
                    } catch (IOException ignored) {}
                });
        }
    }

    @Benchmark
    public LoadOutcome dispatcherVariantHit() {
        return dispatcher.load(urls[ThreadLocalRandom.current().nextInt(URL_COUNT)], SIZE);
    }

    @Benchmark
    public boolean schedulerVariantHit() {
        return thumbnails.loadThumbnail(urls[ThreadLocalRandom.current().nextInt(URL_COUNT)], SIZE);
    }
}
