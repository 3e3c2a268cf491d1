package io.thumbd.loader.schedule;

import io.thumbd.cache.CacheConfig;
import io.thumbd.cache.TieredCache;
import io.thumbd.common.CacheKey;
import io.thumbd.common.ManualTaskScheduler;
import io.thumbd.common.ThumbnailSize;
import io.thumbd.loader.DispatcherConfig;
import io.thumbd.loader.FakeFetcher;
import io.thumbd.loader.ImageFetcher;
import io.thumbd.loader.LoadDispatcher;
import io.thumbd.loader.RecordingListener;
import io.thumbd.loader.TestImages;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.*;

class ThumbnailSchedulerTest {

    private static final ThumbnailSize SIZE = ThumbnailSize.of(150, 150);

    @TempDir
    Path tempDir;

    private ManualTaskScheduler clock;
    private TieredCache cache;
    private LoadDispatcher dispatcher;
    private ThumbnailScheduler thumbnails;
    private RecordingListener listener;

    @BeforeEach
    void setUp() {
        clock = new ManualTaskScheduler();
        cache = TieredCache.open(CacheConfig.defaults(tempDir), clock);
        listener = new RecordingListener();
    }

    @AfterEach
    void tearDown() {
        if (thumbnails != null) {
            thumbnails.close();
        }
        if (dispatcher != null) {
            dispatcher.close();
        }
        cache.close();
    }

    private void start(ImageFetcher fetcher) {
        start(fetcher, DispatcherConfig.defaults());
    }

    private void start(ImageFetcher fetcher, DispatcherConfig config) {
        dispatcher = new LoadDispatcher(cache, fetcher, clock, config);
        thumbnails = ThumbnailScheduler.create(cache, dispatcher, clock, SchedulerConfig.defaults());
        thumbnails.addListener(listener);
    }

    private static String url(int i) {
        return "https://img.example.org/" + i + ".png";
    }

    private static List<String> urls(int from, int to) {
        List<String> urls = new ArrayList<>();
        for (int i = from; i < to; i++) {
            urls.add(url(i));
        }
        return urls;
    }

    private void cacheBase(List<String> urls) {
        for (String u : urls) {
            cache.putMemory(CacheKey.of(u), TestImages.image(300, 200));
        }
    }

    @Nested
    class LoadThumbnail {

        @Test
        void variantHitReturnsImmediately() {
            start(new FakeFetcher(TestImages.png(10, 10)));
            cache.putMemory(CacheKey.variant(url(1), SIZE), TestImages.image(150, 100));

            assertThat(thumbnails.loadThumbnail(url(1), SIZE)).isTrue();

            assertThat(listener.loaded).singleElement()
                .satisfies(event -> assertThat(event.size()).isEqualTo(SIZE));
            assertThat(thumbnails.getCacheStats().cacheHits()).isEqualTo(1);
        }

        @Test
        void baseHitIsRescaledAndCached() {
            FakeFetcher fetcher = new FakeFetcher(TestImages.png(10, 10));
            start(fetcher);
            cacheBase(List.of(url(1)));

            assertThat(thumbnails.loadThumbnail(url(1), SIZE)).isTrue();

            assertThat(listener.loaded).singleElement().satisfies(event -> {
                assertThat(event.image().getWidth()).isEqualTo(150);
                assertThat(event.image().getHeight()).isEqualTo(100);
            });
            assertThat(cache.containsMemory(CacheKey.variant(url(1), SIZE))).isTrue();
            assertThat(fetcher.calls()).isZero();
        }

        @Test
        void missIsHandedToDispatcher() throws InterruptedException {
            start(new FakeFetcher(TestImages.png(300, 300)));

            assertThat(thumbnails.loadThumbnail(url(1), SIZE, true)).isFalse();

            assertThat(listener.awaitEvents(1)).isTrue();
            assertThat(listener.loaded).singleElement()
                .satisfies(event -> assertThat(event.image().getWidth()).isEqualTo(150));
            SchedulerStats stats = thumbnails.getCacheStats();
            assertThat(stats.cacheMisses()).isEqualTo(1);
            assertThat(stats.preloadHits()).isZero();
        }

        @Test
        void nonPriorityCompletionCountsAsPreloadHit() throws InterruptedException {
            start(new FakeFetcher(TestImages.png(30, 30)));

            thumbnails.loadThumbnail(url(1), SIZE, false);

            assertThat(listener.awaitEvents(1)).isTrue();
            assertThat(thumbnails.getCacheStats().preloadHits()).isEqualTo(1);
        }

        @Test
        void backToBackLoadsFetchOnce() throws InterruptedException {
            FakeFetcher fetcher = FakeFetcher.gated(TestImages.png(300, 300));
            start(fetcher);

            assertThat(thumbnails.loadThumbnail(url(1), SIZE)).isFalse();
            assertThat(thumbnails.loadThumbnail(url(1), SIZE)).isFalse();
            fetcher.release();

            assertThat(listener.awaitEvents(1)).isTrue();
            assertThat(fetcher.awaitFinished(1)).isTrue();
            assertThat(fetcher.calls(url(1))).isEqualTo(1);
        }

        @Test
        void hitRateIsHitsOverRequests() {
            start(new FakeFetcher(TestImages.png(10, 10)));
            cacheBase(urls(0, 3));

            for (String u : urls(0, 4)) {
                thumbnails.loadThumbnail(u, SIZE);
            }

            assertThat(thumbnails.getCacheStats().hitRate()).isEqualTo(0.75);
        }
    }

    @Nested
    class States {

        @Test
        void cacheHitGoesStraightToLoaded() {
            start(new FakeFetcher(TestImages.png(10, 10)));
            cacheBase(List.of(url(1)));
            assertThat(thumbnails.stateOf(url(1), SIZE)).isEqualTo(LoadState.PLACEHOLDER);

            thumbnails.loadThumbnail(url(1), SIZE);

            assertThat(thumbnails.stateOf(url(1), SIZE)).isEqualTo(LoadState.LOADED);
        }

        @Test
        void missMovesThroughLoading() throws InterruptedException {
            FakeFetcher fetcher = FakeFetcher.gated(TestImages.png(300, 300));
            start(fetcher);

            thumbnails.loadThumbnail(url(1), SIZE);
            assertThat(thumbnails.stateOf(url(1), SIZE)).isEqualTo(LoadState.LOADING);

            fetcher.release();
            assertThat(listener.awaitEvents(1)).isTrue();
            assertThat(thumbnails.stateOf(url(1), SIZE)).isEqualTo(LoadState.LOADED);
        }

        @Test
        void failureEndsInError() throws InterruptedException {
            start(new FakeFetcher(TestImages.png(10, 10)).fail(url(1)));

            thumbnails.loadThumbnail(url(1), SIZE);

            assertThat(listener.awaitEvents(1)).isTrue();
            assertThat(listener.failed).hasSize(1);
            assertThat(thumbnails.stateOf(url(1), SIZE)).isEqualTo(LoadState.ERROR);
        }

        @Test
        void clearPreloadQueueForgetsErrors() throws InterruptedException {
            start(new FakeFetcher(TestImages.png(10, 10)).fail(url(1)));
            thumbnails.loadThumbnail(url(1), SIZE);
            assertThat(listener.awaitEvents(1)).isTrue();
            assertThat(thumbnails.stateOf(url(1), SIZE)).isEqualTo(LoadState.ERROR);

            thumbnails.clearPreloadQueue();

            assertThat(thumbnails.stateOf(url(1), SIZE)).isEqualTo(LoadState.PLACEHOLDER);
        }

        @Test
        void errorStatesAreBounded() throws InterruptedException {
            start(new FakeFetcher(new byte[] {1, 2, 3}));
            int failures = ThumbnailScheduler.MAX_ERROR_STATES + 10;

            for (int i = 0; i < failures; i++) {
                thumbnails.loadThumbnail(url(i), SIZE);
                assertThat(listener.awaitEvents(1)).isTrue();
                clock.advance(30);
            }

            assertThat(listener.failed).hasSize(failures);
            for (int i = 0; i < 10; i++) {
                assertThat(thumbnails.stateOf(url(i), SIZE)).isEqualTo(LoadState.PLACEHOLDER);
            }
            for (int i = 10; i < failures; i++) {
                assertThat(thumbnails.stateOf(url(i), SIZE)).isEqualTo(LoadState.ERROR);
            }
        }

        @Test
        void cancelAllResetsLoadingToPlaceholder() throws InterruptedException {
            FakeFetcher fetcher = FakeFetcher.gated(TestImages.png(10, 10));
            start(fetcher);
            thumbnails.loadThumbnail(url(1), SIZE);
            thumbnails.preloadThumbnails(urls(10, 15), SIZE);

            thumbnails.cancelAll();

            assertThat(thumbnails.stateOf(url(1), SIZE)).isEqualTo(LoadState.PLACEHOLDER);
            SchedulerStats stats = thumbnails.getCacheStats();
            assertThat(stats.preloadQueueSize()).isZero();
            assertThat(stats.dispatcher().active()).isZero();
            assertThat(listener.cancelled).containsExactly(url(1));
        }
    }

    @Nested
    class Preload {

        @Test
        void partitionsByCacheState() {
            FakeFetcher fetcher = FakeFetcher.gated(TestImages.png(300, 300));
            start(fetcher);
            List<String> all = urls(0, 100);
            cacheBase(all.subList(0, 80));

            thumbnails.preloadThumbnails(all, SIZE);

            SchedulerStats stats = thumbnails.getCacheStats();
            assertThat(stats.variantQueueSize()).isEqualTo(80);
            assertThat(stats.preloadQueueSize()).isEqualTo(20);
            assertThat(fetcher.calls()).isZero();
        }

        @Test
        void variantQueueRescalesWithoutNetwork() {
            FakeFetcher fetcher = new FakeFetcher(TestImages.png(300, 300));
            start(fetcher);
            List<String> all = urls(0, 100);
            List<String> based = all.subList(0, 80);
            cacheBase(based);

            thumbnails.preloadThumbnails(all, SIZE);
            clock.advance(200);
            assertThat(thumbnails.getCacheStats().variantQueueSize()).isEqualTo(76);

            clock.advance(200 * 19);

            assertThat(thumbnails.getCacheStats().variantQueueSize()).isZero();
            for (String u : based) {
                assertThat(cache.containsMemory(CacheKey.variant(u, SIZE))).isTrue();
            }
            assertThat(fetcher.fetchedUrls()).doesNotContainAnyElementsOf(based);
        }

        @Test
        void variantCachedEntriesAreSkipped() {
            start(new FakeFetcher(TestImages.png(10, 10)));
            cache.putMemory(CacheKey.variant(url(1), SIZE), TestImages.image(150, 100));

            thumbnails.preloadThumbnails(List.of(url(1)), SIZE);

            SchedulerStats stats = thumbnails.getCacheStats();
            assertThat(stats.variantQueueSize()).isZero();
            assertThat(stats.preloadQueueSize()).isZero();
        }

        @Test
        void duplicatesAreQueuedOnce() {
            start(FakeFetcher.gated(TestImages.png(10, 10)));

            thumbnails.preloadThumbnails(urls(0, 5), SIZE);
            thumbnails.preloadThumbnails(urls(0, 5), SIZE);

            assertThat(thumbnails.getCacheStats().preloadQueueSize()).isEqualTo(5);
        }

        @Test
        void variantWithEvictedBaseMovesToPreloadQueue() {
            start(FakeFetcher.gated(TestImages.png(10, 10)));
            cacheBase(List.of(url(1)));
            thumbnails.preloadThumbnails(List.of(url(1)), SIZE);

            cache.clearMemory();
            clock.advance(200);

            SchedulerStats stats = thumbnails.getCacheStats();
            assertThat(stats.variantQueueSize()).isZero();
            assertThat(stats.preloadQueueSize()).isEqualTo(1);
        }

        @Test
        void lowHitRateReservesHalfTheSlots() {
            start(FakeFetcher.gated(TestImages.png(10, 10)));

            thumbnails.preloadThumbnails(urls(0, 10), SIZE);
            clock.advance(500);

            // 5 free slots, 2 reserved
            assertThat(thumbnails.getCacheStats().preloadQueueSize()).isEqualTo(7);
            assertThat(thumbnails.preloadDelayMillis()).isEqualTo(400);

            clock.advance(400);

            // 3 active, 2 free, 1 reserved
            assertThat(thumbnails.getCacheStats().preloadQueueSize()).isEqualTo(6);
            assertThat(thumbnails.preloadDelayMillis()).isEqualTo(300);
        }

        @Test
        void highHitRateReservesFewerSlots() {
            start(FakeFetcher.gated(TestImages.png(10, 10)));
            List<String> warm = urls(100, 105);
            cacheBase(warm);
            for (String u : warm) {
                thumbnails.loadThumbnail(u, SIZE);
            }

            thumbnails.preloadThumbnails(urls(0, 10), SIZE);
            clock.advance(500);

            // 5 free slots, 1 reserved
            assertThat(thumbnails.getCacheStats().preloadQueueSize()).isEqualTo(6);
        }

        @Test
        void backlogDefersPreloadTick() {
            FakeFetcher fetcher = FakeFetcher.gated(TestImages.png(10, 10));
            start(fetcher, DispatcherConfig.defaults().withMinLaunchInterval(Duration.ofSeconds(5)));
            for (String u : urls(100, 110)) {
                thumbnails.loadThumbnail(u, SIZE, true);
            }

            thumbnails.preloadThumbnails(urls(0, 3), SIZE);
            clock.advance(500);

            assertThat(thumbnails.getCacheStats().preloadQueueSize()).isEqualTo(3);
            assertThat(thumbnails.preloadDelayMillis()).isEqualTo(500);
        }

        @Test
        void slowLoadsStretchTheDelay() throws InterruptedException {
            FakeFetcher fetcher = FakeFetcher.gated(TestImages.png(10, 10));
            start(fetcher);
            thumbnails.loadThumbnail(url(100), SIZE);
            assertThat(fetcher.awaitStarted(1)).isTrue();
            clock.advance(2000);
            fetcher.release();
            assertThat(listener.awaitEvents(1)).isTrue();
            for (int i = 0; i < 6; i++) {
                thumbnails.updateStats();
            }
            assertThat(thumbnails.getCacheStats().smoothedLoadMs()).isGreaterThan(700.0);

            thumbnails.preloadThumbnails(urls(0, 10), SIZE);
            clock.advance(500);

            assertThat(thumbnails.preloadDelayMillis()).isEqualTo(700);
        }

        @Test
        void pauseSuppressesPreloadTicks() {
            FakeFetcher fetcher = FakeFetcher.gated(TestImages.png(10, 10));
            start(fetcher);
            thumbnails.preloadThumbnails(urls(0, 5), SIZE);

            thumbnails.setPaused(true);
            clock.advance(3000);

            assertThat(thumbnails.getCacheStats().preloadQueueSize()).isEqualTo(5);
            assertThat(fetcher.calls()).isZero();
            assertThat(thumbnails.getCacheStats().paused()).isTrue();

            thumbnails.setPaused(false);
            clock.advance(500);

            assertThat(thumbnails.getCacheStats().preloadQueueSize()).isEqualTo(2);
        }

        @Test
        void pauseDoesNotAffectPriorityLoads() throws InterruptedException {
            start(new FakeFetcher(TestImages.png(300, 300)));
            thumbnails.setPaused(true);

            thumbnails.loadThumbnail(url(1), SIZE, true);

            assertThat(listener.awaitEvents(1)).isTrue();
            assertThat(listener.loaded).hasSize(1);
        }

        @Test
        void clearPreloadQueueDropsBothQueues() {
            start(FakeFetcher.gated(TestImages.png(10, 10)));
            cacheBase(urls(0, 3));
            thumbnails.preloadThumbnails(urls(0, 10), SIZE);

            thumbnails.clearPreloadQueue();
            clock.advance(2000);

            SchedulerStats stats = thumbnails.getCacheStats();
            assertThat(stats.preloadQueueSize()).isZero();
            assertThat(stats.variantQueueSize()).isZero();
            assertThat(stats.dispatcher().active()).isZero();
        }
    }

    @Nested
    class AdaptiveConcurrency {

        @Test
        void backlogShrinksPoolOneStepPerTick() {
            FakeFetcher fetcher = FakeFetcher.gated(TestImages.png(10, 10));
            start(fetcher);
            for (String u : urls(0, 30)) {
                thumbnails.loadThumbnail(u, SIZE, true);
            }

            clock.advance(500);
            assertThat(dispatcher.getMaxConcurrent()).isEqualTo(4);

            clock.advance(500);
            assertThat(dispatcher.getMaxConcurrent()).isEqualTo(3);

            clock.advance(500);
            assertThat(dispatcher.getMaxConcurrent()).isEqualTo(2);

            clock.advance(500);
            assertThat(dispatcher.getMaxConcurrent()).isEqualTo(2);
        }

        @Test
        void highHitRateGrowsPoolBackToBase() {
            start(new FakeFetcher(TestImages.png(10, 10)));
            dispatcher.setMaxConcurrent(2);
            List<String> warm = urls(0, 10);
            cacheBase(warm);
            for (String u : warm) {
                thumbnails.loadThumbnail(u, SIZE);
            }
            assertThat(dispatcher.getMaxConcurrent()).isEqualTo(2);

            clock.advance(500);
            assertThat(dispatcher.getMaxConcurrent()).isEqualTo(3);

            clock.advance(500);
            assertThat(dispatcher.getMaxConcurrent()).isEqualTo(4);

            clock.advance(500);
            assertThat(dispatcher.getMaxConcurrent()).isEqualTo(5);

            clock.advance(500);
            assertThat(dispatcher.getMaxConcurrent()).isEqualTo(5);
        }

        @Test
        void controllerRunsAtMostOncePerInterval() {
            FakeFetcher fetcher = FakeFetcher.gated(TestImages.png(10, 10));
            start(fetcher, DispatcherConfig.defaults().withMinLaunchInterval(Duration.ofSeconds(5)));
            for (String u : urls(0, 10)) {
                thumbnails.loadThumbnail(u, SIZE, true);
            }
            clock.advance(500);
            int afterTick = dispatcher.getMaxConcurrent();

            for (int i = 0; i < 5; i++) {
                thumbnails.updateStats();
            }

            assertThat(afterTick).isEqualTo(4);
            assertThat(dispatcher.getMaxConcurrent()).isEqualTo(afterTick);
        }
    }

    @Test
    void statsListenerSeesEveryRecompute() {
        start(new FakeFetcher(TestImages.png(10, 10)));
        List<SchedulerStats> seen = new CopyOnWriteArrayList<>();
        thumbnails.addStatsListener(seen::add);
        cacheBase(urls(0, 2));

        thumbnails.loadThumbnail(url(0), SIZE);
        thumbnails.loadThumbnail(url(1), SIZE);

        assertThat(seen).hasSize(2);
        assertThat(seen.get(1).totalRequests()).isEqualTo(2);
        assertThat(seen.get(1).smoothedHitRate()).isCloseTo(0.36, within(1e-9));
    }

    @Test
    void closedSchedulerRejectsLoads() {
        start(new FakeFetcher(TestImages.png(10, 10)));
        thumbnails.close();

        assertThatThrownBy(() -> thumbnails.loadThumbnail(url(1), SIZE))
            .isInstanceOf(IllegalStateException.class);
    }
}
