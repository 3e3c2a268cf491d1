package io.thumbd.loader.schedule;

import io.thumbd.cache.TieredCache;
import io.thumbd.common.CacheKey;
import io.thumbd.common.TaskScheduler;
import io.thumbd.common.ThumbnailSize;
import io.thumbd.loader.DispatcherStats;
import io.thumbd.loader.ImageScaler;
import io.thumbd.loader.LoadDispatcher;
import io.thumbd.loader.LoadListener;
import io.thumbd.loader.LoadOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Front end for grid thumbnails: synchronous cache fast path, background preload and
 * variant queues, and an adaptive controller around the dispatcher's pool size.
 *
 * <p>The preload queue needs network fetches and only uses the dispatcher slots left after
 * reserving a share for priority loads. The variant queue only rescales base images that are
 * already in memory and never touches the dispatcher.
 */
public final class ThumbnailScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ThumbnailScheduler.class);

    static final double LOW_HIT_RATE = 0.4;
    static final double HIGH_LATENCY_MS = 600.0;
    static final double BACKOFF_LATENCY_MS = 700.0;
    static final int BACKOFF_PENDING = 10;
    static final double LOW_RESERVE_RATIO = 0.3;
    static final double HIGH_RESERVE_RATIO = 0.5;
    static final int MAX_ERROR_STATES = 256;

    private record Request(String url, ThumbnailSize size) {}

    private final TieredCache cache;
    private final LoadDispatcher dispatcher;
    private final TaskScheduler scheduler;
    private final SchedulerConfig config;
    private final Executor callbackExecutor;
    private final List<LoadListener> listeners = new CopyOnWriteArrayList<>();
    private final List<StatsListener> statsListeners = new CopyOnWriteArrayList<>();
    private final LoadListener dispatcherListener = new DispatcherEvents();

    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashSet<Request> preloadQueue = new LinkedHashSet<>();
    private final LinkedHashSet<Request> variantQueue = new LinkedHashSet<>();
    private final Set<String> priorityUrls = new HashSet<>();
    private final Map<Request, LoadState> states = new LinkedHashMap<>();
    private final ExponentialAverage smoothedHitRate;
    private final ExponentialAverage smoothedLoadMs;
    private final ConcurrencyController controller;
    private long totalRequests;
    private long cacheHits;
    private long cacheMisses;
    private long preloadHits;
    private long preloadDelayMillis;
    private TaskScheduler.Handle preloadTimer;
    private TaskScheduler.Handle variantTimer;
    private TaskScheduler.Handle controllerTask;
    private boolean paused;
    private boolean closed;

    private ThumbnailScheduler(
        TieredCache cache,
        LoadDispatcher dispatcher,
        TaskScheduler scheduler,
        SchedulerConfig config,
        Executor callbackExecutor
    ) {
        this.cache = Objects.requireNonNull(cache, "cache");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.config = Objects.requireNonNull(config, "config");
        this.callbackExecutor = Objects.requireNonNull(callbackExecutor, "callbackExecutor");
        this.smoothedHitRate = new ExponentialAverage(config.emaAlpha());
        this.smoothedLoadMs = new ExponentialAverage(config.emaAlpha());
        this.controller = new ConcurrencyController(config.controllerInterval().toMillis());
        this.preloadDelayMillis = config.preloadInitialDelay().toMillis();
    }

    public static ThumbnailScheduler create(
        TieredCache cache,
        LoadDispatcher dispatcher,
        TaskScheduler scheduler,
        SchedulerConfig config,
        Executor callbackExecutor
    ) {
        ThumbnailScheduler thumbnails = new ThumbnailScheduler(cache, dispatcher, scheduler, config, callbackExecutor);
        dispatcher.addListener(thumbnails.dispatcherListener);
        thumbnails.controllerTask = scheduler.scheduleAtFixedRate(
            thumbnails::updateStats,
            config.controllerInterval().toMillis()
        );
        return thumbnails;
    }

    public static ThumbnailScheduler create(
        TieredCache cache,
        LoadDispatcher dispatcher,
        TaskScheduler scheduler,
        SchedulerConfig config
    ) {
        return create(cache, dispatcher, scheduler, config, Runnable::run);
    }

    public void addListener(LoadListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(LoadListener listener) {
        listeners.remove(listener);
    }

    public void addStatsListener(StatsListener listener) {
        statsListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeStatsListener(StatsListener listener) {
        statsListeners.remove(listener);
    }

    /**
     * Resolves a thumbnail from memory when possible, otherwise hands it to the dispatcher.
     *
     * @return {@code true} only when the thumbnail was served synchronously from cache
     */
    public boolean loadThumbnail(String url, ThumbnailSize size, boolean priority) {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(size, "size");
        Request request = new Request(url, size);

        Optional<BufferedImage> hit = resolveFromMemory(url, size);

        lock.lock();
        try {
            if (closed) {
                throw new IllegalStateException("Scheduler is closed");
            }
            totalRequests++;
            if (hit.isPresent()) {
                cacheHits++;
                states.remove(request);
            } else {
                cacheMisses++;
                if (priority) {
                    priorityUrls.add(url);
                }
                states.put(request, LoadState.LOADING);
            }
        } finally {
            lock.unlock();
        }

        if (hit.isPresent()) {
            BufferedImage image = hit.get();
            callbackExecutor.execute(() -> fireLoaded(url, size, image));
            updateStats();
            return true;
        }

        dispatcher.load(url, size);
        updateStats();
        return false;
    }

    public boolean loadThumbnail(String url, ThumbnailSize size) {
        return loadThumbnail(url, size, false);
    }

    /**
     * Queues thumbnails for background loading. Entries already cached at this size are
     * skipped, entries whose original image is in memory only need a rescale, the rest need a
     * network fetch.
     */
    public void preloadThumbnails(List<String> urls, ThumbnailSize size) {
        Objects.requireNonNull(urls, "urls");
        Objects.requireNonNull(size, "size");

        List<Request> rescale = new ArrayList<>();
        List<Request> fetch = new ArrayList<>();
        for (String url : urls) {
            if (cache.containsMemory(CacheKey.variant(url, size))) {
                continue;
            }
            if (cache.containsMemory(CacheKey.of(url))) {
                rescale.add(new Request(url, size));
            } else {
                fetch.add(new Request(url, size));
            }
        }

        lock.lock();
        try {
            if (closed) {
                return;
            }
            variantQueue.addAll(rescale);
            preloadQueue.addAll(fetch);
            if (!preloadQueue.isEmpty()) {
                armPreloadTimer();
            }
            if (!variantQueue.isEmpty()) {
                armVariantTimer();
            }
        } finally {
            lock.unlock();
        }

        log.atDebug()
            .addKeyValue("requested", urls.size())
            .addKeyValue("rescale", rescale.size())
            .addKeyValue("fetch", fetch.size())
            .log("Thumbnails queued for preload");
    }

    public void setPaused(boolean paused) {
        lock.lock();
        try {
            this.paused = paused;
            if (!paused && !preloadQueue.isEmpty()) {
                armPreloadTimer();
            }
        } finally {
            lock.unlock();
        }
    }

    public boolean isPaused() {
        lock.lock();
        try {
            return paused;
        } finally {
            lock.unlock();
        }
    }

    public void clearPreloadQueue() {
        lock.lock();
        try {
            preloadQueue.clear();
            variantQueue.clear();
            cancelTimers();
            states.values().removeIf(state -> state == LoadState.ERROR);
        } finally {
            lock.unlock();
        }
    }

    public void cancelAll() {
        dispatcher.cancelAll();
        lock.lock();
        try {
            preloadQueue.clear();
            variantQueue.clear();
            cancelTimers();
            priorityUrls.clear();
            states.clear();
        } finally {
            lock.unlock();
        }
    }

    public LoadState stateOf(String url, ThumbnailSize size) {
        LoadState recorded;
        lock.lock();
        try {
            recorded = states.get(new Request(url, size));
        } finally {
            lock.unlock();
        }
        if (recorded != null) {
            return recorded;
        }
        return cache.containsMemory(CacheKey.variant(url, size)) ? LoadState.LOADED : LoadState.PLACEHOLDER;
    }

    public SchedulerStats getCacheStats() {
        DispatcherStats loads = dispatcher.stats();
        lock.lock();
        try {
            return snapshot(loads);
        } finally {
            lock.unlock();
        }
    }

    long preloadDelayMillis() {
        lock.lock();
        try {
            return preloadDelayMillis;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            if (controllerTask != null) {
                controllerTask.cancel();
                controllerTask = null;
            }
        } finally {
            lock.unlock();
        }
        cancelAll();
        dispatcher.removeListener(dispatcherListener);
    }

    /**
     * Recomputes the combined statistics, feeds the smoothed averages and lets the
     * concurrency controller adjust the dispatcher when its interval has elapsed.
     */
    void updateStats() {
        DispatcherStats loads = dispatcher.stats();
        SchedulerStats stats;
        int target;

        lock.lock();
        try {
            if (closed) {
                return;
            }
            smoothedHitRate.update((double) cacheHits / Math.max(1, totalRequests));
            smoothedLoadMs.update(loads.avgLoadMs());

            long now = scheduler.nowMillis();
            target = controller.isDue(now)
                ? controller.adjust(now, loads, smoothedHitRate.value())
                : loads.maxConcurrent();
            stats = snapshot(loads);
        } finally {
            lock.unlock();
        }

        if (target != loads.maxConcurrent()) {
            log.atDebug()
                .addKeyValue("from", loads.maxConcurrent())
                .addKeyValue("to", target)
                .addKeyValue("active", loads.active())
                .addKeyValue("pending", loads.pending())
                .log("Adjusting fetch concurrency");
            dispatcher.setMaxConcurrent(target);
        }

        callbackExecutor.execute(() -> {
            for (StatsListener listener : statsListeners) {
                try {
                    listener.onStatsUpdated(stats);
                } catch (RuntimeException e) {
                    log.warn("Stats listener failed", e);
                }
            }
        });
    }

    private Optional<BufferedImage> resolveFromMemory(String url, ThumbnailSize size) {
        CacheKey variantKey = CacheKey.variant(url, size);
        Optional<BufferedImage> variant = cache.getMemory(variantKey);
        if (variant.isPresent()) {
            return variant;
        }
        Optional<BufferedImage> base = cache.getMemory(CacheKey.of(url));
        if (base.isEmpty()) {
            return Optional.empty();
        }
        BufferedImage scaled = ImageScaler.fit(base.get(), size);
        cache.putMemory(variantKey, scaled);
        return Optional.of(scaled);
    }

    private void processPreloadQueue() {
        DispatcherStats loads = dispatcher.stats();
        int slots;

        lock.lock();
        try {
            preloadTimer = null;
            if (closed || paused || preloadQueue.isEmpty()) {
                return;
            }
            if (loads.pending() > Math.max(2, loads.active() * 2)) {
                armPreloadTimer();
                return;
            }
            int available = loads.maxConcurrent() - loads.active();
            double ratio = smoothedHitRate.value() < LOW_HIT_RATE || smoothedLoadMs.value() > HIGH_LATENCY_MS
                ? HIGH_RESERVE_RATIO
                : LOW_RESERVE_RATIO;
            int reserved = Math.max(1, (int) (available * ratio));
            slots = available - reserved;
        } finally {
            lock.unlock();
        }

        int submitted = 0;
        while (submitted < slots) {
            Request next;
            lock.lock();
            try {
                if (closed) {
                    return;
                }
                next = poll(preloadQueue);
                if (next == null) {
                    break;
                }
                states.put(next, LoadState.LOADING);
            } finally {
                lock.unlock();
            }

            if (cache.containsMemory(CacheKey.variant(next.url(), next.size()))) {
                clearState(next);
                continue;
            }
            if (dispatcher.load(next.url(), next.size()) != LoadOutcome.CACHED) {
                submitted++;
            }
        }

        lock.lock();
        try {
            if (loads.pending() > BACKOFF_PENDING || smoothedLoadMs.value() > BACKOFF_LATENCY_MS) {
                preloadDelayMillis = Math.min(
                    config.preloadMaxDelay().toMillis(),
                    preloadDelayMillis + config.preloadDelayIncrease().toMillis()
                );
            } else {
                preloadDelayMillis = Math.max(
                    config.preloadMinDelay().toMillis(),
                    preloadDelayMillis - config.preloadDelayDecrease().toMillis()
                );
            }
            if (!preloadQueue.isEmpty()) {
                armPreloadTimer();
            }
        } finally {
            lock.unlock();
        }

        log.atTrace()
            .addKeyValue("submitted", submitted)
            .addKeyValue("slots", slots)
            .addKeyValue("nextDelayMs", preloadDelayMillis())
            .log("Preload tick");
    }

    private void processVariantQueue() {
        lock.lock();
        try {
            variantTimer = null;
        } finally {
            lock.unlock();
        }

        int processed = 0;
        while (processed < config.variantBatchSize()) {
            Request next;
            lock.lock();
            try {
                if (closed) {
                    return;
                }
                next = poll(variantQueue);
            } finally {
                lock.unlock();
            }
            if (next == null) {
                break;
            }

            CacheKey variantKey = CacheKey.variant(next.url(), next.size());
            if (cache.containsMemory(variantKey)) {
                continue;
            }
            Optional<BufferedImage> base = cache.getMemory(CacheKey.of(next.url()));
            if (base.isEmpty()) {
                requeueForFetch(next);
                continue;
            }
            BufferedImage scaled = ImageScaler.fit(base.get(), next.size());
            cache.putMemory(variantKey, scaled);
            clearState(next);
            callbackExecutor.execute(() -> fireLoaded(next.url(), next.size(), scaled));
            processed++;
        }

        updateStats();

        lock.lock();
        try {
            if (!closed && !variantQueue.isEmpty()) {
                armVariantTimer();
            }
        } finally {
            lock.unlock();
        }
    }

    private void requeueForFetch(Request request) {
        lock.lock();
        try {
            if (preloadQueue.add(request)) {
                armPreloadTimer();
            }
        } finally {
            lock.unlock();
        }
    }

    private void clearState(Request request) {
        lock.lock();
        try {
            states.remove(request);
        } finally {
            lock.unlock();
        }
    }

    // Caller holds the lock.
    private void armPreloadTimer() {
        if (closed || (preloadTimer != null && preloadTimer.isActive())) {
            return;
        }
        preloadTimer = scheduler.schedule(this::processPreloadQueue, preloadDelayMillis);
    }

    // Caller holds the lock.
    private void armVariantTimer() {
        if (closed || (variantTimer != null && variantTimer.isActive())) {
            return;
        }
        variantTimer = scheduler.schedule(this::processVariantQueue, config.variantDelay().toMillis());
    }

    // Caller holds the lock.
    private void cancelTimers() {
        if (preloadTimer != null) {
            preloadTimer.cancel();
            preloadTimer = null;
        }
        if (variantTimer != null) {
            variantTimer.cancel();
            variantTimer = null;
        }
    }

    // Caller holds the lock.
    private SchedulerStats snapshot(DispatcherStats loads) {
        return new SchedulerStats(
            totalRequests,
            cacheHits,
            cacheMisses,
            preloadHits,
            smoothedHitRate.value(),
            smoothedLoadMs.value(),
            preloadQueue.size(),
            variantQueue.size(),
            preloadDelayMillis,
            paused,
            loads
        );
    }

    // Caller holds the lock. Oldest failures fall back to PLACEHOLDER first.
    private void trimErrorStates() {
        long errors = states.values().stream().filter(state -> state == LoadState.ERROR).count();
        Iterator<LoadState> it = states.values().iterator();
        while (errors > MAX_ERROR_STATES && it.hasNext()) {
            if (it.next() == LoadState.ERROR) {
                it.remove();
                errors--;
            }
        }
    }

    private static Request poll(LinkedHashSet<Request> queue) {
        Iterator<Request> it = queue.iterator();
        if (!it.hasNext()) {
            return null;
        }
        Request next = it.next();
        it.remove();
        return next;
    }

    private void fireLoaded(String url, ThumbnailSize size, BufferedImage image) {
        for (LoadListener listener : listeners) {
            try {
                listener.onLoaded(url, size, image);
            } catch (RuntimeException e) {
                log.warn("Thumbnail listener failed", e);
            }
        }
    }

    private void fireFailed(String url, String message) {
        for (LoadListener listener : listeners) {
            try {
                listener.onFailed(url, message);
            } catch (RuntimeException e) {
                log.warn("Thumbnail listener failed", e);
            }
        }
    }

    private void fireCancelled(String url) {
        for (LoadListener listener : listeners) {
            try {
                listener.onCancelled(url);
            } catch (RuntimeException e) {
                log.warn("Thumbnail listener failed", e);
            }
        }
    }

    // Dispatcher events already arrive on the callback executor.
    private final class DispatcherEvents implements LoadListener {

        @Override
        public void onLoaded(String url, ThumbnailSize size, BufferedImage image) {
            lock.lock();
            try {
                if (!priorityUrls.remove(url)) {
                    preloadHits++;
                }
                if (size != null) {
                    states.remove(new Request(url, size));
                }
            } finally {
                lock.unlock();
            }
            fireLoaded(url, size, image);
            updateStats();
        }

        @Override
        public void onFailed(String url, String message) {
            lock.lock();
            try {
                priorityUrls.remove(url);
                states.replaceAll((request, state) ->
                    request.url().equals(url) && state == LoadState.LOADING ? LoadState.ERROR : state);
                trimErrorStates();
            } finally {
                lock.unlock();
            }
            fireFailed(url, message);
            updateStats();
        }

        @Override
        public void onCancelled(String url) {
            lock.lock();
            try {
                priorityUrls.remove(url);
                states.entrySet().removeIf(entry ->
                    entry.getKey().url().equals(url) && entry.getValue() == LoadState.LOADING);
            } finally {
                lock.unlock();
            }
            fireCancelled(url);
        }
    }
}
