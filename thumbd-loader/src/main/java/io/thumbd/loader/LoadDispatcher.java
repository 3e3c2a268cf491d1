package io.thumbd.loader;

import io.thumbd.cache.TieredCache;
import io.thumbd.common.CacheKey;
import io.thumbd.common.TaskScheduler;
import io.thumbd.common.ThumbnailSize;
import io.thumbd.common.exception.LoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded pool of fetch workers with read-through/write-through caching.
 *
 * <p>At most one worker is live per URL; a request for a URL already in flight adds its
 * target size to that worker, so every caller receives an image scaled for its own
 * request. Worker launches are spaced by a minimum interval so a burst of requests does
 * not start all fetches in the same instant. Requests that cannot launch are queued and
 * drained by a one-shot dispatch timer.
 *
 * <p>Listeners are always invoked without the dispatcher lock held.
 */
public final class LoadDispatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LoadDispatcher.class);
    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private record PendingLoad(String url, ThumbnailSize size) {}

    private record Delivery(String url, ThumbnailSize size, BufferedImage image) {}

    private static final class FetchWorker {
        final String url;
        final long startedMillis;
        final Set<ThumbnailSize> sizes = new LinkedHashSet<>();
        boolean wantsOriginal;
        volatile boolean cancelled;
        Future<?> future;

        FetchWorker(String url, long startedMillis) {
            this.url = url;
            this.startedMillis = startedMillis;
        }

        void addTarget(ThumbnailSize size) {
            if (size == null) {
                wantsOriginal = true;
            } else {
                sizes.add(size);
            }
        }

        Targets drainTargets() {
            Targets targets = new Targets(wantsOriginal, List.copyOf(sizes));
            wantsOriginal = false;
            sizes.clear();
            return targets;
        }
    }

    private record Targets(boolean original, List<ThumbnailSize> sizes) {}

    private final TieredCache cache;
    private final ImageFetcher fetcher;
    private final ImageDecoder decoder;
    private final TaskScheduler scheduler;
    private final DispatcherConfig config;
    private final Executor callbackExecutor;
    private final ExecutorService workers;
    private final List<LoadListener> listeners = new CopyOnWriteArrayList<>();

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, FetchWorker> active = new LinkedHashMap<>();
    private final Deque<PendingLoad> pending = new ArrayDeque<>();
    private int maxConcurrent;
    private long lastLaunchMillis = Long.MIN_VALUE / 2;
    private TaskScheduler.Handle dispatchTimer;
    private long loadedCount;
    private long cancelCount;
    private long failedCount;
    private long sumLoadMillis;
    private boolean closed;

    public LoadDispatcher(
        TieredCache cache,
        ImageFetcher fetcher,
        ImageDecoder decoder,
        TaskScheduler scheduler,
        DispatcherConfig config,
        Executor callbackExecutor
    ) {
        this.cache = Objects.requireNonNull(cache, "cache");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.config = Objects.requireNonNull(config, "config");
        this.callbackExecutor = Objects.requireNonNull(callbackExecutor, "callbackExecutor");
        this.maxConcurrent = config.baseMaxConcurrent();
        this.workers = Executors.newFixedThreadPool(config.baseMaxConcurrent(), r -> {
            Thread thread = new Thread(r, "thumbd-fetch-" + THREAD_COUNTER.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public LoadDispatcher(TieredCache cache, ImageFetcher fetcher, TaskScheduler scheduler, DispatcherConfig config) {
        this(cache, fetcher, ImageIODecoder.INSTANCE, scheduler, config, Runnable::run);
    }

    public void addListener(LoadListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(LoadListener listener) {
        listeners.remove(listener);
    }

    /**
     * @param size target bounds, or {@code null} for the original image
     */
    public LoadOutcome load(String url, ThumbnailSize size) {
        Objects.requireNonNull(url, "url");

        Optional<BufferedImage> cached = resolveFromCache(url, size);
        if (cached.isPresent()) {
            notifyLoaded(List.of(new Delivery(url, size, cached.get())));
            return LoadOutcome.CACHED;
        }

        lock.lock();
        try {
            if (closed) {
                throw new IllegalStateException("Dispatcher is closed");
            }

            FetchWorker worker = active.get(url);
            if (worker != null) {
                worker.addTarget(size);
                return LoadOutcome.JOINED;
            }

            if (active.size() < maxConcurrent && throttleRemainingMillis() == 0) {
                launch(url, size);
                return LoadOutcome.STARTED;
            }

            PendingLoad request = new PendingLoad(url, size);
            if (!pending.contains(request)) {
                pending.addLast(request);
            }
            if (active.size() < maxConcurrent) {
                armDispatchTimer(throttleRemainingMillis());
            }
            return LoadOutcome.QUEUED;
        } finally {
            lock.unlock();
        }
    }

    public LoadOutcome load(String url) {
        return load(url, null);
    }

    public boolean isLoading(String url) {
        lock.lock();
        try {
            return active.containsKey(url);
        } finally {
            lock.unlock();
        }
    }

    public void cancel(String url) {
        FetchWorker worker;
        boolean removedPending;

        lock.lock();
        try {
            worker = active.remove(url);
            if (worker != null) {
                worker.cancelled = true;
                cancelCount++;
            }
            removedPending = pending.removeIf(p -> p.url().equals(url));
        } finally {
            lock.unlock();
        }

        if (worker != null && worker.future != null) {
            worker.future.cancel(true);
        }
        if (worker != null || removedPending) {
            log.atDebug().addKeyValue("url", url).log("Load cancelled");
            notifyCancelled(List.of(url));
        }
        scheduleDispatchIfPending();
    }

    public void cancelAll() {
        List<FetchWorker> cancelled;

        lock.lock();
        try {
            cancelled = new ArrayList<>(active.values());
            active.clear();
            for (FetchWorker worker : cancelled) {
                worker.cancelled = true;
            }
            cancelCount += cancelled.size();
            pending.clear();
            if (dispatchTimer != null) {
                dispatchTimer.cancel();
                dispatchTimer = null;
            }
        } finally {
            lock.unlock();
        }

        List<String> urls = new ArrayList<>();
        for (FetchWorker worker : cancelled) {
            if (worker.future != null) {
                worker.future.cancel(true);
            }
            urls.add(worker.url);
        }
        if (!urls.isEmpty()) {
            log.atDebug().addKeyValue("count", urls.size()).log("All loads cancelled");
            notifyCancelled(urls);
        }
    }

    public void setMaxConcurrent(int n) {
        lock.lock();
        try {
            maxConcurrent = Math.max(1, Math.min(n, config.baseMaxConcurrent()));
        } finally {
            lock.unlock();
        }
        scheduleDispatchIfPending();
    }

    public int getMaxConcurrent() {
        lock.lock();
        try {
            return maxConcurrent;
        } finally {
            lock.unlock();
        }
    }

    public int baseMaxConcurrent() {
        return config.baseMaxConcurrent();
    }

    public DispatcherStats stats() {
        lock.lock();
        try {
            double avg = loadedCount > 0 ? (double) sumLoadMillis / loadedCount : 0.0;
            return new DispatcherStats(
                active.size(),
                pending.size(),
                maxConcurrent,
                config.baseMaxConcurrent(),
                loadedCount,
                cancelCount,
                failedCount,
                avg
            );
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
        } finally {
            lock.unlock();
        }

        cancelAll();
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Fetch workers did not terminate in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private Optional<BufferedImage> resolveFromCache(String url, ThumbnailSize size) {
        if (size != null) {
            Optional<BufferedImage> variant = cache.getMemory(CacheKey.variant(url, size));
            if (variant.isPresent()) {
                return variant;
            }
        }

        Optional<BufferedImage> base = cache.getMemory(CacheKey.of(url));
        if (base.isEmpty() || size == null) {
            return base;
        }

        BufferedImage scaled = ImageScaler.fit(base.get(), size);
        cache.putMemory(CacheKey.variant(url, size), scaled);
        return Optional.of(scaled);
    }

    // Caller holds the lock.
    private void launch(String url, ThumbnailSize size) {
        long now = scheduler.nowMillis();
        FetchWorker worker = new FetchWorker(url, now);
        worker.addTarget(size);
        active.put(url, worker);
        lastLaunchMillis = now;
        worker.future = workers.submit(() -> runWorker(worker));
    }

    // Caller holds the lock.
    private long throttleRemainingMillis() {
        long elapsed = scheduler.nowMillis() - lastLaunchMillis;
        return Math.max(0, config.minLaunchInterval().toMillis() - elapsed);
    }

    // Caller holds the lock.
    private void armDispatchTimer(long delayMillis) {
        if (closed || (dispatchTimer != null && dispatchTimer.isActive())) {
            return;
        }
        dispatchTimer = scheduler.schedule(this::dispatchPending, delayMillis);
    }

    private void scheduleDispatchIfPending() {
        lock.lock();
        try {
            if (!pending.isEmpty() && active.size() < maxConcurrent) {
                armDispatchTimer(throttleRemainingMillis());
            }
        } finally {
            lock.unlock();
        }
    }

    private void dispatchPending() {
        lock.lock();
        try {
            dispatchTimer = null;
        } finally {
            lock.unlock();
        }

        while (true) {
            PendingLoad next;
            lock.lock();
            try {
                if (closed || pending.isEmpty() || active.size() >= maxConcurrent) {
                    return;
                }
                long wait = throttleRemainingMillis();
                if (wait > 0) {
                    armDispatchTimer(wait);
                    return;
                }
                next = pending.pollFirst();
            } finally {
                lock.unlock();
            }

            Optional<BufferedImage> cached = resolveFromCache(next.url(), next.size());
            if (cached.isPresent()) {
                notifyLoaded(List.of(new Delivery(next.url(), next.size(), cached.get())));
                continue;
            }

            lock.lock();
            try {
                if (closed) {
                    return;
                }
                FetchWorker existing = active.get(next.url());
                if (existing != null) {
                    existing.addTarget(next.size());
                    continue;
                }
                if (active.size() >= maxConcurrent) {
                    pending.addFirst(next);
                    return;
                }
                launch(next.url(), next.size());
                if (!pending.isEmpty() && active.size() < maxConcurrent) {
                    armDispatchTimer(config.minLaunchInterval().toMillis());
                }
                return;
            } finally {
                lock.unlock();
            }
        }
    }

    private void runWorker(FetchWorker worker) {
        try {
            BufferedImage image = fetchImage(worker);
            finishSuccess(worker, image);
        } catch (CancellationException e) {
            finishFailure(worker, "Cancelled");
        } catch (LoadException e) {
            finishFailure(worker, e.getMessage());
        } catch (RuntimeException e) {
            log.atWarn()
                .addKeyValue("url", worker.url)
                .setCause(e)
                .log("Unexpected failure while loading image");
            finishFailure(worker, "Load failed: " + e.getMessage());
        }
    }

    private BufferedImage fetchImage(FetchWorker worker) {
        CacheKey baseKey = CacheKey.of(worker.url);

        Optional<BufferedImage> inMemory = cache.getMemory(baseKey);
        if (inMemory.isPresent()) {
            return inMemory.get();
        }

        Optional<byte[]> onDisk = cache.getDisk(baseKey);
        if (onDisk.isPresent()) {
            try {
                return decoder.decode(onDisk.get());
            } catch (LoadException.Decode e) {
                log.atWarn()
                    .addKeyValue("url", worker.url)
                    .addKeyValue("error", e.getMessage())
                    .log("Cached bytes are not a valid image, refetching");
                cache.removeDisk(baseKey);
            }
        }

        checkCancelled(worker);
        byte[] data = fetcher.fetch(worker.url);
        BufferedImage image = decoder.decode(data);
        checkCancelled(worker);

        cache.putDisk(baseKey, data);
        return image;
    }

    private static void checkCancelled(FetchWorker worker) {
        if (worker.cancelled || Thread.currentThread().isInterrupted()) {
            throw new CancellationException();
        }
    }

    private void finishSuccess(FetchWorker worker, BufferedImage image) {
        Targets first;
        lock.lock();
        try {
            if (worker.cancelled) {
                return;
            }
            first = worker.drainTargets();
        } finally {
            lock.unlock();
        }

        List<Delivery> deliveries = new ArrayList<>(render(worker.url, image, first));

        Targets late;
        lock.lock();
        try {
            if (worker.cancelled) {
                return;
            }
            late = worker.drainTargets();
            active.remove(worker.url, worker);
            loadedCount++;
            sumLoadMillis += Math.max(0, scheduler.nowMillis() - worker.startedMillis);
        } finally {
            lock.unlock();
        }

        deliveries.addAll(render(worker.url, image, late));
        notifyLoaded(deliveries);
        scheduleDispatchIfPending();
    }

    private void finishFailure(FetchWorker worker, String message) {
        boolean report;
        lock.lock();
        try {
            report = !worker.cancelled;
            if (report) {
                active.remove(worker.url, worker);
                failedCount++;
            }
        } finally {
            lock.unlock();
        }

        if (report) {
            log.atDebug()
                .addKeyValue("url", worker.url)
                .addKeyValue("error", message)
                .log("Image load failed");
            notifyFailed(worker.url, message);
        }
        scheduleDispatchIfPending();
    }

    private List<Delivery> render(String url, BufferedImage image, Targets targets) {
        List<Delivery> deliveries = new ArrayList<>();
        if (targets.original()) {
            cache.putMemory(CacheKey.of(url), image);
            deliveries.add(new Delivery(url, null, image));
        }
        for (ThumbnailSize size : targets.sizes()) {
            BufferedImage scaled = ImageScaler.fit(image, size);
            cache.putMemory(CacheKey.variant(url, size), scaled);
            deliveries.add(new Delivery(url, size, scaled));
        }
        return deliveries;
    }

    private void notifyLoaded(List<Delivery> deliveries) {
        if (deliveries.isEmpty()) {
            return;
        }
        callbackExecutor.execute(() -> {
            for (Delivery delivery : deliveries) {
                for (LoadListener listener : listeners) {
                    try {
                        listener.onLoaded(delivery.url(), delivery.size(), delivery.image());
                    } catch (RuntimeException e) {
                        log.warn("Load listener failed", e);
                    }
                }
            }
        });
    }

    private void notifyFailed(String url, String message) {
        callbackExecutor.execute(() -> {
            for (LoadListener listener : listeners) {
                try {
                    listener.onFailed(url, message);
                } catch (RuntimeException e) {
                    log.warn("Load listener failed", e);
                }
            }
        });
    }

    private void notifyCancelled(List<String> urls) {
        callbackExecutor.execute(() -> {
            for (String url : urls) {
                for (LoadListener listener : listeners) {
                    try {
                        listener.onCancelled(url);
                    } catch (RuntimeException e) {
                        log.warn("Load listener failed", e);
                    }
                }
            }
        });
    }
}
