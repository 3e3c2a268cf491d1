package io.thumbd.loader;

import io.thumbd.common.exception.LoadException;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory fetcher. Optionally holds every fetch at a gate until {@link #release()} so tests
 * can observe in-flight work.
 */
public final class FakeFetcher implements ImageFetcher {

    private final Map<String, byte[]> responses = new ConcurrentHashMap<>();
    private final Set<String> failing = ConcurrentHashMap.newKeySet();
    private final Map<String, AtomicInteger> callsByUrl = new ConcurrentHashMap<>();
    private final AtomicInteger calls = new AtomicInteger();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();
    private final Semaphore started = new Semaphore(0);
    private final Semaphore finished = new Semaphore(0);
    private final byte[] defaultResponse;
    private volatile CountDownLatch gate;

    public FakeFetcher(byte[] defaultResponse) {
        this.defaultResponse = defaultResponse;
    }

    public static FakeFetcher gated(byte[] defaultResponse) {
        FakeFetcher fetcher = new FakeFetcher(defaultResponse);
        fetcher.gate = new CountDownLatch(1);
        return fetcher;
    }

    public FakeFetcher respond(String url, byte[] data) {
        responses.put(url, data);
        return this;
    }

    public FakeFetcher fail(String url) {
        failing.add(url);
        return this;
    }

    public void release() {
        CountDownLatch current = gate;
        if (current != null) {
            current.countDown();
        }
    }

    @Override
    public byte[] fetch(String url) {
        calls.incrementAndGet();
        callsByUrl.computeIfAbsent(url, k -> new AtomicInteger()).incrementAndGet();
        maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
        started.release();
        try {
            CountDownLatch current = gate;
            if (current != null && !current.await(10, TimeUnit.SECONDS)) {
                throw new LoadException.Network("Gate never opened for " + url, null);
            }
            if (failing.contains(url)) {
                throw new LoadException.Network("Connection refused: " + url, null);
            }
            return responses.getOrDefault(url, defaultResponse);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LoadException.Network("Interrupted", e);
        } finally {
            inFlight.decrementAndGet();
            finished.release();
        }
    }

    public int calls() {
        return calls.get();
    }

    public int calls(String url) {
        AtomicInteger count = callsByUrl.get(url);
        return count == null ? 0 : count.get();
    }

    public Set<String> fetchedUrls() {
        return Set.copyOf(callsByUrl.keySet());
    }

    public int maxInFlight() {
        return maxInFlight.get();
    }

    public boolean awaitStarted(int count) throws InterruptedException {
        return started.tryAcquire(count, 5, TimeUnit.SECONDS);
    }

    public boolean awaitFinished(int count) throws InterruptedException {
        return finished.tryAcquire(count, 5, TimeUnit.SECONDS);
    }
}
