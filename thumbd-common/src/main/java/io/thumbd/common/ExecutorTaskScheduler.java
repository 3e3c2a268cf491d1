package io.thumbd.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

public final class ExecutorTaskScheduler implements TaskScheduler {

    private static final Logger logger = LoggerFactory.getLogger(ExecutorTaskScheduler.class);
    private static final AtomicInteger INSTANCES = new AtomicInteger();

    private final ScheduledExecutorService executor;
    private final boolean ownsExecutor;

    public ExecutorTaskScheduler(ScheduledExecutorService executor) {
        this(executor, false);
    }

    private ExecutorTaskScheduler(ScheduledExecutorService executor, boolean ownsExecutor) {
        this.executor = executor;
        this.ownsExecutor = ownsExecutor;
    }

    public static ExecutorTaskScheduler create(String name) {
        String threadName = name + "-" + INSTANCES.incrementAndGet();
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, threadName);
            thread.setDaemon(true);
            return thread;
        });
        return new ExecutorTaskScheduler(executor, true);
    }

    @Override
    public long nowMillis() {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime());
    }

    @Override
    public Handle schedule(Runnable task, long delayMillis) {
        try {
            ScheduledFuture<?> future = executor.schedule(
                () -> {
                    try {
                        task.run();
                    } catch (Exception e) {
                        logger.error("Scheduled task failed", e);
                    }
                },
                Math.max(0, delayMillis),
                TimeUnit.MILLISECONDS
            );
            return new FutureHandle(future);
        } catch (RejectedExecutionException e) {
            logger.debug("Scheduler is shut down, dropping task");
            return FutureHandle.DONE;
        }
    }

    @Override
    public void close() {
        if (!ownsExecutor) {
            return;
        }
        executor.shutdownNow();
        try {
            executor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private record FutureHandle(ScheduledFuture<?> future) implements Handle {

        static final FutureHandle DONE = new FutureHandle(null);

        @Override
        public void cancel() {
            if (future != null && !future.isDone()) {
                future.cancel(false);
            }
        }

        @Override
        public boolean isActive() {
            return future != null && !future.isDone();
        }
    }
}
