package io.thumbd.common;

/**
 * Source of time and one-shot delayed execution for every timer-driven loop in the
 * cache and loader. Production code runs on {@link ExecutorTaskScheduler}; tests drive
 * {@link ManualTaskScheduler} by hand.
 */
public interface TaskScheduler extends AutoCloseable {

    long nowMillis();

    Handle schedule(Runnable task, long delayMillis);

    default Handle scheduleAtFixedRate(Runnable task, long periodMillis) {
        return new RepeatingTask(this, task, periodMillis).start();
    }

    @Override
    void close();

    interface Handle {

        void cancel();

        boolean isActive();
    }
}
