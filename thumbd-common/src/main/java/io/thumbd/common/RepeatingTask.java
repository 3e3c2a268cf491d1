package io.thumbd.common;

final class RepeatingTask implements TaskScheduler.Handle {

    private final TaskScheduler scheduler;
    private final Runnable task;
    private final long periodMillis;

    private volatile TaskScheduler.Handle next;
    private volatile boolean cancelled;

    RepeatingTask(TaskScheduler scheduler, Runnable task, long periodMillis) {
        if (periodMillis <= 0) {
            throw new IllegalArgumentException("periodMillis must be positive");
        }
        this.scheduler = scheduler;
        this.task = task;
        this.periodMillis = periodMillis;
    }

    RepeatingTask start() {
        next = scheduler.schedule(this::runAndReschedule, periodMillis);
        return this;
    }

    @Override
    public void cancel() {
        cancelled = true;
        TaskScheduler.Handle current = next;
        if (current != null) {
            current.cancel();
        }
    }

    @Override
    public boolean isActive() {
        return !cancelled;
    }

    private void runAndReschedule() {
        if (cancelled) {
            return;
        }
        try {
            task.run();
        } finally {
            if (!cancelled) {
                next = scheduler.schedule(this::runAndReschedule, periodMillis);
            }
        }
    }
}
