package io.thumbd.common;

import java.util.PriorityQueue;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Deterministic scheduler with a hand-advanced clock. Tasks run on the thread that calls
 * {@link #advance(long)} or {@link #runDue()}, in due-time order.
 */
public final class ManualTaskScheduler implements TaskScheduler {

    private final ReentrantLock lock = new ReentrantLock();
    private final PriorityQueue<Scheduled> queue = new PriorityQueue<>();
    private long now;
    private long sequence;

    public ManualTaskScheduler() {
        this(0);
    }

    public ManualTaskScheduler(long startMillis) {
        this.now = startMillis;
    }

    @Override
    public long nowMillis() {
        lock.lock();
        try {
            return now;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Handle schedule(Runnable task, long delayMillis) {
        lock.lock();
        try {
            Scheduled scheduled = new Scheduled(now + Math.max(0, delayMillis), sequence++, task);
            queue.add(scheduled);
            return scheduled;
        } finally {
            lock.unlock();
        }
    }

    public void advance(long millis) {
        long target;
        lock.lock();
        try {
            target = now + millis;
        } finally {
            lock.unlock();
        }

        while (true) {
            Scheduled next;
            lock.lock();
            try {
                next = queue.peek();
                if (next == null || next.dueMillis > target) {
                    now = target;
                    return;
                }
                queue.poll();
                now = Math.max(now, next.dueMillis);
            } finally {
                lock.unlock();
            }
            next.runIfActive();
        }
    }

    public void runDue() {
        advance(0);
    }

    public int pendingTasks() {
        lock.lock();
        try {
            return (int) queue.stream().filter(Scheduled::isActive).count();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            queue.clear();
        } finally {
            lock.unlock();
        }
    }

    private static final class Scheduled implements Handle, Comparable<Scheduled> {

        final long dueMillis;
        final long sequence;
        final Runnable task;
        volatile boolean cancelled;
        volatile boolean done;

        Scheduled(long dueMillis, long sequence, Runnable task) {
            this.dueMillis = dueMillis;
            this.sequence = sequence;
            this.task = task;
        }

        void runIfActive() {
            if (cancelled) {
                return;
            }
            done = true;
            task.run();
        }

        @Override
        public void cancel() {
            cancelled = true;
        }

        @Override
        public boolean isActive() {
            return !cancelled && !done;
        }

        @Override
        public int compareTo(Scheduled other) {
            int byTime = Long.compare(dueMillis, other.dueMillis);
            return byTime != 0 ? byTime : Long.compare(sequence, other.sequence);
        }
    }
}
