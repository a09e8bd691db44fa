package io.harrier.core.gate;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Counting admission gate bounding how many units run at once.
 * <p>
 * Unlike {@link java.util.concurrent.Semaphore}, waiting for a permit does not
 * park a thread: {@link #acquire()} returns a future completed when a permit
 * is handed over. Waiters are served in FIFO order.
 */
public class AdmissionGate {

    private final int permits;
    private final Deque<CompletableFuture<Permit>> waiters = new ArrayDeque<>();
    private int available;

    public AdmissionGate(int permits) {
        if (permits <= 0) {
            throw new IllegalArgumentException("Permits must be positive");
        }
        this.permits = permits;
        this.available = permits;
    }

    /**
     * @return a future completed with a permit; close the permit to hand it on
     */
    public CompletableFuture<Permit> acquire() {
        synchronized (this) {
            if (available > 0) {
                available--;
                return CompletableFuture.completedFuture(new Permit());
            }
            CompletableFuture<Permit> waiter = new CompletableFuture<>();
            waiters.addLast(waiter);
            return waiter;
        }
    }

    private void release() {
        while (true) {
            CompletableFuture<Permit> next;
            synchronized (this) {
                next = waiters.pollFirst();
                if (next == null) {
                    available++;
                    return;
                }
            }
            // completed outside the lock; a cancelled waiter passes the permit on
            if (next.complete(new Permit())) {
                return;
            }
        }
    }

    public int permits() {
        return permits;
    }

    public synchronized int available() {
        return available;
    }

    public synchronized int waiting() {
        return waiters.size();
    }

    /**
     * @return permits currently held
     */
    public synchronized int inUse() {
        return permits - available;
    }

    /**
     * A held slot. Closing it more than once has no effect.
     */
    public final class Permit implements AutoCloseable {

        private final AtomicBoolean released = new AtomicBoolean(false);

        private Permit() {}

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                release();
            }
        }
    }
}
