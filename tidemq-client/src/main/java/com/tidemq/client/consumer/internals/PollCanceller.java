package com.tidemq.client.consumer.internals;

/**
 * Lets other threads interrupt a blocked poll. A wakeup ends the current (or
 * next) poll once; close ends every later one.
 */
public class PollCanceller {

    private final Object lock = new Object();
    private boolean wakeupRequested;
    private boolean closed;

    public void wakeup() {
        synchronized (lock) {
            wakeupRequested = true;
            lock.notifyAll();
        }
    }

    public void close() {
        synchronized (lock) {
            closed = true;
            lock.notifyAll();
        }
    }

    public boolean isCancelled() {
        synchronized (lock) {
            return wakeupRequested || closed;
        }
    }

    /**
     * Consume a pending wakeup.
     */
    public void clearWakeup() {
        synchronized (lock) {
            wakeupRequested = false;
        }
    }

    /**
     * Wait up to {@code waitMs} or until closed. A wakeup does not end this wait.
     *
     * @return true if closed
     */
    public boolean awaitClose(long waitMs) {
        long deadline = System.currentTimeMillis() + waitMs;
        synchronized (lock) {
            while (!closed) {
                long remaining = deadline - System.currentTimeMillis();
                if (remaining <= 0) {
                    return false;
                }
                try {
                    lock.wait(remaining);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return true;
                }
            }
            return true;
        }
    }

    /**
     * Wait up to {@code waitMs} or until cancelled.
     *
     * @return true if cancelled
     */
    public boolean await(long waitMs) {
        long deadline = System.currentTimeMillis() + waitMs;
        synchronized (lock) {
            while (!wakeupRequested && !closed) {
                long remaining = deadline - System.currentTimeMillis();
                if (remaining <= 0) {
                    return false;
                }
                try {
                    lock.wait(remaining);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return true;
                }
            }
            return true;
        }
    }
}
