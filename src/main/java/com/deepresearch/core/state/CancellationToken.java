package com.deepresearch.core.state;

/**
 * Cooperative cancellation flag for one research session.
 * <p>
 * Cancelling also interrupts the worker thread currently bound to the token, so a
 * blocking collaborator call is woken up. The first reason given wins.
 */
public class CancellationToken {

    private volatile boolean cancelled;
    private volatile String reason;
    private Thread worker;

    /**
     * @return true if this call cancelled the token, false if it was already cancelled
     */
    public boolean cancel(String reason) {
        synchronized (this) {
            if (cancelled) {
                return false;
            }
            this.reason = reason != null ? reason : "cancelled";
            this.cancelled = true;
            if (worker != null) {
                worker.interrupt();
            }
            return true;
        }
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public String reason() {
        return reason;
    }

    public synchronized void bind(Thread thread) {
        this.worker = thread;
    }

    /**
     * Unbinds the worker. Must be called before the thread moves on to other work so a
     * late cancel cannot interrupt it.
     */
    public synchronized void unbind() {
        this.worker = null;
    }
}
