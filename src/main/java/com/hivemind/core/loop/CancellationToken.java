package com.hivemind.core.loop;

/**
 * Cooperative cancellation request for one run.
 * <p>
 * While a run is active its worker thread is bound to the token, and
 * {@link #cancel} interrupts it so a blocked wait (next stream event, tool
 * completion, retry backoff) returns promptly.
 */
public final class CancellationToken {

    private volatile boolean cancelled;
    private volatile String reason;
    private Thread boundThread;

    public static CancellationToken create() {
        return new CancellationToken();
    }

    public void cancel(String reason) {
        synchronized (this) {
            if (cancelled) return;
            this.reason = reason;
            this.cancelled = true;
            if (boundThread != null) {
                boundThread.interrupt();
            }
        }
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public String reason() {
        return reason;
    }

    public void throwIfCancelled() {
        if (cancelled) {
            throw new RunCancelledException(reason != null ? reason : "cancelled");
        }
    }

    synchronized void bind(Thread thread) {
        boundThread = thread;
        if (cancelled) {
            thread.interrupt();
        }
    }

    /**
     * Unbinds the current thread and clears an interrupt that the token may
     * have delivered after the run stopped listening for it.
     */
    synchronized void unbind() {
        boundThread = null;
        Thread.interrupted();
    }
}
