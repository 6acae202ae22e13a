package com.hivemind.core.llm;

import java.time.Duration;

/**
 * A lazily produced, finite sequence of {@link StreamEvent}s.
 * <p>
 * {@link #poll} is the suspension point of an exchange: it blocks for at most
 * {@code timeout} and responds to thread interruption, so a caller can observe
 * cancellation within one poll interval.
 */
public interface ModelStream extends AutoCloseable {

    /**
     * Waits for the next event.
     *
     * @return the next event, or null if none arrived within {@code timeout}
     *         (check {@link #isExhausted()} to tell a timeout from the end of the stream)
     */
    StreamEvent poll(Duration timeout) throws InterruptedException;

    /** True once the producer has finished and every event has been consumed. */
    boolean isExhausted();

    /** Releases the underlying provider connection. Idempotent. */
    @Override
    void close();
}
