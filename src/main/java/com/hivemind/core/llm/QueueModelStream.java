package com.hivemind.core.llm;

import java.time.Duration;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link ModelStream} fed by a producer thread (a reactive subscription, or a test).
 */
public class QueueModelStream implements ModelStream {

    private final LinkedBlockingQueue<StreamEvent> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean completed = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile Runnable onClose = () -> { };

    /** Stream that already holds {@code events} and is complete. */
    public static QueueModelStream of(StreamEvent... events) {
        var stream = new QueueModelStream();
        for (StreamEvent event : events) {
            stream.push(event);
        }
        stream.complete();
        return stream;
    }

    public void push(StreamEvent event) {
        if (completed.get() || closed.get()) return;
        queue.add(event);
    }

    /** Marks the end of production; already queued events remain readable. */
    public void complete() {
        completed.set(true);
    }

    /** Action run once when the consumer closes the stream. */
    public void onClose(Runnable action) {
        this.onClose = action;
    }

    @Override
    public StreamEvent poll(Duration timeout) throws InterruptedException {
        return queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    @Override
    public boolean isExhausted() {
        return completed.get() && queue.isEmpty();
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            completed.set(true);
            onClose.run();
        }
    }
}
