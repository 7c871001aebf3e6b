package com.adlanda.codeindex.service;

import com.adlanda.codeindex.model.IndexingEvent;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Hands events of a streaming run from the producing worker to the consumer.
 *
 * The queue is unbounded so publishing never blocks the run. Closing the
 * channel cancels the run; events published afterwards are dropped.
 */
public class IndexingEventChannel {

    private final BlockingQueue<IndexingEvent> queue = new LinkedBlockingQueue<>();
    private final CancellationSignal cancellation;

    private volatile boolean closed;

    public IndexingEventChannel(CancellationSignal cancellation) {
        this.cancellation = cancellation;
    }

    /**
     * Publishes an event. Returns false once the channel is closed.
     */
    public boolean publish(IndexingEvent event) {
        if (closed) {
            return false;
        }
        return queue.offer(event);
    }

    /**
     * Waits up to the given time for the next event.
     *
     * @return The event, or null if none arrived in time
     */
    public IndexingEvent poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    /**
     * Stops accepting events and cancels the producing run.
     */
    public void close() {
        closed = true;
        cancellation.cancel();
    }

    public boolean isClosed() {
        return closed;
    }

    public CancellationSignal cancellation() {
        return cancellation;
    }
}
