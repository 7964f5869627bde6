package com.mlld.sdk.transport;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Single-producer, single-consumer delivery channel for one pending request.
 * The reader thread delivers; the thread waiting on the request receives.
 */
public final class ResponseChannel {

    private static final Object DISCONNECTED = new Object();

    private final long requestId;
    private final BlockingQueue<Object> queue = new LinkedBlockingQueue<>();

    public ResponseChannel(long requestId) {
        this.requestId = requestId;
    }

    public long getRequestId() {
        return requestId;
    }

    public void deliver(TransportMessage message) {
        queue.offer(message);
    }

    /**
     * Mark the producer side as gone without a terminal message.
     */
    public void disconnect() {
        queue.offer(DISCONNECTED);
    }

    /**
     * Block until the next message arrives.
     */
    public TransportMessage receive() throws InterruptedException, DisconnectedException {
        return unwrap(queue.take());
    }

    /**
     * Wait up to the given time for the next message.
     *
     * @return the message, or {@code null} if the wait timed out
     */
    public TransportMessage receive(long timeout, TimeUnit unit)
            throws InterruptedException, DisconnectedException {
        Object next = queue.poll(timeout, unit);
        return next == null ? null : unwrap(next);
    }

    private TransportMessage unwrap(Object next) throws DisconnectedException {
        if (next == DISCONNECTED) {
            // Keep the marker so later receives fail the same way.
            queue.offer(DISCONNECTED);
            throw new DisconnectedException("Channel for request " + requestId + " was disconnected");
        }
        return (TransportMessage) next;
    }

    /**
     * Thrown when the channel was dropped without a terminal message.
     */
    public static class DisconnectedException extends Exception {
        public DisconnectedException(String message) {
            super(message);
        }
    }
}
