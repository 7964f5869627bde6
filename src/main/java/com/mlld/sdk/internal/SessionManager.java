package com.mlld.sdk.internal;

import com.mlld.sdk.exceptions.TransportException;
import com.mlld.sdk.transport.ResponseChannel;
import com.mlld.sdk.transport.Transport;
import com.mlld.sdk.transport.TransportFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.function.LongFunction;

/**
 * Holds the single session slot of a client. Spawns a session on first use,
 * replaces a dead one on the next request, and serializes the
 * liveness-check/register/send sequence. Waiting happens outside the lock.
 */
public final class SessionManager implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(SessionManager.class);

    private final TransportFactory factory;
    private final Object lock = new Object();

    @Nullable
    private Transport current;

    public SessionManager(TransportFactory factory) {
        this.factory = factory;
    }

    /**
     * Register the id on a live session and send the encoded request.
     *
     * @param requestId id already allocated by the caller
     * @param encoder   builds the request line for the id
     * @throws TransportException if no session can be started or the write fails
     */
    public PendingCall dispatch(long requestId, LongFunction<String> encoder) {
        String line = encoder.apply(requestId);
        synchronized (lock) {
            Transport transport = ensureTransportLocked();
            ResponseChannel channel = transport.register(requestId);
            try {
                transport.send(line);
            } catch (RuntimeException e) {
                transport.remove(requestId);
                throw e;
            }
            return new PendingCall(requestId, transport, channel);
        }
    }

    /**
     * Clear the slot if it still holds the given session, then tear that session down.
     * A session that was already replaced leaves the slot untouched.
     */
    public void invalidate(Transport failed) {
        synchronized (lock) {
            if (current == failed) {
                current = null;
            }
        }
        failed.close();
    }

    /**
     * The session currently in the slot, if any.
     */
    @Nullable
    public Transport currentTransport() {
        synchronized (lock) {
            return current;
        }
    }

    @Override
    public void close() {
        Transport toClose;
        synchronized (lock) {
            toClose = current;
            current = null;
        }
        if (toClose != null) {
            toClose.close();
        }
    }

    private Transport ensureTransportLocked() {
        if (current != null && current.isRunning()) {
            return current;
        }
        if (current != null) {
            logger.debug("mlld live transport is no longer running; starting a new one");
            Transport dead = current;
            current = null;
            dead.close();
        }
        current = factory.open();
        if (current == null) {
            throw new TransportException("failed to initialize transport");
        }
        return current;
    }
}
