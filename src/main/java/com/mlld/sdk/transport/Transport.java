package com.mlld.sdk.transport;

import java.io.Closeable;

/**
 * One live worker session multiplexing requests over a single process.
 */
public interface Transport extends Closeable {

    /**
     * Register a delivery channel for the id. Must happen before the request is sent.
     */
    ResponseChannel register(long requestId);

    /**
     * Write one request line followed by a newline and flush it.
     *
     * @param line Encoded JSON request
     * @throws com.mlld.sdk.exceptions.TransportException if the write fails
     */
    void send(String line);

    /**
     * Drop the registry entry for the id, if any.
     */
    void remove(long requestId);

    /**
     * Non-blocking liveness check.
     */
    boolean isRunning();

    /**
     * Terminate the worker and release its resources.
     */
    @Override
    void close();
}
