package com.mlld.sdk.exceptions;

/**
 * Raised when the live worker process cannot be started, written to, or
 * disconnects while requests are in flight.
 */
public class TransportException extends MlldSdkException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
