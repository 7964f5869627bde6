package com.mlld.sdk.exceptions;

import java.time.Duration;

/**
 * Raised when a request does not complete within its configured timeout.
 */
public class RequestTimeoutException extends MlldSdkException {

    private final long requestId;
    private final Duration timeout;

    public RequestTimeoutException(long requestId, Duration timeout) {
        super("Request " + requestId + " timed out after " + timeout.toMillis() + " ms");
        this.requestId = requestId;
        this.timeout = timeout;
    }

    public long getRequestId() {
        return requestId;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
