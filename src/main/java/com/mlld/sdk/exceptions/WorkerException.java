package com.mlld.sdk.exceptions;

import javax.annotation.Nullable;

/**
 * Structured failure reported by the mlld worker for a single request.
 */
public class WorkerException extends MlldSdkException {

    /**
     * Code the worker uses when a request id is not (or no longer) active.
     */
    public static final String REQUEST_NOT_FOUND = "REQUEST_NOT_FOUND";

    @Nullable
    private final String code;

    public WorkerException(String message, @Nullable String code) {
        super(message);
        this.code = code;
    }

    /**
     * Machine-readable error code, if the worker supplied one.
     */
    @Nullable
    public String getCode() {
        return code;
    }

    public boolean isRequestNotFound() {
        return REQUEST_NOT_FOUND.equals(code);
    }
}
