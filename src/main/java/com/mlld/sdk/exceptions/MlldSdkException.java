package com.mlld.sdk.exceptions;

/**
 * Base class for every failure raised by the mlld SDK.
 */
public class MlldSdkException extends RuntimeException {

    public MlldSdkException(String message) {
        super(message);
    }

    public MlldSdkException(String message, Throwable cause) {
        super(message, cause);
    }
}
