package com.mlld.sdk.exceptions;

/**
 * Raised when a reply line or result payload cannot be decoded.
 */
public class MessageParseException extends MlldSdkException {

    private final String rawMessage;

    public MessageParseException(String message, String rawMessage) {
        super(message);
        this.rawMessage = rawMessage;
    }

    public MessageParseException(String message, String rawMessage, Throwable cause) {
        super(message, cause);
        this.rawMessage = rawMessage;
    }

    public String getRawMessage() {
        return rawMessage;
    }
}
