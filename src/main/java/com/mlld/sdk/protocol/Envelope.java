package com.mlld.sdk.protocol;

import com.fasterxml.jackson.databind.JsonNode;

import javax.annotation.Nullable;

/**
 * One decoded reply line from the worker. A line carries an {@code event}, a
 * {@code result}, or (unusually) both.
 */
public final class Envelope {

    @Nullable
    private final JsonNode event;
    @Nullable
    private final JsonNode result;

    public Envelope(@Nullable JsonNode event, @Nullable JsonNode result) {
        this.event = event;
        this.result = result;
    }

    @Nullable
    public JsonNode getEvent() {
        return event;
    }

    @Nullable
    public JsonNode getResult() {
        return result;
    }

    public boolean isEmpty() {
        return event == null && result == null;
    }
}
