package com.mlld.sdk.transport;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Message delivered to the caller waiting on a request.
 */
public interface TransportMessage {

    static Event event(JsonNode payload) {
        return new Event(payload);
    }

    static Result result(JsonNode payload) {
        return new Result(payload);
    }

    static Closed closed(String reason) {
        return new Closed(reason);
    }

    /**
     * Non-terminal notification; zero or more per request.
     */
    @Data
    @AllArgsConstructor
    final class Event implements TransportMessage {
        private final JsonNode payload;
    }

    /**
     * Terminal reply, successful or carrying an {@code error} member.
     */
    @Data
    @AllArgsConstructor
    final class Result implements TransportMessage {
        private final JsonNode payload;
    }

    /**
     * Terminal notice that the worker or its output stream became unusable.
     */
    @Data
    @AllArgsConstructor
    final class Closed implements TransportMessage {
        private final String reason;
    }
}
