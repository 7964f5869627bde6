package com.mlld.sdk.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.mlld.sdk.types.results.StateWrite;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Successful result payload plus the state writes streamed while waiting for it.
 */
final class CompletedRequest {

    private final JsonNode payload;
    private final List<StateWrite> stateWrites;

    CompletedRequest(JsonNode payload, List<StateWrite> stateWrites) {
        this.payload = payload;
        this.stateWrites = List.copyOf(stateWrites);
    }

    JsonNode getPayload() {
        return payload;
    }

    /**
     * Copies of the streamed state writes, so callers never share instances.
     */
    List<StateWrite> getStateWrites() {
        return stateWrites.stream()
                .map(CompletedRequest::copyOf)
                .collect(Collectors.collectingAndThen(Collectors.toList(), Collections::unmodifiableList));
    }

    private static StateWrite copyOf(StateWrite stateWrite) {
        return new StateWrite(
                stateWrite.getPath(),
                stateWrite.getValue() != null ? stateWrite.getValue().deepCopy() : null,
                stateWrite.getTimestamp()
        );
    }
}
