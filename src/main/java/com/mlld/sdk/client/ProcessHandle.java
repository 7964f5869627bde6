package com.mlld.sdk.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.mlld.sdk.internal.PendingCall;

import javax.annotation.Nullable;
import java.time.Duration;

/**
 * In-flight {@code process} request. Resolves to the script's text output.
 */
public final class ProcessHandle extends RequestHandle<String> {

    ProcessHandle(MlldClient client, PendingCall call, @Nullable Duration timeout) {
        super(client, call, timeout);
    }

    /**
     * Send a {@code state:update} for this in-flight execution.
     */
    public void updateState(String path, Object value) {
        sendStateUpdate(path, value);
    }

    @Override
    protected String decode(CompletedRequest completedRequest) {
        JsonNode payload = completedRequest.getPayload();
        JsonNode output = payload.get("output");
        if (output == null || output.isNull()) {
            output = payload.get("value");
        }
        if (output == null || output.isNull()) {
            return "";
        }
        return output.isTextual() ? output.asText() : output.toString();
    }
}
