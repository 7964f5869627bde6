package com.mlld.sdk.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mlld.sdk.internal.PendingCall;
import com.mlld.sdk.types.results.ExecuteResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;

/**
 * In-flight {@code execute} request. Resolves to an {@link ExecuteResult} whose
 * state writes combine those embedded in the result with those streamed as events.
 */
public final class ExecuteHandle extends RequestHandle<ExecuteResult> {

    private static final Logger logger = LoggerFactory.getLogger(ExecuteHandle.class);

    ExecuteHandle(MlldClient client, PendingCall call, @Nullable Duration timeout) {
        super(client, call, timeout);
    }

    /**
     * Send a {@code state:update} for this in-flight execution.
     */
    public void updateState(String path, Object value) {
        sendStateUpdate(path, value);
    }

    @Override
    protected ExecuteResult decode(CompletedRequest completedRequest) {
        JsonNode payload = completedRequest.getPayload().deepCopy();
        if (payload instanceof ObjectNode) {
            ((ObjectNode) payload).remove("id");
        }

        ExecuteResult result;
        try {
            result = client().mapper().treeToValue(payload, ExecuteResult.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            logger.debug("execute result has an unexpected shape; returning it as text output", e);
            result = ExecuteResult.ofOutput(payload.isTextual() ? payload.asText() : payload.toString());
        }
        if (result == null) {
            result = ExecuteResult.ofOutput(payload.toString());
        }
        if (result.getOutput() == null) {
            result.setOutput("");
        }
        if (result.getStateWrites() == null) {
            result.setStateWrites(new ArrayList<>());
        }
        if (result.getEffects() == null) {
            result.setEffects(new ArrayList<>());
        }

        result.setStateWrites(Collections.unmodifiableList(client().stateWriteMerger()
                .merge(result.getStateWrites(), completedRequest.getStateWrites())));
        return result;
    }
}
