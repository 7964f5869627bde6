package com.mlld.sdk.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mlld.sdk.exceptions.MessageParseException;
import com.mlld.sdk.internal.PendingCall;
import com.mlld.sdk.types.analysis.AnalyzeResult;

import javax.annotation.Nullable;
import java.time.Duration;

/**
 * In-flight {@code analyze} request.
 */
public final class AnalyzeHandle extends RequestHandle<AnalyzeResult> {

    private final String filepath;

    AnalyzeHandle(MlldClient client, PendingCall call, @Nullable Duration timeout, String filepath) {
        super(client, call, timeout);
        this.filepath = filepath;
    }

    @Override
    protected AnalyzeResult decode(CompletedRequest completedRequest) {
        JsonNode payload = completedRequest.getPayload().deepCopy();
        if (payload instanceof ObjectNode) {
            ((ObjectNode) payload).remove("id");
        }

        AnalyzeResult result;
        try {
            result = client().mapper().treeToValue(payload, AnalyzeResult.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new MessageParseException("Failed to decode analyze result", payload.toString(), e);
        }
        if (result == null) {
            throw new MessageParseException("Empty analyze result", payload.toString());
        }
        if (result.getFilepath() == null) {
            result.setFilepath(filepath);
        }
        return result;
    }
}
