package com.mlld.sdk.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mlld.sdk.exceptions.MessageParseException;
import com.mlld.sdk.exceptions.WorkerException;
import com.mlld.sdk.types.results.StateWrite;

import javax.annotation.Nullable;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Codec for the line-delimited JSON protocol spoken by {@code mlld live --stdio}.
 *
 * <p>Requests are written as {@code {"method": ..., "id": ..., "params": ...}}.
 * Replies are either {@code {"event": {"id": ..., "type": ...}}} or
 * {@code {"result": {"id": ..., "error"?: {...}}}}.
 */
public class LiveProtocol {

    public static final String METHOD_PROCESS = "process";
    public static final String METHOD_EXECUTE = "execute";
    public static final String METHOD_ANALYZE = "analyze";
    public static final String METHOD_CANCEL = "cancel";
    public static final String METHOD_STATE_UPDATE = "state:update";

    public static final String EVENT_STATE_WRITE = "state:write";

    private static final String DEFAULT_ERROR_MESSAGE = "mlld request failed";

    private final ObjectMapper objectMapper;

    public LiveProtocol() {
        this(new ObjectMapper());
    }

    public LiveProtocol(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    /**
     * Encode a request line (without the trailing newline).
     */
    public String encodeRequest(long requestId, String method, @Nullable JsonNode params) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("method", method);
        request.put("id", requestId);
        if (params != null) {
            request.set("params", params);
        }
        return request.toString();
    }

    public String encodeCancel(long requestId) {
        return encodeRequest(requestId, METHOD_CANCEL, null);
    }

    /**
     * Decode one reply line.
     *
     * @throws MessageParseException if the line is not valid JSON
     */
    public Envelope decode(String line) {
        JsonNode root;
        try {
            root = objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            throw new MessageParseException("invalid live response: " + e.getOriginalMessage(), line, e);
        }
        if (root == null || !root.isObject()) {
            return new Envelope(null, null);
        }
        return new Envelope(presentOrNull(root.get("event")), presentOrNull(root.get("result")));
    }

    /**
     * Read the request id embedded in an event or result payload. Accepts a
     * non-negative integer or a string holding one.
     */
    public static OptionalLong requestIdOf(@Nullable JsonNode payload) {
        if (payload == null) {
            return OptionalLong.empty();
        }
        JsonNode id = payload.get("id");
        if (id == null) {
            return OptionalLong.empty();
        }
        if (id.isIntegralNumber() && id.canConvertToLong()) {
            long value = id.asLong();
            return value >= 0 ? OptionalLong.of(value) : OptionalLong.empty();
        }
        if (id.isTextual()) {
            try {
                long value = Long.parseLong(id.asText().trim());
                return value >= 0 ? OptionalLong.of(value) : OptionalLong.empty();
            } catch (NumberFormatException e) {
                return OptionalLong.empty();
            }
        }
        return OptionalLong.empty();
    }

    /**
     * Extract a state write from a {@code state:write} event; other events yield empty.
     */
    public Optional<StateWrite> stateWriteFromEvent(JsonNode event) {
        if (event == null || !EVENT_STATE_WRITE.equals(textOrNull(event.get("type")))) {
            return Optional.empty();
        }
        JsonNode write = event.get("write");
        if (write == null || !write.isObject()) {
            return Optional.empty();
        }
        String path = textOrNull(write.get("path"));
        if (path == null) {
            return Optional.empty();
        }
        JsonNode value = write.has("value") ? write.get("value") : NullNode.getInstance();
        return Optional.of(new StateWrite(path, value, textOrNull(write.get("timestamp"))));
    }

    /**
     * Translate the {@code error} member of a result into an exception.
     */
    public WorkerException errorFromPayload(JsonNode error) {
        if (error.isTextual()) {
            return new WorkerException(error.asText(), null);
        }
        String message = textOrNull(error.get("message"));
        return new WorkerException(
                message != null ? message : DEFAULT_ERROR_MESSAGE,
                textOrNull(error.get("code"))
        );
    }

    /**
     * Identity of a state write for de-duplication: its path and serialized value.
     */
    public String stateWriteKey(StateWrite stateWrite) {
        String value;
        try {
            value = objectMapper.writeValueAsString(stateWrite.getValue());
        } catch (JsonProcessingException e) {
            value = "null";
        }
        return stateWrite.getPath() + "|" + value;
    }

    @Nullable
    private static JsonNode presentOrNull(@Nullable JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode() ? null : node;
    }

    @Nullable
    private static String textOrNull(@Nullable JsonNode node) {
        return node != null && node.isTextual() ? node.asText() : null;
    }
}
