package com.mlld.sdk.internal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mlld.sdk.exceptions.WorkerException;
import com.mlld.sdk.protocol.LiveProtocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.time.Duration;

/**
 * Sends {@code state:update} for an in-flight request.
 *
 * <p>The worker makes a request eligible for state updates shortly after it starts,
 * so an early update may see {@code REQUEST_NOT_FOUND}. That code is retried at a
 * fixed interval until the deadline passes; any other failure is returned at once.
 * A request that already finished therefore fails deterministically once the
 * deadline is reached.
 */
public final class StateUpdateLoop {

    private static final Logger logger = LoggerFactory.getLogger(StateUpdateLoop.class);

    /**
     * Issues one request and waits for its result.
     */
    @FunctionalInterface
    public interface Requester {
        JsonNode request(String method, ObjectNode params, @Nullable Duration timeout);
    }

    private final Requester requester;
    private final ObjectMapper mapper;
    private final Duration retryInterval;
    private final Duration defaultDeadline;

    public StateUpdateLoop(Requester requester, ObjectMapper mapper, Duration retryInterval, Duration defaultDeadline) {
        this.requester = requester;
        this.mapper = mapper;
        this.retryInterval = retryInterval;
        this.defaultDeadline = defaultDeadline;
    }

    /**
     * @param targetId request whose state is updated
     * @param path     state path, must not be blank
     * @param value    new value
     * @param timeout  per-attempt timeout, also used as retry deadline when set
     * @throws IllegalArgumentException if the path is blank; nothing is sent
     * @throws WorkerException          if the worker rejects the update
     */
    public void update(long targetId, String path, @Nullable JsonNode value, @Nullable Duration timeout) {
        if (path == null || path.trim().isEmpty()) {
            throw new IllegalArgumentException("state update path is required");
        }

        ObjectNode params = mapper.createObjectNode();
        params.put("requestId", targetId);
        params.put("path", path);
        params.set("value", value != null ? value : NullNode.getInstance());

        long maxWaitNanos = Timeouts.toNanos(timeout != null ? timeout : defaultDeadline);
        long start = System.nanoTime();
        int attempts = 0;

        while (true) {
            attempts++;
            try {
                requester.request(LiveProtocol.METHOD_STATE_UPDATE, params, timeout);
                if (attempts > 1) {
                    logger.debug("state:update for request {} accepted after {} attempts", targetId, attempts);
                }
                return;
            } catch (WorkerException e) {
                if (!e.isRequestNotFound()) {
                    throw e;
                }
                if (System.nanoTime() - start >= maxWaitNanos) {
                    throw new WorkerException("No active request for id " + targetId, WorkerException.REQUEST_NOT_FOUND);
                }
                try {
                    Thread.sleep(retryInterval.toMillis());
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
            }
        }
    }
}
