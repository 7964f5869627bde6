package com.mlld.sdk.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mlld.sdk.exceptions.RequestTimeoutException;
import com.mlld.sdk.exceptions.TransportException;
import com.mlld.sdk.internal.PendingCall;
import com.mlld.sdk.internal.SessionManager;
import com.mlld.sdk.internal.StateUpdateLoop;
import com.mlld.sdk.internal.Timeouts;
import com.mlld.sdk.protocol.LiveProtocol;
import com.mlld.sdk.transport.LiveTransport;
import com.mlld.sdk.transport.ResponseChannel;
import com.mlld.sdk.transport.TransportFactory;
import com.mlld.sdk.transport.TransportMessage;
import com.mlld.sdk.types.analysis.AnalyzeResult;
import com.mlld.sdk.types.options.ClientOptions;
import com.mlld.sdk.types.options.ExecuteOptions;
import com.mlld.sdk.types.options.ProcessOptions;
import com.mlld.sdk.types.results.ExecuteResult;
import com.mlld.sdk.types.results.StateWrite;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Client for a persistent {@code mlld live --stdio} worker.
 *
 * <p>One worker process is started on first use and shared by every request;
 * any number of threads may issue requests concurrently. If the worker dies, the
 * requests in flight fail with a {@link TransportException} and the next request
 * starts a fresh worker.
 *
 * <p>Example:
 * <pre>{@code
 * try (MlldClient client = new MlldClient()) {
 *     String output = client.process("/var @name = \"World\"\nHello, @name!");
 *
 *     ProcessHandle handle = client.processAsync(
 *         "loop(99999, 50ms) until @state.exit [\n  continue\n]\nshow \"stopped\"",
 *         ProcessOptions.builder().state(Map.of("exit", false)).build());
 *     handle.updateState("exit", true);
 *     log.info("{}", handle.result());
 * }
 * }</pre>
 */
public final class MlldClient implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(MlldClient.class);

    private final ClientOptions options;
    private final LiveProtocol protocol;
    private final SessionManager sessions;
    private final StateUpdateLoop stateUpdates;
    private final StateWriteMerger stateWriteMerger;
    private final AtomicLong nextRequestId = new AtomicLong(1);

    /**
     * Create a client with default options.
     */
    public MlldClient() {
        this(ClientOptions.builder().build());
    }

    public MlldClient(ClientOptions options) {
        this(options, null);
    }

    /**
     * Create a client with a custom transport factory (e.g. a remote worker).
     */
    public MlldClient(ClientOptions options, @Nullable TransportFactory transportFactory) {
        this.options = Objects.requireNonNull(options, "options");
        this.protocol = new LiveProtocol();
        this.sessions = new SessionManager(transportFactory != null
                ? transportFactory
                : LiveTransport.factory(options, protocol));
        this.stateUpdates = new StateUpdateLoop(
                this::request,
                protocol.getObjectMapper(),
                options.getStateUpdateRetryInterval(),
                options.getStateUpdateDeadline()
        );
        this.stateWriteMerger = new StateWriteMerger(protocol);
    }

    public ClientOptions getOptions() {
        return options;
    }

    /**
     * Execute a script and return its output.
     */
    public String process(String script) {
        return process(script, null);
    }

    public String process(String script, @Nullable ProcessOptions processOptions) {
        return processAsync(script, processOptions).result();
    }

    public ProcessHandle processAsync(String script) {
        return processAsync(script, null);
    }

    /**
     * Start a script execution and return the in-flight handle.
     */
    public ProcessHandle processAsync(String script, @Nullable ProcessOptions processOptions) {
        ProcessOptions opts = processOptions != null ? processOptions : ProcessOptions.builder().build();

        ObjectNode params = mapper().createObjectNode();
        params.put("script", script);
        if (opts.getFilePath() != null) {
            params.put("filePath", opts.getFilePath());
        }
        if (opts.getPayload() != null) {
            params.set("payload", toTree(opts.getPayload()));
        }
        putCommonParams(params, opts.getState(), opts.getDynamicModules(), opts.getDynamicModuleSource(),
                opts.getMode() != null ? opts.getMode().getValue() : null, opts.getAllowAbsolutePaths());

        Duration timeout = effectiveTimeout(opts.getTimeout());
        PendingCall call = startRequest(LiveProtocol.METHOD_PROCESS, params);
        return new ProcessHandle(this, call, timeout);
    }

    /**
     * Run a file and return its structured result.
     */
    public ExecuteResult execute(String filepath) {
        return execute(filepath, null, null);
    }

    public ExecuteResult execute(String filepath, @Nullable Object payload) {
        return execute(filepath, payload, null);
    }

    public ExecuteResult execute(String filepath, @Nullable Object payload, @Nullable ExecuteOptions executeOptions) {
        return executeAsync(filepath, payload, executeOptions).result();
    }

    public ExecuteHandle executeAsync(String filepath, @Nullable Object payload) {
        return executeAsync(filepath, payload, null);
    }

    /**
     * Start a file execution and return the in-flight handle.
     *
     * @param payload any value Jackson can serialize, injected as {@code @payload}
     */
    public ExecuteHandle executeAsync(String filepath, @Nullable Object payload, @Nullable ExecuteOptions executeOptions) {
        ExecuteOptions opts = executeOptions != null ? executeOptions : ExecuteOptions.builder().build();

        ObjectNode params = mapper().createObjectNode();
        params.put("filepath", filepath);
        if (payload != null) {
            params.set("payload", toTree(payload));
        }
        putCommonParams(params, opts.getState(), opts.getDynamicModules(), opts.getDynamicModuleSource(),
                opts.getMode() != null ? opts.getMode().getValue() : null, opts.getAllowAbsolutePaths());

        Duration timeout = effectiveTimeout(opts.getTimeout());
        PendingCall call = startRequest(LiveProtocol.METHOD_EXECUTE, params);
        return new ExecuteHandle(this, call, timeout);
    }

    /**
     * Statically analyze a module without executing it.
     */
    public AnalyzeResult analyze(String filepath) {
        return analyzeAsync(filepath).result();
    }

    public AnalyzeHandle analyzeAsync(String filepath) {
        ObjectNode params = mapper().createObjectNode();
        params.put("filepath", filepath);
        PendingCall call = startRequest(LiveProtocol.METHOD_ANALYZE, params);
        return new AnalyzeHandle(this, call, options.getTimeout(), filepath);
    }

    /**
     * Stop the worker process. A later request starts a new one.
     */
    @Override
    public void close() {
        sessions.close();
    }

    PendingCall startRequest(String method, JsonNode params) {
        long requestId = nextRequestId.getAndIncrement();
        return sessions.dispatch(requestId, id -> protocol.encodeRequest(id, method, params));
    }

    CompletedRequest awaitRequest(PendingCall call, @Nullable Duration timeout) {
        long start = System.nanoTime();
        long timeoutNanos = timeout != null ? Timeouts.toNanos(timeout) : 0;
        List<StateWrite> stateWriteEvents = new ArrayList<>();
        ResponseChannel channel = call.getChannel();

        while (true) {
            TransportMessage message;
            try {
                if (timeout != null) {
                    long remaining = timeoutNanos - (System.nanoTime() - start);
                    if (remaining <= 0) {
                        throw abandonOnTimeout(call, timeout);
                    }
                    message = channel.receive(remaining, TimeUnit.NANOSECONDS);
                    if (message == null) {
                        throw abandonOnTimeout(call, timeout);
                    }
                } else {
                    message = channel.receive();
                }
            } catch (ResponseChannel.DisconnectedException e) {
                sessions.invalidate(call.getTransport());
                throw new TransportException("live transport disconnected", e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                call.getTransport().remove(call.getRequestId());
                throw new TransportException("Interrupted while waiting for request " + call.getRequestId(), e);
            }

            if (message instanceof TransportMessage.Event) {
                JsonNode event = ((TransportMessage.Event) message).getPayload();
                protocol.stateWriteFromEvent(event).ifPresent(stateWriteEvents::add);
            } else if (message instanceof TransportMessage.Result) {
                JsonNode result = ((TransportMessage.Result) message).getPayload();
                JsonNode error = result.get("error");
                if (error != null) {
                    throw protocol.errorFromPayload(error);
                }
                return new CompletedRequest(result, stateWriteEvents);
            } else if (message instanceof TransportMessage.Closed) {
                sessions.invalidate(call.getTransport());
                throw new TransportException(((TransportMessage.Closed) message).getReason());
            }
        }
    }

    void cancelRequest(PendingCall call) {
        try {
            call.getTransport().send(protocol.encodeCancel(call.getRequestId()));
        } catch (TransportException e) {
            logger.debug("Could not send cancel for request {}", call.getRequestId(), e);
        }
    }

    void updateStateRequest(long requestId, String path, JsonNode value, @Nullable Duration timeout) {
        stateUpdates.update(requestId, path, value, timeout);
    }

    SessionManager sessions() {
        return sessions;
    }

    ObjectMapper mapper() {
        return protocol.getObjectMapper();
    }

    StateWriteMerger stateWriteMerger() {
        return stateWriteMerger;
    }

    JsonNode toTree(@Nullable Object value) {
        if (value == null) {
            return NullNode.getInstance();
        }
        if (value instanceof JsonNode) {
            return (JsonNode) value;
        }
        return mapper().valueToTree(value);
    }

    private JsonNode request(String method, ObjectNode params, @Nullable Duration timeout) {
        PendingCall call = startRequest(method, params);
        return awaitRequest(call, timeout).getPayload();
    }

    private RequestTimeoutException abandonOnTimeout(PendingCall call, Duration timeout) {
        cancelRequest(call);
        call.getTransport().remove(call.getRequestId());
        return new RequestTimeoutException(call.getRequestId(), timeout);
    }

    @Nullable
    private Duration effectiveTimeout(@Nullable Duration override) {
        return override != null ? override : options.getTimeout();
    }

    private void putCommonParams(
            ObjectNode params,
            @Nullable Object state,
            @Nullable Map<String, Object> dynamicModules,
            @Nullable String dynamicModuleSource,
            @Nullable String mode,
            @Nullable Boolean allowAbsolutePaths
    ) {
        if (state != null) {
            params.set("state", toTree(state));
        }
        if (dynamicModules != null && !dynamicModules.isEmpty()) {
            params.set("dynamicModules", toTree(dynamicModules));
        }
        if (dynamicModuleSource != null) {
            params.put("dynamicModuleSource", dynamicModuleSource);
        }
        if (mode != null) {
            params.put("mode", mode);
        }
        if (allowAbsolutePaths != null) {
            params.put("allowAbsolutePaths", allowAbsolutePaths);
        }
    }
}
