package com.mlld.sdk.client;

import com.mlld.sdk.internal.PendingCall;

import com.mlld.sdk.types.results.StateWrite;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-flight request started by one of the {@code *Async} methods of {@link MlldClient}.
 *
 * <p>The first {@link #result()} blocks until the request finishes and caches the
 * raw outcome; later calls decode the cached payload again (or rethrow the cached
 * failure) without touching the transport, so every call returns its own copy.
 * A handle must not be awaited from two threads at once.
 *
 * @param <T> decoded result type
 */
public abstract class RequestHandle<T> {

    private final MlldClient client;
    private final PendingCall call;
    @Nullable
    private final Duration timeout;
    private final AtomicBoolean receiverTaken = new AtomicBoolean(false);

    private volatile CompletedRequest completed;
    private volatile RuntimeException failure;

    RequestHandle(MlldClient client, PendingCall call, @Nullable Duration timeout) {
        this.client = client;
        this.call = call;
        this.timeout = timeout;
    }

    /**
     * Live request identifier.
     */
    public long getRequestId() {
        return call.getRequestId();
    }

    /**
     * Effective timeout of this request, or {@code null} for none.
     */
    @Nullable
    public Duration getTimeout() {
        return timeout;
    }

    /**
     * Ask the worker to stop this request. Fire-and-forget; safe after completion.
     */
    public void cancel() {
        client.cancelRequest(call);
    }

    /**
     * Whether a terminal outcome has been received and cached.
     */
    public boolean isDone() {
        return completed != null || failure != null;
    }

    /**
     * Wait for completion. Same as {@link #result()}.
     */
    public T await() {
        return result();
    }

    /**
     * Wait for completion and return the decoded result.
     *
     * @throws com.mlld.sdk.exceptions.WorkerException           if the worker reported an error
     * @throws com.mlld.sdk.exceptions.RequestTimeoutException   if the timeout elapsed
     * @throws com.mlld.sdk.exceptions.TransportException        if the worker disconnected
     * @throws IllegalStateException if another thread is already waiting on this handle
     */
    public final T result() {
        return decode(awaitRaw());
    }

    /**
     * State writes streamed as {@code state:write} events while the request ran,
     * in arrival order. Waits for completion like {@link #result()}.
     */
    public List<StateWrite> getStateWriteEvents() {
        return awaitRaw().getStateWrites();
    }

    protected abstract T decode(CompletedRequest completedRequest);

    MlldClient client() {
        return client;
    }

    void sendStateUpdate(String path, Object value) {
        client.updateStateRequest(getRequestId(), path, client.toTree(value), timeout);
    }

    private CompletedRequest awaitRaw() {
        CompletedRequest cached = completed;
        if (cached != null) {
            return cached;
        }
        RuntimeException failed = failure;
        if (failed != null) {
            throw failed;
        }

        if (!receiverTaken.compareAndSet(false, true)) {
            throw new IllegalStateException("request handle already awaited");
        }

        try {
            CompletedRequest result = client.awaitRequest(call, timeout);
            completed = result;
            return result;
        } catch (RuntimeException e) {
            failure = e;
            throw e;
        }
    }
}
