package com.mlld.sdk.client;

import com.mlld.sdk.exceptions.RequestTimeoutException;
import com.mlld.sdk.exceptions.TransportException;
import com.mlld.sdk.exceptions.WorkerException;
import com.mlld.sdk.testing.FakeWorkers;
import com.mlld.sdk.transport.LiveTransport;
import com.mlld.sdk.types.analysis.AnalyzeResult;
import com.mlld.sdk.types.options.ClientOptions;
import com.mlld.sdk.types.options.ExecuteOptions;
import com.mlld.sdk.types.options.ProcessOptions;
import com.mlld.sdk.types.results.ExecuteResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * End-to-end tests over a real worker subprocess speaking the live protocol.
 */
@Tag("integration")
class MlldClientIntegrationTest {

    private final List<String> stderrLines = new CopyOnWriteArrayList<>();
    private MlldClient client;

    @BeforeEach
    void setUp() {
        client = new MlldClient(FakeWorkers.options()
                .timeout(Duration.ofSeconds(10))
                .stderr(stderrLines::add)
                .build());
    }

    @AfterEach
    void tearDown() {
        client.close();
    }

    @Test
    @DisplayName("Should inject state and report the state write made by the script")
    void process_shouldReturnOutputAndStateWrite() {
        ProcessHandle handle = client.processAsync("increment count",
                ProcessOptions.builder().state(Map.of("count", 1)).build());

        assertThat(handle.result()).isEqualTo("count=2");
        assertThat(handle.getStateWriteEvents()).hasSize(1);
        assertThat(handle.getStateWriteEvents().get(0).getPath()).isEqualTo("count");
        assertThat(handle.getStateWriteEvents().get(0).getValue().asInt()).isEqualTo(2);
        assertThat(handle.getStateWriteEvents().get(0).getTimestamp()).isNotBlank();
    }

    @Test
    @DisplayName("Should stop a waiting script through a state update sent before it is updatable")
    void updateState_shouldReachRunningScript() {
        ProcessHandle handle = client.processAsync("wait-for exit",
                ProcessOptions.builder().state(Map.of("exit", false)).build());

        handle.updateState("exit", true);

        assertThat(handle.result()).isEqualTo("loop-stopped");
    }

    @Test
    @DisplayName("Should fail a state update for a finished request once the deadline passes")
    void updateState_shouldFailAfterCompletion() {
        ProcessHandle handle = client.processAsync("echo done",
                ProcessOptions.builder().timeout(Duration.ofSeconds(1)).build());
        assertThat(handle.result()).isEqualTo("done");

        long start = System.nanoTime();
        assertThatThrownBy(() -> handle.updateState("exit", true))
                .isInstanceOf(WorkerException.class)
                .hasMessageContaining("No active request for id " + handle.getRequestId())
                .satisfies(e -> assertThat(((WorkerException) e).isRequestNotFound()).isTrue());
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isGreaterThanOrEqualTo(Duration.ofSeconds(1));
    }

    @Test
    @DisplayName("Should reject a blank state path without contacting the worker")
    void updateState_shouldRejectBlankPath() {
        ProcessHandle handle = client.processAsync("sleep 200");

        assertThatThrownBy(() -> handle.updateState(" ", true))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("state update path is required");
        assertThat(handle.result()).isEqualTo("slept");
    }

    @Test
    @DisplayName("Should keep a timed-out request from affecting concurrent ones")
    void timeout_shouldIsolateRequests() {
        String pid = client.process("pid");
        ProcessHandle slow = client.processAsync("sleep 5000",
                ProcessOptions.builder().timeout(Duration.ofMillis(300)).build());
        ProcessHandle steady = client.processAsync("sleep 600");

        assertThatThrownBy(slow::result)
                .isInstanceOf(RequestTimeoutException.class)
                .satisfies(e -> assertThat(((RequestTimeoutException) e).getTimeout()).isEqualTo(Duration.ofMillis(300)));
        assertThat(steady.result()).isEqualTo("slept");
        assertThat(client.process("pid")).isEqualTo(pid);
    }

    @Test
    @DisplayName("Should stop an in-flight request on cancel")
    void cancel_shouldAbortRunningRequest() {
        ProcessHandle handle = client.processAsync("sleep 10000");

        handle.cancel();

        assertThatThrownBy(handle::result)
                .isInstanceOf(WorkerException.class)
                .satisfies(e -> assertThat(((WorkerException) e).getCode()).isEqualTo("ABORTED"));
        handle.cancel();
        assertThat(client.process("echo after cancel")).isEqualTo("after cancel");
    }

    @Test
    @DisplayName("Should keep a cancelled request from affecting concurrent ones")
    void cancel_shouldIsolateRequests() {
        String pid = client.process("pid");
        ProcessHandle cancelled = client.processAsync("sleep 10000");
        ProcessHandle steady = client.processAsync("sleep 500");

        cancelled.cancel();

        assertThatThrownBy(cancelled::result)
                .isInstanceOf(WorkerException.class)
                .satisfies(e -> assertThat(((WorkerException) e).getCode()).isEqualTo("ABORTED"));
        assertThat(steady.result()).isEqualTo("slept");
        assertThat(client.process("pid")).isEqualTo(pid);
    }

    @Test
    @DisplayName("Should fail every in-flight request with stderr context when the worker dies")
    void workerDeath_shouldFailPendingAndRespawn() {
        String firstPid = client.process("pid");
        ProcessHandle first = client.processAsync("sleep 10000");
        ProcessHandle second = client.processAsync("sleep 10000");
        ProcessHandle crash = client.processAsync("crash");

        for (ProcessHandle handle : List.of(first, second, crash)) {
            assertThatThrownBy(handle::result)
                    .isInstanceOf(TransportException.class)
                    .hasMessageContaining("worker crashed");
        }
        assertThat(stderrLines).contains("worker crashed: fatal");

        ProcessHandle next = client.processAsync("pid");
        assertThat(next.getRequestId()).isGreaterThan(crash.getRequestId());
        assertThat(next.result()).isNotEqualTo(firstPid);
    }

    @Test
    @DisplayName("Should keep request ids increasing across worker restarts")
    void requestIds_shouldIncreaseAcrossRestarts() {
        ProcessHandle before = client.processAsync("echo one");
        before.result();
        client.close();
        ProcessHandle after = client.processAsync("echo two");

        assertThat(after.getRequestId()).isGreaterThan(before.getRequestId());
        assertThat(after.result()).isEqualTo("two");
    }

    @Test
    @DisplayName("Should keep using the worker after a malformed line while idle")
    void malformedLine_shouldNotStopIdleSession() {
        String pid = client.process("pid");
        assertThat(client.process("garbage-after")).isEqualTo("ok");

        LiveTransport session = (LiveTransport) client.sessions().currentTransport();
        await().during(Duration.ofMillis(200)).atMost(Duration.ofSeconds(2)).until(session::isRunning);

        assertThat(client.process("pid")).isEqualTo(pid);
    }

    @Test
    @DisplayName("Should fail a pending request when a malformed line arrives")
    void malformedLine_shouldFailPendingRequest() {
        assertThatThrownBy(() -> client.process("garbage-before"))
                .isInstanceOf(TransportException.class)
                .hasMessageStartingWith("invalid live response");

        assertThat(client.process("echo recovered")).isEqualTo("recovered");
    }

    @Test
    @DisplayName("Should surface worker errors with their code")
    void process_shouldRaiseWorkerError() {
        assertThatThrownBy(() -> client.process("fail"))
                .isInstanceOf(WorkerException.class)
                .hasMessage("boom")
                .satisfies(e -> assertThat(((WorkerException) e).getCode()).isEqualTo("RUNTIME_ERROR"));
    }

    @Test
    @DisplayName("Should correlate events and results that carry string ids")
    void process_shouldAcceptStringIds() {
        ProcessHandle handle = client.processAsync("events");

        assertThat(handle.result()).isEqualTo("42");
        assertThat(handle.getStateWriteEvents()).extracting("path").containsExactly("status");
    }

    @Test
    @DisplayName("Should return the same outcome from repeated waits")
    void execute_shouldBeIdempotentAcrossWaits() {
        ExecuteHandle handle = client.executeAsync("./agent.mld", Map.of("text", "hello"));

        ExecuteResult first = handle.result();
        ExecuteResult second = handle.result();

        assertThat(second).isEqualTo(first);
        assertThat(second.getStateWrites()).isEqualTo(first.getStateWrites());
    }

    @Test
    @DisplayName("Should merge embedded and streamed state writes without duplicates")
    void execute_shouldReturnStructuredResult() {
        ExecuteResult result = client.execute("./agent.mld", Map.of("text", "hello"),
                ExecuteOptions.builder().state(Map.of("count", 0)).build());

        assertThat(result.getOutput()).isEqualTo("ran ./agent.mld with hello");
        assertThat(result.getStateWrites()).extracting("path").containsExactly("count", "seen");
        assertThat(result.getExports().get("answer").asInt()).isEqualTo(42);
        assertThat(result.getEffects()).extracting("type").containsExactly("doc");
        assertThat(result.getMetrics().getEvaluateMs()).isEqualTo(2.5);
    }

    @Test
    @DisplayName("Should fall back to text output for an unexpected execute result")
    void execute_shouldFallBackForUnexpectedShape() {
        ExecuteResult result = client.execute("./odd-shape.mld");

        assertThat(result.getOutput()).contains("partial");
        assertThat(result.getStateWrites()).isEmpty();
    }

    @Test
    @DisplayName("Should analyze a module without executing it")
    void analyze_shouldReturnModuleInformation() {
        AnalyzeResult result = client.analyze("./module.mld");

        assertThat(result.getFilepath()).isEqualTo("./module.mld");
        assertThat(result.isValid()).isTrue();
        assertThat(result.getExecutables()).extracting("name").containsExactly("greet");
        assertThat(result.getExports()).containsExactly("greet");
        assertThat(result.getImports().get(0).getFrom()).isEqualTo("@config");
        assertThat(result.getNeeds().getCmd()).containsExactly("git");
    }

    @Test
    @DisplayName("Should serve concurrent requests over one worker")
    void process_shouldMultiplexConcurrentRequests() {
        String pid = client.process("pid");
        ProcessHandle slow = client.processAsync("sleep 400");
        ProcessHandle fast = client.processAsync("echo fast");
        ExecuteHandle execute = client.executeAsync("./agent.mld", Map.of("text", "x"));

        assertThat(fast.result()).isEqualTo("fast");
        assertThat(slow.isDone()).isFalse();
        assertThat(execute.result().getOutput()).isEqualTo("ran ./agent.mld with x");
        assertThat(slow.result()).isEqualTo("slept");
        assertThat(client.process("pid")).isEqualTo(pid);
    }

    @Test
    @DisplayName("Should fail to start when the command does not exist")
    void process_shouldReportSpawnFailure() {
        try (MlldClient broken = new MlldClient(ClientOptions.builder()
                .command("/nonexistent/mlld-binary-for-tests")
                .build())) {
            assertThatThrownBy(() -> broken.process("show 1"))
                    .isInstanceOf(TransportException.class)
                    .hasMessageStartingWith("Failed to start mlld live transport");
        }
    }
}
