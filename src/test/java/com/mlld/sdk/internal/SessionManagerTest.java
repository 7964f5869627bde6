package com.mlld.sdk.internal;

import com.mlld.sdk.exceptions.TransportException;
import com.mlld.sdk.testing.RecordingTransport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class SessionManagerTest {

    private final List<RecordingTransport> opened = new ArrayList<>();
    private final SessionManager sessions = new SessionManager(() -> {
        RecordingTransport transport = new RecordingTransport();
        opened.add(transport);
        return transport;
    });

    @Test
    @DisplayName("Should start one session lazily and reuse it while it runs")
    void dispatch_shouldReuseLiveSession() {
        assertThat(sessions.currentTransport()).isNull();

        PendingCall first = sessions.dispatch(1, id -> "{\"id\":" + id + "}");
        PendingCall second = sessions.dispatch(2, id -> "{\"id\":" + id + "}");

        assertThat(opened).hasSize(1);
        assertThat(first.getTransport()).isSameAs(second.getTransport());
        assertThat(opened.get(0).sentLines()).containsExactly("{\"id\":1}", "{\"id\":2}");
        assertThat(opened.get(0).registry().contains(1)).isTrue();
        assertThat(first.getChannel().getRequestId()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should replace a session that stopped running")
    void dispatch_shouldRespawnDeadSession() {
        sessions.dispatch(1, id -> "first");
        opened.get(0).die("worker crashed");

        PendingCall call = sessions.dispatch(2, id -> "second");

        assertThat(opened).hasSize(2);
        assertThat(opened.get(0).isClosed()).isTrue();
        assertThat(call.getTransport()).isSameAs(opened.get(1));
    }

    @Test
    @DisplayName("Should unregister the id when the write fails")
    void dispatch_shouldRemoveEntryOnSendFailure() {
        sessions.dispatch(1, id -> "first");
        RecordingTransport transport = opened.get(0);
        transport.failSendsWith(new TransportException("Failed to write to mlld stdin: broken pipe"));

        assertThatThrownBy(() -> sessions.dispatch(2, id -> "second"))
                .isInstanceOf(TransportException.class)
                .hasMessageContaining("broken pipe");
        assertThat(transport.registry().contains(2)).isFalse();
        assertThat(transport.registry().contains(1)).isTrue();
    }

    @Test
    @DisplayName("Should report a factory that produced no session")
    void dispatch_shouldFailWhenFactoryReturnsNull() {
        SessionManager broken = new SessionManager(() -> null);

        assertThatThrownBy(() -> broken.dispatch(1, id -> "line"))
                .isInstanceOf(TransportException.class)
                .hasMessage("failed to initialize transport");
    }

    @Test
    @DisplayName("Should not let a stale session clear its replacement")
    void invalidate_shouldIgnoreReplacedSession() {
        PendingCall stale = sessions.dispatch(1, id -> "first");
        opened.get(0).die("worker crashed");
        PendingCall fresh = sessions.dispatch(2, id -> "second");

        sessions.invalidate(stale.getTransport());

        assertThat(sessions.currentTransport()).isSameAs(fresh.getTransport());
        assertThat(opened.get(1).isClosed()).isFalse();
    }

    @Test
    @DisplayName("Should clear and close the current session on invalidate")
    void invalidate_shouldCloseCurrentSession() {
        PendingCall call = sessions.dispatch(1, id -> "first");

        sessions.invalidate(call.getTransport());

        assertThat(sessions.currentTransport()).isNull();
        assertThat(opened.get(0).isClosed()).isTrue();
    }

    @Test
    @DisplayName("Should close the session and start a new one on next use")
    void close_shouldAllowRestart() {
        sessions.dispatch(1, id -> "first");

        sessions.close();
        sessions.close();
        sessions.dispatch(2, id -> "second");

        assertThat(opened).hasSize(2);
        assertThat(opened.get(0).isClosed()).isTrue();
    }
}
