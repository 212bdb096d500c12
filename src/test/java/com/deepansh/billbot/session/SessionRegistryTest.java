package com.deepansh.billbot.session;

import com.deepansh.billbot.exception.SessionConflictException;
import com.deepansh.billbot.streaming.RecordingEventSink;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionRegistryTest {

    private final SessionRegistry registry = new SessionRegistry();

    private static SearchSession session(String sessionId, String connectionId) {
        return new SearchSession(sessionId, connectionId, "msg-1", "clean water", Instant.EPOCH);
    }

    @Test
    void register_duplicateId_throwsConflict() {
        registry.register(session("s1", "c1"));

        assertThatThrownBy(() -> registry.register(session("s1", "c2")))
                .isInstanceOf(SessionConflictException.class);
        assertThat(registry.get("s1")).get().extracting(SearchSession::getConnectionId).isEqualTo("c1");
    }

    @Test
    void cancel_matchingConnection_flipsToken() {
        SearchSession s = session("s1", "c1");
        registry.register(s);

        assertThat(registry.cancel("s1", "c1")).isTrue();
        assertThat(s.isCancelled()).isTrue();
        // repeated stop still reports the session as found
        assertThat(registry.cancel("s1", "c1")).isTrue();
    }

    @Test
    void cancel_otherConnection_isRejected() {
        SearchSession s = session("s1", "c1");
        registry.register(s);

        assertThat(registry.cancel("s1", "c2")).isFalse();
        assertThat(s.isCancelled()).isFalse();
    }

    @Test
    void cancel_unknownSession_returnsFalse() {
        assertThat(registry.cancel("missing", "c1")).isFalse();
    }

    @Test
    void cancelAllForSink_onlyTouchesSessionsOnThatStream() {
        RecordingEventSink oldStream = new RecordingEventSink("c1");
        RecordingEventSink newStream = new RecordingEventSink("c1");
        SearchSession a = new SearchSession("s1", "c1", "msg-1", "water", Instant.EPOCH, oldStream);
        SearchSession b = new SearchSession("s2", "c1", "msg-2", "water", Instant.EPOCH, oldStream);
        SearchSession reopened = new SearchSession("s3", "c1", "msg-3", "water", Instant.EPOCH, newStream);
        registry.register(a);
        registry.register(b);
        registry.register(reopened);

        assertThat(registry.cancelAllForSink(oldStream)).isEqualTo(2);
        assertThat(a.isCancelled()).isTrue();
        assertThat(b.isCancelled()).isTrue();
        assertThat(reopened.isCancelled()).isFalse();
        assertThat(registry.cancelAllForSink(oldStream)).isZero();
    }

    @Test
    void remove_staleInstance_keepsNewerSessionWithSameId() {
        SearchSession old = session("s1", "c1");
        registry.register(old);
        registry.remove(old);
        SearchSession fresh = session("s1", "c2");
        registry.register(fresh);

        registry.remove(old);

        assertThat(registry.get("s1")).containsSame(fresh);
        registry.remove(fresh);
        assertThat(registry.isActive("s1")).isFalse();
        assertThat(registry.activeCount()).isZero();
    }

    @Test
    void cancelAll_cancelsEverySession() {
        SearchSession a = session("s1", "c1");
        SearchSession b = session("s2", "c2");
        registry.register(a);
        registry.register(b);

        registry.cancelAll();

        assertThat(a.isCancelled()).isTrue();
        assertThat(b.isCancelled()).isTrue();
        assertThat(registry.activeSessionIds()).containsExactlyInAnyOrder("s1", "s2");
    }
}
