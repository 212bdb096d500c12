package com.deepansh.billbot.session;

import com.deepansh.billbot.config.StreamingProperties;
import com.deepansh.billbot.exception.BillBotException;
import com.deepansh.billbot.exception.SessionConflictException;
import com.deepansh.billbot.exception.ValidationException;
import com.deepansh.billbot.exception.WorkerUnavailableException;
import com.deepansh.billbot.model.CompletionReason;
import com.deepansh.billbot.model.SearchOptions;
import com.deepansh.billbot.model.StopResult;
import com.deepansh.billbot.search.SearchLoop;
import com.deepansh.billbot.streaming.EventChannel;
import com.deepansh.billbot.streaming.EventStreamMultiplexer;
import com.deepansh.billbot.streaming.RecordingEventSink;
import com.deepansh.billbot.tool.ToolRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SearchSessionServiceTest {

    @Mock
    private SearchLoop searchLoop;

    @Mock
    private ToolRegistry toolRegistry;

    private final Clock clock = Clock.fixed(Instant.parse("2024-03-01T12:00:00Z"), ZoneOffset.UTC);
    private final List<Runnable> queued = new ArrayList<>();

    private SessionRegistry sessionRegistry;
    private EventStreamMultiplexer multiplexer;

    @BeforeEach
    void setUp() {
        sessionRegistry = new SessionRegistry();
        multiplexer = new EventStreamMultiplexer(new StreamingProperties(), clock);
    }

    private SearchSessionService service(TaskExecutor executor) {
        return new SearchSessionService(searchLoop, sessionRegistry, multiplexer, toolRegistry, executor, clock);
    }

    private SearchSessionService queueingService() {
        return service(queued::add);
    }

    @Test
    void startSession_blankQuery_throwsValidation() {
        SearchSessionService service = queueingService();

        assertThatThrownBy(() -> service.startSession("  ", "s1", new RecordingEventSink("c1"), null))
                .isInstanceOf(ValidationException.class);
        verifyNoInteractions(toolRegistry);
    }

    @Test
    void startSession_missingIds_throwsValidation() {
        SearchSessionService service = queueingService();

        assertThatThrownBy(() -> service.startSession("water", "", new RecordingEventSink("c1"), null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.startSession("water", "s1", new RecordingEventSink(" "), null))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void startSession_workerUnavailable_registersNothing() {
        doThrow(new WorkerUnavailableException("worker suspended")).when(toolRegistry).ensureReady();
        SearchSessionService service = queueingService();

        assertThatThrownBy(() -> service.startSession("water", "s1", new RecordingEventSink("c1"), null))
                .isInstanceOf(WorkerUnavailableException.class);
        assertThat(sessionRegistry.activeCount()).isZero();
        assertThat(queued).isEmpty();
    }

    @Test
    void startSession_runsLoopInBackgroundAndRemovesSessionAfterwards() {
        RecordingEventSink sink = new RecordingEventSink("c1");
        SearchOptions options = SearchOptions.defaults();
        when(searchLoop.run(any(), eq(options), eq(sink))).thenReturn(CompletionReason.NO_NEW_RESULTS);
        SearchSessionService service = queueingService();

        SearchSession session = service.startSession("  clean water  ", "s1", sink, options);

        assertThat(session.getOriginalQuery()).isEqualTo("clean water");
        assertThat(session.getConnectionId()).isEqualTo("c1");
        assertThat(session.getSink()).isSameAs(sink);
        assertThat(session.getMessageId()).startsWith("msg-");
        assertThat(session.getCreatedAt()).isEqualTo(clock.instant());
        assertThat(service.isActive("s1")).isTrue();
        verify(searchLoop, never()).run(any(), any(), any());

        queued.forEach(Runnable::run);

        verify(searchLoop).run(session, options, sink);
        assertThat(service.isActive("s1")).isFalse();
    }

    @Test
    void startSession_loopThrows_stillRemovesSession() {
        when(searchLoop.run(any(), any(), any())).thenThrow(new IllegalStateException("boom"));
        SearchSessionService service = queueingService();
        service.startSession("water", "s1", new RecordingEventSink("c1"), null);

        assertThatThrownBy(() -> queued.get(0).run()).isInstanceOf(IllegalStateException.class);
        assertThat(service.activeSessionCount()).isZero();
    }

    @Test
    void startSession_duplicateRunningId_throwsConflict() {
        SearchSessionService service = queueingService();
        service.startSession("water", "s1", new RecordingEventSink("c1"), null);

        assertThatThrownBy(() -> service.startSession("air", "s1", new RecordingEventSink("c2"), null))
                .isInstanceOf(SessionConflictException.class);
        assertThat(queued).hasSize(1);
    }

    @Test
    void startSession_poolFull_throwsCapacityAndUnregisters() {
        SearchSessionService service = service(task -> {
            throw new TaskRejectedException("pool full");
        });

        assertThatThrownBy(() -> service.startSession("water", "s1", new RecordingEventSink("c1"), null))
                .isInstanceOfSatisfying(BillBotException.class, e -> {
                    assertThat(e.getCode()).isEqualTo(SearchSessionService.CAPACITY_CODE);
                    assertThat(e.isRecoverable()).isTrue();
                });
        assertThat(sessionRegistry.isActive("s1")).isFalse();
    }

    @Test
    void stopSession_running_cancelsAndReports() {
        SearchSessionService service = queueingService();
        SearchSession session = service.startSession("water", "s1", new RecordingEventSink("c1"), null);

        StopResult result = service.stopSession("s1", "c1", false);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getSessionId()).isEqualTo("s1");
        assertThat(result.getConnectionId()).isEqualTo("c1");
        assertThat(result.getStoppedAt()).isEqualTo("2024-03-01T12:00:00Z");
        assertThat(session.isCancelled()).isTrue();
    }

    @Test
    void stopSession_unknownSession_reportsNotFound() {
        StopResult result = queueingService().stopSession("s1", "c1", false);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getMessage()).contains("No active session");
    }

    @Test
    void stopSession_missingConnectionId_throwsValidation() {
        SearchSessionService service = queueingService();

        assertThatThrownBy(() -> service.stopSession("s1", null, false))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void stopSession_closeConnection_closesStream() {
        SearchSessionService service = queueingService();
        EventChannel channel = multiplexer.open("c1");
        service.startSession("water", "s1", channel, null);

        service.stopSession("s1", "c1", true);

        assertThat(channel.isOpen()).isFalse();
        assertThat(multiplexer.isActive("c1")).isFalse();
    }

    @Test
    void clientDisconnect_cancelsSessionsOnThatConnection() {
        SearchSessionService service = queueingService();
        EventChannel channel = multiplexer.open("c1");
        SearchSession session = service.startSession("water", "s1", channel, null);
        SearchSession unrelated = service.startSession("air", "s2", new RecordingEventSink("c2"), null);

        multiplexer.close("c1");

        assertThat(session.isCancelled()).isTrue();
        assertThat(unrelated.isCancelled()).isFalse();
    }

    @Test
    void reopenedConnection_cancelsOnlySessionsOfReplacedStream() {
        SearchSessionService service = queueingService();
        EventChannel first = multiplexer.open("c1");
        SearchSession old = service.startSession("water", "s1", first, null);

        EventChannel second = multiplexer.create("c1");
        SearchSession fresh = service.startSession("air", "s2", second, null);
        multiplexer.attach(second);

        assertThat(first.isOpen()).isFalse();
        assertThat(old.isCancelled()).isTrue();
        assertThat(fresh.isCancelled()).isFalse();
    }

    @Test
    void rejectedDuplicate_leavesRunningSessionAndStreamAlone() {
        SearchSessionService service = queueingService();
        EventChannel first = multiplexer.open("c1");
        SearchSession running = service.startSession("water", "s1", first, null);

        EventChannel attempt = multiplexer.create("c1");
        assertThatThrownBy(() -> service.startSession("water", "s1", attempt, null))
                .isInstanceOf(SessionConflictException.class);
        attempt.close();

        assertThat(running.isCancelled()).isFalse();
        assertThat(first.isOpen()).isTrue();
        assertThat(multiplexer.get("c1")).containsSame(first);
    }

    @Test
    void shutdown_cancelsAllSessions() {
        SearchSessionService service = queueingService();
        SearchSession a = service.startSession("water", "s1", new RecordingEventSink("c1"), null);
        SearchSession b = service.startSession("air", "s2", new RecordingEventSink("c2"), null);

        service.shutdown();

        assertThat(a.isCancelled()).isTrue();
        assertThat(b.isCancelled()).isTrue();
    }
}
