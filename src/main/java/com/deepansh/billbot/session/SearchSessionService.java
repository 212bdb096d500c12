package com.deepansh.billbot.session;

import com.deepansh.billbot.exception.BillBotException;
import com.deepansh.billbot.exception.ValidationException;
import com.deepansh.billbot.model.SearchOptions;
import com.deepansh.billbot.model.StopResult;
import com.deepansh.billbot.search.SearchLoop;
import com.deepansh.billbot.streaming.EventStreamMultiplexer;
import com.deepansh.billbot.streaming.EventSink;
import com.deepansh.billbot.tool.ToolRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Entry point used by the HTTP layer: starts sessions in the background and
 * stops them on request.
 *
 * Everything that can make a session impossible (blank query, missing ids,
 * duplicate session id, worker down, pool full) is thrown synchronously before
 * any event is streamed.
 */
@Service
@Slf4j
public class SearchSessionService {

    /** Code used when the session pool is full. */
    public static final String CAPACITY_CODE = "CAPACITY_EXCEEDED";

    private final SearchLoop searchLoop;
    private final SessionRegistry sessionRegistry;
    private final EventStreamMultiplexer multiplexer;
    private final ToolRegistry toolRegistry;
    private final TaskExecutor executor;
    private final Clock clock;

    public SearchSessionService(SearchLoop searchLoop,
                                SessionRegistry sessionRegistry,
                                EventStreamMultiplexer multiplexer,
                                ToolRegistry toolRegistry,
                                @Qualifier("searchTaskExecutor") TaskExecutor executor,
                                Clock clock) {
        this.searchLoop = searchLoop;
        this.sessionRegistry = sessionRegistry;
        this.multiplexer = multiplexer;
        this.toolRegistry = toolRegistry;
        this.executor = executor;
        this.clock = clock;

        multiplexer.onDisconnect(sessionRegistry::cancelAllForSink);
    }

    /**
     * Fire-and-forget: returns the started session; results arrive through {@code sink}.
     *
     * @throws ValidationException on a blank query or missing ids
     * @throws com.deepansh.billbot.exception.SessionConflictException if the session id is already running
     * @throws com.deepansh.billbot.exception.WorkerUnavailableException if the tool worker cannot be started
     * @throws BillBotException with {@link #CAPACITY_CODE} when no session slot is free
     */
    public SearchSession startSession(String query, String sessionId, EventSink sink, SearchOptions options) {
        if (query == null || query.isBlank()) {
            throw new ValidationException("Message is required");
        }
        if (sessionId == null || sessionId.isBlank()) {
            throw new ValidationException("Session id is required");
        }
        if (sink == null || sink.connectionId() == null || sink.connectionId().isBlank()) {
            throw new ValidationException("Connection id is required");
        }

        toolRegistry.ensureReady();

        SearchSession session = new SearchSession(sessionId, sink.connectionId(), "msg-" + UUID.randomUUID(),
                query.trim(), Instant.now(clock), sink);
        sessionRegistry.register(session);

        try {
            executor.execute(() -> runSession(session, options, sink));
        } catch (TaskRejectedException e) {
            sessionRegistry.remove(session);
            log.warn("Session rejected, pool full {}", session);
            throw new BillBotException("Too many searches in progress, try again shortly", CAPACITY_CODE, true, e);
        }

        log.info("Session started {}", session);
        return session;
    }

    private void runSession(SearchSession session, SearchOptions options, EventSink sink) {
        try {
            searchLoop.run(session, options, sink);
        } finally {
            sessionRegistry.remove(session);
        }
    }

    /**
     * Cancels a running session. The loop notices at its next checkpoint and
     * still ends the stream with a cancelled end event, unless
     * {@code closeConnection} tears the stream down right away.
     */
    public StopResult stopSession(String sessionId, String connectionId, boolean closeConnection) {
        if (sessionId == null || sessionId.isBlank() || connectionId == null || connectionId.isBlank()) {
            throw new ValidationException("Session id and connection id are required");
        }

        boolean stopped = sessionRegistry.cancel(sessionId, connectionId);
        if (closeConnection) {
            multiplexer.close(connectionId);
        }

        return StopResult.builder()
                .success(stopped)
                .message(stopped ? "Session stop requested" : "No active session found for this connection")
                .stoppedAt(Instant.now(clock).toString())
                .sessionId(sessionId)
                .connectionId(connectionId)
                .build();
    }

    public boolean isActive(String sessionId) {
        return sessionRegistry.isActive(sessionId);
    }

    public int activeSessionCount() {
        return sessionRegistry.activeCount();
    }

    @PreDestroy
    public void shutdown() {
        int active = sessionRegistry.activeCount();
        if (active > 0) {
            log.info("Shutting down, cancelling {} active session(s)", active);
        }
        sessionRegistry.cancelAll();
    }
}
