package com.deepansh.billbot.session;

import com.deepansh.billbot.exception.SessionConflictException;
import com.deepansh.billbot.streaming.EventSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live sessions by id, so that stop requests arriving on another HTTP call can
 * reach the running loop's cancellation token.
 */
@Component
@Slf4j
public class SessionRegistry {

    private final Map<String, SearchSession> sessions = new ConcurrentHashMap<>();

    /** @throws SessionConflictException if a session with the same id is still running */
    public void register(SearchSession session) {
        SearchSession existing = sessions.putIfAbsent(session.getSessionId(), session);
        if (existing != null) {
            throw new SessionConflictException(session.getSessionId());
        }
        log.debug("Session registered {}", session);
    }

    public Optional<SearchSession> get(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public boolean isActive(String sessionId) {
        return sessions.containsKey(sessionId);
    }

    /**
     * Cancels the session if it belongs to the given connection.
     *
     * @return true if a running session was found and cancelled
     */
    public boolean cancel(String sessionId, String connectionId) {
        SearchSession session = sessions.get(sessionId);
        if (session == null) return false;
        if (!session.getConnectionId().equals(connectionId)) {
            log.warn("Stop rejected, connection mismatch [sessionId={}, connectionId={}]", sessionId, connectionId);
            return false;
        }
        boolean flipped = session.cancel();
        log.info("Session cancel requested {} (alreadyCancelled={})", session, !flipped);
        return true;
    }

    /**
     * Cancels the sessions writing to {@code sink}. Sessions on the same
     * connection id but bound to a newer stream are left running.
     *
     * @return how many sessions were cancelled
     */
    public int cancelAllForSink(EventSink sink) {
        int count = 0;
        for (SearchSession session : sessions.values()) {
            if (session.getSink() == sink && session.cancel()) {
                count++;
            }
        }
        if (count > 0) {
            log.info("Cancelled {} session(s) for closed stream [connectionId={}]", count, sink.connectionId());
        }
        return count;
    }

    /** Removes exactly this session; a newer session reusing the id stays. */
    public void remove(SearchSession session) {
        sessions.remove(session.getSessionId(), session);
    }

    public List<String> activeSessionIds() {
        return List.copyOf(sessions.keySet());
    }

    public int activeCount() {
        return sessions.size();
    }

    public void cancelAll() {
        sessions.values().forEach(SearchSession::cancel);
    }
}
