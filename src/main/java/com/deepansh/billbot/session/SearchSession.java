package com.deepansh.billbot.session;

import com.deepansh.billbot.model.SearchIteration;
import com.deepansh.billbot.streaming.EventSink;
import lombok.Getter;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * One user query from submission to stream completion.
 * Iterations are append-only and readable from any thread.
 */
@Getter
public class SearchSession {

    private final String sessionId;
    private final String connectionId;
    private final String messageId;
    private final String originalQuery;
    private final Instant createdAt;
    private final CancellationToken cancellationToken = new CancellationToken();
    private final List<SearchIteration> iterations = new CopyOnWriteArrayList<>();
    /** The stream this session writes to; null when not bound to one */
    private final EventSink sink;

    public SearchSession(String sessionId, String connectionId, String messageId,
                         String originalQuery, Instant createdAt) {
        this(sessionId, connectionId, messageId, originalQuery, createdAt, null);
    }

    public SearchSession(String sessionId, String connectionId, String messageId,
                         String originalQuery, Instant createdAt, EventSink sink) {
        this.sessionId = sessionId;
        this.connectionId = connectionId;
        this.messageId = messageId;
        this.originalQuery = originalQuery;
        this.createdAt = createdAt;
        this.sink = sink;
    }

    public void recordIteration(SearchIteration iteration) {
        iterations.add(iteration);
    }

    public List<SearchIteration> getIterations() {
        return Collections.unmodifiableList(iterations);
    }

    public int iterationCount() {
        return iterations.size();
    }

    public boolean isCancelled() {
        return cancellationToken.isCancelled();
    }

    public boolean cancel() {
        return cancellationToken.cancel();
    }

    @Override
    public String toString() {
        return "[sessionId=" + sessionId + ", connectionId=" + connectionId + "]";
    }
}
