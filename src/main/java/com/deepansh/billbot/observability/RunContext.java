package com.deepansh.billbot.observability;

import com.deepansh.billbot.model.CompletionReason;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-session measurements, collected while the search loop runs and logged
 * as one summary line when it ends. Owned by the session's own thread.
 */
@Slf4j
@Getter
public class RunContext {

    private final String sessionId;
    private final String connectionId;
    private final long startTimeMs = System.currentTimeMillis();
    private final List<ToolCallRecord> toolCallRecords = new ArrayList<>();

    private int retries;
    private int citationsEmitted;
    private int answerChunks;

    public RunContext(String sessionId, String connectionId) {
        this.sessionId = sessionId;
        this.connectionId = connectionId;
    }

    public void recordToolCall(String toolName, int iteration, long latencyMs, int resultCount, String error) {
        toolCallRecords.add(new ToolCallRecord(toolName, iteration, latencyMs, resultCount, error));
    }

    public void recordRetry() {
        retries++;
    }

    public void recordCitation() {
        citationsEmitted++;
    }

    public void recordAnswerChunk() {
        answerChunks++;
    }

    public long elapsedMs() {
        return System.currentTimeMillis() - startTimeMs;
    }

    public long totalToolLatencyMs() {
        return toolCallRecords.stream().mapToLong(ToolCallRecord::latencyMs).sum();
    }

    public long failedToolCalls() {
        return toolCallRecords.stream().filter(r -> r.error() != null).count();
    }

    public void logSummary(CompletionReason reason, int iterations, int results) {
        log.info("Search run complete [sessionId={}, connectionId={}, reason={}, iterations={}, results={}, "
                        + "citations={}, toolCalls={}, failedCalls={}, retries={}, toolLatency={}ms, answerChunks={}, latency={}ms]",
                sessionId, connectionId, reason.wireName(), iterations, results, citationsEmitted,
                toolCallRecords.size(), failedToolCalls(), retries, totalToolLatencyMs(), answerChunks, elapsedMs());
    }

    public record ToolCallRecord(String toolName, int iteration, long latencyMs, int resultCount, String error) {
    }
}
