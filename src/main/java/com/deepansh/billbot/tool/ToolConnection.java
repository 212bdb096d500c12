package com.deepansh.billbot.tool;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Request/response messaging with one supervised tool worker.
 *
 * Calls complete with the tool's decoded payload, or fail with
 * {@link com.deepansh.billbot.exception.ToolTimeoutException},
 * {@link com.deepansh.billbot.exception.WorkerDiedException},
 * {@link com.deepansh.billbot.exception.WorkerUnavailableException} or a plain
 * {@link com.deepansh.billbot.exception.ToolCallException} when the tool reports an error.
 */
public interface ToolConnection extends AutoCloseable {

    /**
     * Launches the worker and completes the initialize handshake and catalog fetch.
     * Returns once the worker is ready; no-op if it already is.
     */
    void start();

    /**
     * Makes sure a worker is running or being restarted.
     * Throws if the worker cannot be started at all.
     */
    void ensureStarted();

    CompletableFuture<JsonNode> call(String toolName, Map<String, Object> arguments, Duration timeout);

    CompletableFuture<JsonNode> call(String toolName, Map<String, Object> arguments);

    /** Catalog reported by the current worker at handshake time. */
    List<ToolDescriptor> catalog();

    WorkerState state();

    @Override
    void close();
}
