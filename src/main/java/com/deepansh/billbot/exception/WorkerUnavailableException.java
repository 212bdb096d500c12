package com.deepansh.billbot.exception;

/**
 * The worker could not be started, or restarts are suspended because the
 * restart breaker is open. Thrown synchronously when a session cannot begin.
 */
public class WorkerUnavailableException extends ToolCallException {

    public static final String CODE = "MCP_SERVICE_ERROR";

    public WorkerUnavailableException(String message) {
        super(null, message, CODE);
    }

    public WorkerUnavailableException(String message, Throwable cause) {
        this(message + (cause.getMessage() != null ? ": " + cause.getMessage() : ""));
        initCause(cause);
    }
}
