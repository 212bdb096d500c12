package com.deepansh.billbot.exception;

/** The worker process exited while the call was in flight. */
public class WorkerDiedException extends ToolCallException {

    public static final String CODE = "PROCESS_DIED";

    public WorkerDiedException(String toolName, String message) {
        super(toolName, message, CODE);
    }
}
