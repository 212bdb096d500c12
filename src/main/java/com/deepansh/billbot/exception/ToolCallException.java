package com.deepansh.billbot.exception;

import lombok.Getter;

/**
 * A single tool call did not produce a usable result.
 * Either the worker answered with an error or the call never completed.
 */
@Getter
public class ToolCallException extends BillBotException {

    public static final String CODE = "TOOL_CALL_ERROR";

    private final String toolName;

    public ToolCallException(String toolName, String message) {
        this(toolName, message, CODE);
    }

    public ToolCallException(String toolName, String message, Throwable cause) {
        super(message, CODE, true, cause);
        this.toolName = toolName;
    }

    protected ToolCallException(String toolName, String message, String code) {
        super(message, code, true);
        this.toolName = toolName;
    }
}
