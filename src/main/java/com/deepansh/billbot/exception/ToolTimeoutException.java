package com.deepansh.billbot.exception;

import java.time.Duration;

public class ToolTimeoutException extends ToolCallException {

    public static final String CODE = "TIMEOUT";

    public ToolTimeoutException(String toolName, Duration timeout) {
        super(toolName, "Tool '" + toolName + "' did not answer within " + timeout.toMillis() + "ms", CODE);
    }
}
