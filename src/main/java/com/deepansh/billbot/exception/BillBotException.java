package com.deepansh.billbot.exception;

import lombok.Getter;

/**
 * Root of the service's exception hierarchy.
 *
 * Every failure carries a stable {@code code} (surfaced to clients in error bodies
 * and error stream events) and a {@code recoverable} flag telling the client
 * whether retrying the whole request is worthwhile.
 */
@Getter
public class BillBotException extends RuntimeException {

    private final String code;
    private final boolean recoverable;

    public BillBotException(String message, String code, boolean recoverable) {
        super(message);
        this.code = code;
        this.recoverable = recoverable;
    }

    public BillBotException(String message, String code, boolean recoverable, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.recoverable = recoverable;
    }
}
