package com.deepansh.billbot.exception;

/** A line from the worker could not be understood as a protocol message. */
public class ProtocolException extends BillBotException {

    public static final String CODE = "PROTOCOL_ERROR";

    public ProtocolException(String message) {
        super(message, CODE, true);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, CODE, true, cause);
    }
}
