package com.deepansh.billbot.exception;

/** Raised on a connection's stream when it has to be torn down server side. */
public class StreamingException extends BillBotException {

    public static final String CODE = "STREAMING_ERROR";

    public StreamingException(String message) {
        super(message, CODE, true);
    }
}
