package com.deepansh.billbot.exception;

public class SessionConflictException extends BillBotException {

    public static final String CODE = "SESSION_CONFLICT";

    public SessionConflictException(String sessionId) {
        super("Session " + sessionId + " is already running", CODE, false);
    }
}
