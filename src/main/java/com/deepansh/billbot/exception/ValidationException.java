package com.deepansh.billbot.exception;

/** Request rejected before any session state was created. */
public class ValidationException extends BillBotException {

    public static final String CODE = "VALIDATION_ERROR";

    public ValidationException(String message) {
        super(message, CODE, false);
    }
}
