package com.deepansh.billbot.exception;

public class AnswerGenerationException extends BillBotException {

    public static final String CODE = "LLM_ERROR";

    public AnswerGenerationException(String message) {
        super(message, CODE, true);
    }

    public AnswerGenerationException(String message, Throwable cause) {
        super(message, CODE, true, cause);
    }
}
