package com.deepansh.billbot.model.payload;

import com.deepansh.billbot.exception.BillBotException;

public record ErrorPayload(String error, String code, boolean recoverable) {

    public static ErrorPayload from(BillBotException ex) {
        return new ErrorPayload(ex.getMessage(), ex.getCode(), ex.isRecoverable());
    }
}
