package com.deepansh.billbot.model.payload;

public record ContentPayload(String content, String messageId) {
}
