package com.deepansh.billbot.model.payload;

public record StartPayload(String sessionId, String connectionId, String messageId,
                           String query, String timestamp) {
}
