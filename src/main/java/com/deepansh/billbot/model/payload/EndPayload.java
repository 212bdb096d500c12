package com.deepansh.billbot.model.payload;

import com.deepansh.billbot.model.CompletionReason;

/** Last event of every session. {@code status} is completed, stopped or error. */
public record EndPayload(String messageId, String status, CompletionReason completionReason,
                         int totalIterations, int totalResults, long duration) {
}
