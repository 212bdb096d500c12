package com.deepansh.billbot.model;

import java.time.Instant;

/**
 * One unit of stream output: {type, data, sequence, timestamp}.
 * Sequence numbers strictly increase within a connection.
 */
public record StreamEvent(EventType type, Object data, long sequence, Instant timestamp) {
}
