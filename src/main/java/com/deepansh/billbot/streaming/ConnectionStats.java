package com.deepansh.billbot.streaming;

import java.util.Map;

/**
 * Snapshot of the open streams. {@code connectionsByAge} buckets:
 * under_1min, 1_5min, 5_10min, over_10min.
 */
public record ConnectionStats(int activeConnections, long totalEventsStreamed, Map<String, Integer> connectionsByAge) {
}
