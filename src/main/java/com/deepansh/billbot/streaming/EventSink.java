package com.deepansh.billbot.streaming;

import com.deepansh.billbot.model.EventType;

/**
 * Where a search session writes its events. One sink per client connection.
 */
public interface EventSink {

    String connectionId();

    /**
     * Appends an event with the next sequence number. Never blocks on the client.
     *
     * @return false if the event was not accepted (sink closed, already ended, or overflowed)
     */
    boolean push(EventType type, Object data);

    boolean isOpen();
}
