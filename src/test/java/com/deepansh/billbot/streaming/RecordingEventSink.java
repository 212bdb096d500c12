package com.deepansh.billbot.streaming;

import com.deepansh.billbot.model.EventType;
import com.deepansh.billbot.model.StreamEvent;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/** Sink that keeps every event in memory, numbering them like a real channel. */
public class RecordingEventSink implements EventSink {

    private final String connectionId;
    private final List<StreamEvent> events = new ArrayList<>();
    private long sequence;
    private boolean open = true;

    public RecordingEventSink(String connectionId) {
        this.connectionId = connectionId;
    }

    @Override
    public String connectionId() {
        return connectionId;
    }

    @Override
    public synchronized boolean push(EventType type, Object data) {
        if (!open) return false;
        events.add(new StreamEvent(type, data, ++sequence, Instant.now()));
        if (type == EventType.END) open = false;
        return true;
    }

    @Override
    public synchronized boolean isOpen() {
        return open;
    }

    public synchronized void disconnect() {
        open = false;
    }

    public synchronized List<StreamEvent> events() {
        return List.copyOf(events);
    }

    public synchronized List<EventType> types() {
        return events.stream().map(StreamEvent::type).toList();
    }

    @SuppressWarnings("unchecked")
    public synchronized <T> List<T> payloads(EventType type) {
        return events.stream().filter(e -> e.type() == type).map(e -> (T) e.data()).toList();
    }

    public synchronized <T> T last(EventType type) {
        List<T> all = payloads(type);
        return all.isEmpty() ? null : all.get(all.size() - 1);
    }
}
