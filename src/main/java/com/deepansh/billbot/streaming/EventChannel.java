package com.deepansh.billbot.streaming;

import com.deepansh.billbot.exception.StreamingException;
import com.deepansh.billbot.model.EventType;
import com.deepansh.billbot.model.StreamEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.codec.ServerSentEvent;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ArrayBlockingQueue;

/**
 * One outbound event stream.
 *
 * Events go into a bounded unicast sink; the HTTP layer drains it at the
 * client's pace. A client that falls {@code bufferSize} events behind is torn
 * down instead of letting the buffer grow.
 *
 * All emissions happen under this object's monitor: the sink requires
 * serialized signals, and sequence numbers must match delivery order.
 */
@Slf4j
public class EventChannel implements EventSink {

    static final String HEARTBEAT_COMMENT = "keepalive";

    /** How a channel ended, reported once to its owner. */
    public enum CloseCause { COMPLETED, CLIENT_GONE, OVERFLOW, FORCED }

    @FunctionalInterface
    public interface CloseListener {
        void onClose(EventChannel channel, CloseCause cause);
    }

    private final String connectionId;
    private final int bufferSize;
    private final Clock clock;
    private final CloseListener closeListener;
    private final Sinks.Many<ServerSentEvent<StreamEvent>> sink;
    private final Instant createdAt;

    private long sequence;
    private boolean ended;
    private volatile boolean closed;
    private volatile Instant lastEventAt;
    private volatile Instant lastWriteAt;
    private volatile long eventCount;

    public EventChannel(String connectionId, int bufferSize, Clock clock, CloseListener closeListener) {
        this.connectionId = connectionId;
        this.bufferSize = bufferSize;
        this.clock = clock;
        this.closeListener = closeListener;
        this.sink = Sinks.many().unicast().onBackpressureBuffer(new ArrayBlockingQueue<>(bufferSize));
        this.createdAt = clock.instant();
        this.lastEventAt = createdAt;
        this.lastWriteAt = createdAt;
    }

    @Override
    public String connectionId() {
        return connectionId;
    }

    @Override
    public boolean isOpen() {
        return !closed;
    }

    @Override
    public boolean push(EventType type, Object data) {
        CloseCause closedWith;
        synchronized (this) {
            if (closed || ended) {
                log.debug("Dropping {} event for closed connection [connectionId={}]", type.wireName(), connectionId);
                return false;
            }
            long next = sequence + 1;
            Instant now = clock.instant();
            StreamEvent event = new StreamEvent(type, data, next, now);
            Sinks.EmitResult result = sink.tryEmitNext(
                    ServerSentEvent.builder(event).id(Long.toString(next)).build());

            if (result.isSuccess()) {
                sequence = next;
                eventCount++;
                lastEventAt = now;
                lastWriteAt = now;
                if (type.isTerminal()) {
                    ended = true;
                    closed = true;
                    sink.tryEmitComplete();
                    closedWith = CloseCause.COMPLETED;
                } else {
                    return true;
                }
            } else {
                closedWith = result == Sinks.EmitResult.FAIL_OVERFLOW ? CloseCause.OVERFLOW : CloseCause.CLIENT_GONE;
                closed = true;
                if (closedWith == CloseCause.OVERFLOW) {
                    log.warn("Client fell {} events behind, closing stream [connectionId={}]",
                            bufferSize, connectionId);
                    sink.tryEmitError(new StreamingException("Client is not keeping up with the event stream"));
                }
            }
        }
        closeListener.onClose(this, closedWith);
        return closedWith == CloseCause.COMPLETED;
    }

    /** Writes an SSE comment when nothing has been written for {@code interval}. */
    public boolean heartbeatIfIdle(Duration interval) {
        synchronized (this) {
            if (closed) return false;
            Instant now = clock.instant();
            if (Duration.between(lastWriteAt, now).compareTo(interval) < 0) return false;
            Sinks.EmitResult result = sink.tryEmitNext(
                    ServerSentEvent.<StreamEvent>builder().comment(HEARTBEAT_COMMENT).build());
            if (result.isSuccess()) {
                lastWriteAt = now;
                return true;
            }
        }
        // a heartbeat that cannot be written means the client is gone or stalled
        teardown(CloseCause.CLIENT_GONE);
        return false;
    }

    /** Completes the stream after buffered events are delivered. Idempotent. */
    public void close() {
        teardown(CloseCause.FORCED);
    }

    void clientDisconnected() {
        teardown(CloseCause.CLIENT_GONE);
    }

    private void teardown(CloseCause cause) {
        synchronized (this) {
            if (closed) return;
            closed = true;
            sink.tryEmitComplete();
        }
        log.debug("Stream closed [connectionId={}, cause={}]", connectionId, cause);
        closeListener.onClose(this, cause);
    }

    /** The stream the HTTP layer subscribes to. A client cancel counts as a disconnect. */
    public Flux<ServerSentEvent<StreamEvent>> asFlux() {
        return sink.asFlux().doOnCancel(this::clientDisconnected);
    }

    public boolean isStale(Instant now, Duration staleAfter) {
        return Duration.between(lastEventAt, now).compareTo(staleAfter) > 0;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant lastEventAt() {
        return lastEventAt;
    }

    public long eventCount() {
        return eventCount;
    }

    public synchronized long lastSequence() {
        return sequence;
    }
}
