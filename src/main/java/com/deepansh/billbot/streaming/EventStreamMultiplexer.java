package com.deepansh.billbot.streaming;

import com.deepansh.billbot.config.StreamingProperties;
import com.deepansh.billbot.model.EventType;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Owns one {@link EventChannel} per client connection.
 *
 * - Opening an id that is already open closes the previous channel first
 * - A periodic sweep writes keepalive comments to idle channels and closes
 *   channels with no application event for {@code streaming.stale-after}
 * - Disconnect listeners hear about every channel that goes away without
 *   having sent its end event (client gone, overflow, stale, forced close)
 */
@Component
@Slf4j
public class EventStreamMultiplexer {

    private final StreamingProperties props;
    private final Clock clock;
    private final Map<String, EventChannel> channels = new ConcurrentHashMap<>();
    private final List<Consumer<EventChannel>> disconnectListeners = new CopyOnWriteArrayList<>();

    public EventStreamMultiplexer(StreamingProperties props, Clock clock) {
        this.props = props;
        this.clock = clock;
    }

    /** Creates and attaches a channel in one step. */
    public EventChannel open(String connectionId) {
        EventChannel channel = create(connectionId);
        attach(channel);
        return channel;
    }

    /**
     * A channel that is not routed yet: pushes through the multiplexer and
     * closes by id do not reach it until {@link #attach} is called.
     */
    public EventChannel create(String connectionId) {
        return new EventChannel(connectionId, props.getBufferSize(), clock, this::onChannelClosed);
    }

    /**
     * Routes the connection id to {@code channel}. A previous channel with the
     * same id is closed and reported as disconnected. A channel that already
     * finished is not routed.
     */
    public void attach(EventChannel channel) {
        String connectionId = channel.connectionId();
        if (!channel.isOpen()) {
            log.debug("Stream finished before it was attached [connectionId={}]", connectionId);
            return;
        }
        EventChannel previous = channels.put(connectionId, channel);
        if (previous != null && previous != channel) {
            log.info("Connection reopened, closing previous stream [connectionId={}]", connectionId);
            previous.close();
            fireDisconnect(previous);
        }
        if (!channel.isOpen()) {
            // closed while being attached
            channels.remove(connectionId, channel);
            return;
        }
        log.info("Stream opened [connectionId={}, active={}]", connectionId, channels.size());
    }

    /** @return false when the connection is unknown or did not accept the event */
    public boolean push(String connectionId, EventType type, Object data) {
        EventChannel channel = channels.get(connectionId);
        if (channel == null) {
            log.debug("No stream for {} event [connectionId={}]", type.wireName(), connectionId);
            return false;
        }
        return channel.push(type, data);
    }

    public Optional<EventChannel> get(String connectionId) {
        return Optional.ofNullable(channels.get(connectionId));
    }

    public boolean isActive(String connectionId) {
        EventChannel channel = channels.get(connectionId);
        return channel != null && channel.isOpen();
    }

    /** Idempotent. */
    public void close(String connectionId) {
        EventChannel channel = channels.get(connectionId);
        if (channel != null) {
            channel.close();
        }
    }

    @PreDestroy
    public void closeAll() {
        if (!channels.isEmpty()) {
            log.info("Closing {} open streams", channels.size());
        }
        List.copyOf(channels.values()).forEach(EventChannel::close);
    }

    /** Listeners receive the channel that went away, so a replaced channel is told apart from its successor. */
    public void onDisconnect(Consumer<EventChannel> listener) {
        disconnectListeners.add(listener);
    }

    public int activeCount() {
        return channels.size();
    }

    @Scheduled(fixedDelayString = "${streaming.sweep-interval:PT5S}")
    public void sweep() {
        Instant now = clock.instant();
        for (EventChannel channel : List.copyOf(channels.values())) {
            if (channel.isStale(now, props.getStaleAfter())) {
                log.warn("Cleaning up stale connection [connectionId={}, ageMinutes={}]",
                        channel.connectionId(), Duration.between(channel.createdAt(), now).toMinutes());
                channel.close();
            } else {
                channel.heartbeatIfIdle(props.getHeartbeatInterval());
            }
        }
    }

    public ConnectionStats stats() {
        Instant now = clock.instant();
        Map<String, Integer> byAge = new LinkedHashMap<>();
        byAge.put("under_1min", 0);
        byAge.put("1_5min", 0);
        byAge.put("5_10min", 0);
        byAge.put("over_10min", 0);

        long totalEvents = 0;
        for (EventChannel channel : channels.values()) {
            totalEvents += channel.eventCount();
            long minutes = Duration.between(channel.createdAt(), now).toMinutes();
            String bucket = minutes < 1 ? "under_1min"
                    : minutes < 5 ? "1_5min"
                    : minutes < 10 ? "5_10min"
                    : "over_10min";
            byAge.merge(bucket, 1, Integer::sum);
        }
        return new ConnectionStats(channels.size(), totalEvents, byAge);
    }

    private void onChannelClosed(EventChannel channel, EventChannel.CloseCause cause) {
        // a replaced channel was already removed by open()
        if (!channels.remove(channel.connectionId(), channel)) return;
        log.info("Stream closed [connectionId={}, cause={}, events={}]",
                channel.connectionId(), cause, channel.eventCount());
        if (cause != EventChannel.CloseCause.COMPLETED) {
            fireDisconnect(channel);
        }
    }

    private void fireDisconnect(EventChannel channel) {
        for (Consumer<EventChannel> listener : disconnectListeners) {
            try {
                listener.accept(channel);
            } catch (RuntimeException e) {
                log.error("Disconnect listener failed [connectionId={}]", channel.connectionId(), e);
            }
        }
    }
}
