package com.example.chatty.gateway.channel;

import com.example.chatty.shared.dto.ChannelFrame;
import com.example.chatty.shared.session.Session;
import lombok.Getter;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.util.concurrent.Queues;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One live client association on this process. Frames are pushed into a bounded
 * unicast buffer that the transport drains.
 */
public class ChannelConnection {

    @Getter
    private final String id;
    @Getter
    private final String protocol;
    @Getter
    private final Session session;
    @Getter
    private final OffsetDateTime connectedAt;

    private final Set<String> topics = ConcurrentHashMap.newKeySet();
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.CONNECTING);
    private final Sinks.Many<ChannelFrame> outbound;

    ChannelConnection(String id, String protocol, Session session, int outboundBuffer, OffsetDateTime connectedAt) {
        this.id = id;
        this.protocol = protocol;
        this.session = session;
        this.connectedAt = connectedAt;
        this.outbound = Sinks.many().unicast().onBackpressureBuffer(Queues.<ChannelFrame>get(outboundBuffer).get());
    }

    public ConnectionState getState() {
        return state.get();
    }

    public boolean isEstablished() {
        return state.get() == ConnectionState.ESTABLISHED;
    }

    public Set<String> getTopics() {
        return Collections.unmodifiableSet(topics);
    }

    public boolean isSubscribedTo(String topic) {
        return topics.contains(topic);
    }

    public Flux<ChannelFrame> outbound() {
        return outbound.asFlux();
    }

    boolean establish() {
        return state.compareAndSet(ConnectionState.CONNECTING, ConnectionState.ESTABLISHED);
    }

    synchronized DeliveryOutcome push(ChannelFrame frame) {
        if (state.get() != ConnectionState.ESTABLISHED) {
            return DeliveryOutcome.CONNECTION_GONE;
        }
        Sinks.EmitResult result = outbound.tryEmitNext(frame);
        if (result.isSuccess()) {
            return DeliveryOutcome.DELIVERED;
        }
        if (result == Sinks.EmitResult.FAIL_OVERFLOW || result == Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            return DeliveryOutcome.DROPPED;
        }
        return DeliveryOutcome.CONNECTION_GONE;
    }

    synchronized boolean addTopic(String topic) {
        if (state.get() != ConnectionState.ESTABLISHED) {
            return false;
        }
        topics.add(topic);
        return true;
    }

    synchronized boolean removeTopic(String topic) {
        if (state.get() != ConnectionState.ESTABLISHED) {
            return false;
        }
        topics.remove(topic);
        return true;
    }

    /**
     * Moves the connection to {@code CLOSING}. Only the first caller wins.
     */
    boolean beginClosing() {
        return state.compareAndSet(ConnectionState.ESTABLISHED, ConnectionState.CLOSING)
                || state.compareAndSet(ConnectionState.CONNECTING, ConnectionState.CLOSING);
    }

    // frames already buffered are still flushed before the stream completes
    synchronized void close() {
        state.set(ConnectionState.CLOSED);
        topics.clear();
        outbound.tryEmitComplete();
    }
}
