package com.example.chatty.gateway.channel;

import com.example.chatty.gateway.lifecycle.LifecycleStage;
import com.example.chatty.shared.config.GatewayProperties;
import com.example.chatty.shared.dto.ChannelFrame;
import com.example.chatty.shared.exception.GatewayException;
import com.example.chatty.shared.session.Session;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns every event channel connection attached to this process.
 * <p>
 * Delivery methods report a {@link DeliveryOutcome} instead of throwing: a connection that
 * has gone away is a normal condition for callers.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ChannelConnectionManager implements LifecycleStage {

    private final Map<String, ChannelConnection> connections = new ConcurrentHashMap<>();
    private final Map<String, Integer> failedEmitCounts = new ConcurrentHashMap<>();

    private final GatewayProperties properties;
    private final ChannelFrameFactory frameFactory;
    private final Clock clock;

    private volatile boolean accepting;
    private Disposable heartbeatSubscription;

    @Override
    public String stageName() {
        return "event-channel";
    }

    @Override
    public void start() {
        accepting = true;
        startHeartbeat();
        log.info("Event channel accepting connections on '{}', heartbeat every {}",
                properties.getChannel().getPath(), properties.getChannel().getHeartbeatInterval());
    }

    @Override
    public void stop() {
        log.info("Commencing event channel shutdown...");
        accepting = false;

        if (heartbeatSubscription != null && !heartbeatSubscription.isDisposed()) {
            heartbeatSubscription.dispose();
            log.info("Channel heartbeat task stopped.");
        }
        if (!connections.isEmpty()) {
            log.info("Sending shutdown notice to {} connected clients...", connections.size());
            ChannelFrame shutdownFrame = frameFactory.shutdown();
            for (ChannelConnection connection : new ArrayList<>(connections.values())) {
                connection.push(shutdownFrame);
                onDisconnect(connection.getId());
            }
        }
        log.info("Event channel shutdown complete.");
    }

    public boolean isAccepting() {
        return accepting;
    }

    /**
     * Attaches a new connection to this process and queues its {@code CONNECTED} frame.
     *
     * @throws GatewayException with kind {@code CONFLICT_FAILURE} if the id is already attached
     */
    public ChannelConnection open(String connectionId, String protocol, Session session) {
        if (!accepting) {
            throw new IllegalStateException("Event channel is not accepting connections");
        }
        ChannelConnection connection = new ChannelConnection(connectionId, protocol, session,
                properties.getChannel().getOutboundBuffer(), OffsetDateTime.now(clock));
        if (connections.putIfAbsent(connectionId, connection) != null) {
            throw GatewayException.conflict("Connection " + connectionId + " is already attached");
        }
        connection.establish();
        connection.push(frameFactory.connected(connectionId));

        log.info("[CONNECT] Event channel connection '{}' established, subject='{}', protocol='{}'",
                connectionId, session != null ? session.getSubject() : "anonymous", protocol);
        return connection;
    }

    public DeliveryOutcome emit(String connectionId, String event, JsonNode payload) {
        return send(connectionId, frameFactory.event(null, event, payload));
    }

    public DeliveryOutcome send(String connectionId, ChannelFrame frame) {
        ChannelConnection connection = connections.get(connectionId);
        if (connection == null) {
            log.debug("Connection {} is not attached to this process, frame {} skipped", connectionId, frame.getType());
            return DeliveryOutcome.CONNECTION_GONE;
        }
        return deliver(connection, frame);
    }

    public DeliveryOutcome subscribe(String connectionId, String topic) {
        ChannelConnection connection = connections.get(connectionId);
        if (connection == null || !connection.addTopic(topic)) {
            return DeliveryOutcome.CONNECTION_GONE;
        }
        log.debug("Connection {} subscribed to topic '{}'", connectionId, topic);
        return deliver(connection, frameFactory.subscribed(topic));
    }

    public DeliveryOutcome unsubscribe(String connectionId, String topic) {
        ChannelConnection connection = connections.get(connectionId);
        if (connection == null || !connection.removeTopic(topic)) {
            return DeliveryOutcome.CONNECTION_GONE;
        }
        log.debug("Connection {} unsubscribed from topic '{}'", connectionId, topic);
        return deliver(connection, frameFactory.unsubscribed(topic));
    }

    /**
     * Delivers one event to every connection on this process subscribed to {@code topic}.
     *
     * @return number of connections the frame was delivered to
     */
    public int broadcastLocal(String topic, String event, JsonNode payload) {
        ChannelFrame frame = frameFactory.event(topic, event, payload);
        int delivered = 0;
        for (ChannelConnection connection : connections.values()) {
            if (connection.isSubscribedTo(topic) && deliver(connection, frame) == DeliveryOutcome.DELIVERED) {
                delivered++;
            }
        }
        log.debug("Event '{}' on topic '{}' delivered to {} local connections", event, topic, delivered);
        return delivered;
    }

    /**
     * Releases everything held for a connection. Safe to call more than once.
     *
     * @return {@code true} if this call released the connection
     */
    public boolean onDisconnect(String connectionId) {
        ChannelConnection connection = connections.remove(connectionId);
        if (connection == null) {
            return false;
        }
        connection.beginClosing();
        connection.close();
        failedEmitCounts.remove(connectionId);
        log.info("[DISCONNECT] Cleanly disconnected event channel connection '{}'", connectionId);
        return true;
    }

    public Optional<ChannelConnection> find(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId));
    }

    public int getConnectionCount() {
        return connections.size();
    }

    public Map<String, Long> getTopicSubscriberCounts() {
        Map<String, Long> counts = new TreeMap<>();
        for (ChannelConnection connection : connections.values()) {
            connection.getTopics().forEach(topic -> counts.merge(topic, 1L, Long::sum));
        }
        return counts;
    }

    private DeliveryOutcome deliver(ChannelConnection connection, ChannelFrame frame) {
        DeliveryOutcome outcome = connection.push(frame);
        if (outcome == DeliveryOutcome.DROPPED) {
            int failCount = failedEmitCounts.merge(connection.getId(), 1, Integer::sum);
            log.warn("Failed to emit {} frame to connection {}, outbound buffer full. Fail count: {}",
                    frame.getType(), connection.getId(), failCount);

            if (failCount >= properties.getChannel().getMaxFailedEmits()) {
                log.warn("Connection {} has failed {} consecutive emits. Proactively closing slow consumer.",
                        connection.getId(), failCount);
                cleanupFailedConnectionAsync(connection.getId());
            }
        } else if (outcome == DeliveryOutcome.DELIVERED) {
            failedEmitCounts.remove(connection.getId());
        }
        return outcome;
    }

    private void cleanupFailedConnectionAsync(String connectionId) {
        Schedulers.boundedElastic().schedule(() -> onDisconnect(connectionId));
    }

    private void startHeartbeat() {
        heartbeatSubscription = Flux.interval(properties.getChannel().getHeartbeatInterval(), Schedulers.parallel())
                .doOnNext(tick -> {
                    try {
                        if (connections.isEmpty()) {
                            return;
                        }
                        ChannelFrame heartbeat = frameFactory.heartbeat();
                        for (ChannelConnection connection : connections.values()) {
                            deliver(connection, heartbeat);
                        }
                    } catch (Exception e) {
                        log.error("Error in channel heartbeat task: {}", e.getMessage(), e);
                    }
                })
                .subscribe();
    }
}
