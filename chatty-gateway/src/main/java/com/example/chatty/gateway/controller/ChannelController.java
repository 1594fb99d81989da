package com.example.chatty.gateway.controller;

import com.example.chatty.gateway.channel.ChannelConnection;
import com.example.chatty.gateway.channel.ChannelConnectionManager;
import com.example.chatty.gateway.dto.ChannelStatsResponse;
import com.example.chatty.gateway.dto.ConnectionStatusResponse;
import com.example.chatty.gateway.dto.PublishRequest;
import com.example.chatty.gateway.dto.PublishResponse;
import com.example.chatty.gateway.fanout.FanOutBridge;
import com.example.chatty.shared.config.GatewayProperties;
import com.example.chatty.shared.exception.GatewayException;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.OffsetDateTime;

@RestController
@RequestMapping("/api/channel")
@RequiredArgsConstructor
@Slf4j
public class ChannelController {

    private final ChannelConnectionManager connectionManager;
    private final FanOutBridge fanOutBridge;
    private final GatewayProperties properties;
    private final Clock clock;

    @GetMapping("/stats")
    public ResponseEntity<ChannelStatsResponse> getStats() {
        ChannelStatsResponse stats = ChannelStatsResponse.builder()
                .instanceId(properties.getInstanceId())
                .localConnections(connectionManager.getConnectionCount())
                .fanOutState(fanOutBridge.getState())
                .degraded(fanOutBridge.isDegraded())
                .topicSubscribers(connectionManager.getTopicSubscriberCounts())
                .timestamp(OffsetDateTime.now(clock))
                .build();
        return ResponseEntity.ok(stats);
    }

    /**
     * Broadcasts an event to every subscriber of the topic across the cluster.
     * Answers {@code 202} when the event only reached this instance.
     */
    @PostMapping("/topics/{topic}/events")
    public Mono<ResponseEntity<PublishResponse>> publish(@PathVariable String topic,
                                                         @Valid @RequestBody PublishRequest request) {
        log.info("Received publish request for topic '{}', event '{}'", topic, request.getEvent());
        return fanOutBridge.broadcast(topic, request.getEvent(), request.getPayload())
                .map(result -> {
                    PublishResponse response = PublishResponse.builder()
                            .topic(topic)
                            .event(request.getEvent())
                            .outcome(result.getOutcome())
                            .localDeliveries(result.getLocalDeliveries())
                            .instanceId(properties.getInstanceId())
                            .timestamp(OffsetDateTime.now(clock))
                            .build();
                    HttpStatus status = result.isFannedOut() ? HttpStatus.OK : HttpStatus.ACCEPTED;
                    return ResponseEntity.status(status).body(response);
                });
    }

    @GetMapping("/connections/{id}")
    public ResponseEntity<ConnectionStatusResponse> getConnection(@PathVariable String id) {
        ChannelConnection connection = connectionManager.find(id)
                .orElseThrow(() -> GatewayException.notFound("Connection " + id + " is not attached to this instance"));
        ConnectionStatusResponse response = ConnectionStatusResponse.builder()
                .connectionId(connection.getId())
                .state(connection.getState())
                .protocol(connection.getProtocol())
                .subject(connection.getSession() != null ? connection.getSession().getSubject() : null)
                .topics(connection.getTopics())
                .connectedAt(connection.getConnectedAt())
                .build();
        return ResponseEntity.ok(response);
    }

    @DeleteMapping("/connections/{id}")
    public ResponseEntity<Void> disconnect(@PathVariable String id) {
        log.info("Disconnect requested for connection '{}'", id);
        if (!connectionManager.onDisconnect(id)) {
            throw GatewayException.notFound("Connection " + id + " is not attached to this instance");
        }
        return ResponseEntity.noContent().build();
    }
}
