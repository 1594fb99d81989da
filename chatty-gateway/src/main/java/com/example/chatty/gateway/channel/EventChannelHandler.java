package com.example.chatty.gateway.channel;

import com.example.chatty.gateway.exception.ErrorNormalizer;
import com.example.chatty.gateway.fanout.FanOutBridge;
import com.example.chatty.shared.dto.ChannelFrame;
import com.example.chatty.shared.dto.FieldViolation;
import com.example.chatty.shared.exception.GatewayException;
import com.example.chatty.shared.session.Session;
import com.example.chatty.shared.util.Constants;
import com.example.chatty.shared.util.Constants.ChannelAction;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.HandshakeInfo;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Mono;

import java.net.InetSocketAddress;
import java.util.Locale;

/**
 * Bridges one upgraded WebSocket to a {@link ChannelConnection}.
 * <p>
 * The handshake has already passed the security gate, so the validated session (if
 * any) arrives as a session attribute. Client frames are JSON commands; a bad command
 * is answered with an {@code ERROR} frame and the connection stays open.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class EventChannelHandler implements WebSocketHandler {

    private final ChannelConnectionManager connectionManager;
    private final ChannelFrameFactory frameFactory;
    private final FanOutBridge fanOutBridge;
    private final ErrorNormalizer errorNormalizer;
    private final ObjectMapper objectMapper;

    @Override
    public Mono<Void> handle(WebSocketSession webSocketSession) {
        if (!connectionManager.isAccepting()) {
            log.info("Refusing event channel connection {}: gateway is not accepting connections", webSocketSession.getId());
            return webSocketSession.close(CloseStatus.GOING_AWAY);
        }

        HandshakeInfo handshake = webSocketSession.getHandshakeInfo();
        String path = handshake.getUri().getPath();
        Session session = (Session) webSocketSession.getAttributes().get(Constants.SESSION_ATTRIBUTE);
        String connectionId = webSocketSession.getId();

        log.info("[CONNECT_START] Event channel upgrade for connectionId='{}', IP='{}'", connectionId,
                remoteHost(handshake.getRemoteAddress()));

        ChannelConnection connection;
        try {
            connection = connectionManager.open(connectionId, handshake.getSubProtocol(), session);
        } catch (RuntimeException e) {
            log.warn("Event channel connection {} could not be opened: {}", connectionId, e.getMessage());
            return webSocketSession.close(CloseStatus.SERVER_ERROR);
        }

        Mono<Void> outbound = webSocketSession
                .send(connection.outbound().map(frame -> webSocketSession.textMessage(write(frame))))
                .then(Mono.defer(webSocketSession::close));

        Mono<Void> inbound = webSocketSession.receive()
                .filter(message -> message.getType() == WebSocketMessage.Type.TEXT)
                .map(WebSocketMessage::getPayloadAsText)
                .concatMap(text -> handleCommand(connectionId, path, text))
                .then()
                .doFinally(signalType -> connectionManager.onDisconnect(connectionId));

        return Mono.when(inbound, outbound);
    }

    Mono<Void> handleCommand(String connectionId, String path, String text) {
        return Mono.defer(() -> {
                    ChannelCommand command = parse(text);
                    switch (actionOf(command)) {
                        case SUBSCRIBE:
                            connectionManager.subscribe(connectionId, Topics.requireValid(command.getTopic()));
                            return Mono.<Void>empty();
                        case UNSUBSCRIBE:
                            connectionManager.unsubscribe(connectionId, Topics.requireValid(command.getTopic()));
                            return Mono.<Void>empty();
                        case PUBLISH:
                            if (command.getEvent() == null || command.getEvent().isBlank()) {
                                throw GatewayException.validation("Invalid publish command",
                                        new FieldViolation("event", "must not be blank"));
                            }
                            return fanOutBridge.broadcast(command.getTopic(), command.getEvent(), command.getPayload())
                                    .doOnNext(result -> log.debug("Connection {} published '{}' on '{}': {}",
                                            connectionId, command.getEvent(), command.getTopic(), result.getOutcome()))
                                    .then();
                        default:
                            throw GatewayException.validation("Unsupported action " + command.getAction());
                    }
                })
                .onErrorResume(e -> {
                    connectionManager.send(connectionId, frameFactory.error(errorNormalizer.normalize(e, path)));
                    return Mono.empty();
                });
    }

    private ChannelCommand parse(String text) {
        ChannelCommand command;
        try {
            command = objectMapper.readValue(text, ChannelCommand.class);
        } catch (JsonProcessingException e) {
            log.debug("Malformed event channel command: {}", e.getOriginalMessage());
            throw GatewayException.validation("Malformed command, expected a JSON object");
        }
        if (command == null) {
            throw GatewayException.validation("Malformed command, expected a JSON object");
        }
        return command;
    }

    private ChannelAction actionOf(ChannelCommand command) {
        if (command.getAction() == null) {
            throw GatewayException.validation("Missing action", new FieldViolation("action", "must not be blank"));
        }
        try {
            return ChannelAction.valueOf(command.getAction().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw GatewayException.validation("Unsupported action " + command.getAction(),
                    new FieldViolation("action", "must be one of subscribe, unsubscribe, publish"));
        }
    }

    // forwarded-header handling may leave the address unresolved
    static String remoteHost(InetSocketAddress remoteAddress) {
        return remoteAddress != null ? remoteAddress.getHostString() : "unknown";
    }

    private String write(ChannelFrame frame) {
        try {
            return objectMapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Channel frame " + frame.getType() + " could not be serialized", e);
        }
    }
}
