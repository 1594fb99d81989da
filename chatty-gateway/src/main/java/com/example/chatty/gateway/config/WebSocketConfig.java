package com.example.chatty.gateway.config;

import com.example.chatty.gateway.channel.EventChannelHandler;
import com.example.chatty.shared.config.GatewayProperties;
import com.example.chatty.shared.util.Constants;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.config.WebFluxConfigurer;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;
import org.springframework.web.reactive.socket.server.WebSocketService;
import org.springframework.web.reactive.socket.server.support.HandshakeWebSocketService;

import java.util.Map;

@Configuration
public class WebSocketConfig implements WebFluxConfigurer {

    @Bean
    public HandlerMapping eventChannelHandlerMapping(GatewayProperties gatewayProperties, EventChannelHandler eventChannelHandler) {
        return new SimpleUrlHandlerMapping(Map.of(gatewayProperties.getChannel().getPath(), eventChannelHandler), -1);
    }

    /**
     * Copies the session validated by the security gate from the handshake exchange
     * into the WebSocket session.
     */
    @Override
    public WebSocketService getWebSocketService() {
        HandshakeWebSocketService service = new HandshakeWebSocketService();
        service.setSessionAttributePredicate(Constants.SESSION_ATTRIBUTE::equals);
        return service;
    }
}
