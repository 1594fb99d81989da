package com.example.chatty.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.autoconfigure.data.redis.RedisReactiveAutoConfiguration;

/**
 * Real-time messaging gateway: HTTP API and WebSocket event channel on one port,
 * with broadcasts fanned out to every gateway instance over Redis pub/sub.
 * <p>
 * Redis auto-configuration is replaced by {@code RedisConfig}, which keeps the
 * publishing and subscribing connections apart.
 */
@SpringBootApplication(
        scanBasePackages = "com.example.chatty.gateway",
        exclude = {RedisAutoConfiguration.class, RedisReactiveAutoConfiguration.class})
public class ChattyGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChattyGatewayApplication.class, args);
    }
}
