package com.example.chatty.gateway.config;

import com.example.chatty.gateway.fanout.Backbone;
import com.example.chatty.gateway.fanout.RedisBackbone;
import com.example.chatty.shared.config.GatewayProperties;
import com.example.chatty.shared.exception.InvalidConfigurationException;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.RedisURI;
import io.lettuce.core.resource.ClientResources;
import io.lettuce.core.resource.Delay;
import io.lettuce.core.resource.DefaultClientResources;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.listener.ReactiveRedisMessageListenerContainer;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Two independent backbone connections: a subscribed Redis connection cannot issue
 * PUBLISH, and a stalled publisher must not hold up delivery of incoming envelopes.
 */
@Configuration
@RequiredArgsConstructor
public class RedisConfig {

    private final GatewayProperties gatewayProperties;

    @Bean(destroyMethod = "shutdown")
    public ClientResources publisherClientResources() {
        return clientResources();
    }

    // separate resources give the subscriber its own event bus
    @Bean(destroyMethod = "shutdown")
    public ClientResources subscriberClientResources() {
        return clientResources();
    }

    @Bean
    @Primary
    public LettuceConnectionFactory publisherConnectionFactory(
            @Qualifier("publisherClientResources") ClientResources publisherClientResources) {
        return connectionFactory("publisher", publisherClientResources);
    }

    @Bean
    public LettuceConnectionFactory subscriberConnectionFactory(
            @Qualifier("subscriberClientResources") ClientResources subscriberClientResources) {
        return connectionFactory("subscriber", subscriberClientResources);
    }

    @Bean
    public ReactiveStringRedisTemplate backbonePublisherTemplate(
            @Qualifier("publisherConnectionFactory") LettuceConnectionFactory publisherConnectionFactory) {
        return new ReactiveStringRedisTemplate(publisherConnectionFactory);
    }

    @Bean
    public ReactiveRedisMessageListenerContainer backboneListenerContainer(
            @Qualifier("subscriberConnectionFactory") LettuceConnectionFactory subscriberConnectionFactory) {
        return new ReactiveRedisMessageListenerContainer(subscriberConnectionFactory);
    }

    @Bean
    public Backbone backbone(ReactiveStringRedisTemplate backbonePublisherTemplate,
                             ReactiveRedisMessageListenerContainer backboneListenerContainer,
                             @Qualifier("subscriberClientResources") ClientResources subscriberClientResources) {
        return new RedisBackbone(backbonePublisherTemplate, backboneListenerContainer, subscriberClientResources.eventBus());
    }

    /**
     * Parses the backbone URL, failing with the same message as the configuration stage
     * since the connection factories are built before that stage runs.
     */
    static RedisURI backboneUri(String url) {
        try {
            RedisURI uri = RedisURI.create(url);
            if (uri.getHost() == null || uri.getHost().isBlank()) {
                throw new IllegalArgumentException("missing host");
            }
            return uri;
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationException(
                    List.of("chatty.backbone.url (REDIS_HOST) must be a redis:// or rediss:// URL"));
        }
    }

    private ClientResources clientResources() {
        GatewayProperties.Fanout fanout = gatewayProperties.getFanout();
        return DefaultClientResources.builder()
                .reconnectDelay(Delay.exponential(fanout.getReconnectMinBackoff(), fanout.getReconnectMaxBackoff(), 2, TimeUnit.MILLISECONDS))
                .build();
    }

    private LettuceConnectionFactory connectionFactory(String role, ClientResources clientResources) {
        RedisURI uri = backboneUri(gatewayProperties.getBackbone().getUrl());

        RedisStandaloneConfiguration standalone = new RedisStandaloneConfiguration(uri.getHost(), uri.getPort());
        standalone.setDatabase(uri.getDatabase());
        if (uri.getUsername() != null) {
            standalone.setUsername(uri.getUsername());
        }
        if (uri.getPassword() != null) {
            standalone.setPassword(RedisPassword.of(uri.getPassword()));
        }

        ClientOptions clientOptions = ClientOptions.builder()
                .autoReconnect(true)
                .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
                .build();

        LettuceClientConfiguration.LettuceClientConfigurationBuilder client = LettuceClientConfiguration.builder()
                .clientName(gatewayProperties.getInstanceId() + "-" + role)
                .commandTimeout(gatewayProperties.getFanout().getPublishTimeout())
                .clientOptions(clientOptions)
                .clientResources(clientResources);
        if (uri.isSsl()) {
            client.useSsl();
        }
        return new LettuceConnectionFactory(standalone, client.build());
    }
}
