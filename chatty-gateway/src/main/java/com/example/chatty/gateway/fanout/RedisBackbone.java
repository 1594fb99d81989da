package com.example.chatty.gateway.fanout;

import io.lettuce.core.event.EventBus;
import io.lettuce.core.event.connection.ConnectionActivatedEvent;
import io.lettuce.core.event.connection.DisconnectedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.listener.PatternTopic;
import org.springframework.data.redis.listener.ReactiveRedisMessageListenerContainer;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Redis pub/sub backbone. The template and the listener container are built on two
 * distinct connection factories, so a slow subscription never holds up a publish.
 * <p>
 * Lettuce reconnects the subscribing connection and restores the pattern subscription
 * by itself, so the subscription flux never ends on a dropped socket. The link state is
 * taken from the subscriber client's event bus instead.
 */
@Slf4j
@RequiredArgsConstructor
public class RedisBackbone implements Backbone {

    private final ReactiveStringRedisTemplate publisherTemplate;
    private final ReactiveRedisMessageListenerContainer listenerContainer;
    private final EventBus subscriberEvents;

    @Override
    public Mono<Void> publish(String channel, String message) {
        return publisherTemplate.convertAndSend(channel, message)
                .doOnNext(receivers -> log.debug("Published to Redis channel '{}', {} subscribed processes", channel, receivers))
                .then();
    }

    @Override
    public Mono<Flux<BackboneMessage>> subscribe(String channelPattern) {
        PatternTopic topic = PatternTopic.of(channelPattern);
        return listenerContainer.receiveLater(topic)
                .doOnNext(messages -> log.info("Redis pattern subscription '{}' confirmed", channelPattern))
                .map(messages -> messages.map(message -> new BackboneMessage(message.getChannel(), message.getMessage())));
    }

    @Override
    public Mono<Void> ping() {
        return publisherTemplate.execute(connection -> connection.ping()).then();
    }

    @Override
    public Flux<Boolean> subscriberLinkState() {
        return subscriberEvents.get()
                .filter(event -> event instanceof DisconnectedEvent || event instanceof ConnectionActivatedEvent)
                .doOnNext(event -> log.debug("Redis subscriber connection event: {}", event))
                .map(event -> event instanceof ConnectionActivatedEvent);
    }
}
