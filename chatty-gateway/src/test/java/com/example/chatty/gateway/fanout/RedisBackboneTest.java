package com.example.chatty.gateway.fanout;

import io.lettuce.core.event.EventBus;
import io.lettuce.core.event.connection.ConnectedEvent;
import io.lettuce.core.event.connection.ConnectionActivatedEvent;
import io.lettuce.core.event.connection.DisconnectedEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.listener.ReactiveRedisMessageListenerContainer;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("RedisBackbone")
class RedisBackboneTest {

    @Test
    @DisplayName("maps subscriber disconnects and activations to link state and ignores other events")
    void mapsSubscriberConnectionEvents() {
        EventBus eventBus = mock(EventBus.class);
        when(eventBus.get()).thenReturn(Flux.just(
                mock(DisconnectedEvent.class),
                mock(ConnectedEvent.class),
                mock(ConnectionActivatedEvent.class)));
        RedisBackbone backbone = new RedisBackbone(mock(ReactiveStringRedisTemplate.class),
                mock(ReactiveRedisMessageListenerContainer.class), eventBus);

        StepVerifier.create(backbone.subscriberLinkState())
                .expectNext(false)
                .expectNext(true)
                .verifyComplete();
    }
}
