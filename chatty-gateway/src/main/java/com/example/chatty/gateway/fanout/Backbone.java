package com.example.chatty.gateway.fanout;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * The shared publish/subscribe transport connecting gateway processes.
 * Publishing and subscribing go over separate connections.
 */
public interface Backbone {

    Mono<Void> publish(String channel, String message);

    /**
     * Subscribes to every channel matching {@code channelPattern}.
     * The returned {@code Mono} emits once the backbone has confirmed the subscription;
     * the inner {@code Flux} completes or errors when the subscription is lost.
     */
    Mono<Flux<BackboneMessage>> subscribe(String channelPattern);

    /**
     * Round trip on the publishing connection.
     */
    Mono<Void> ping();

    /**
     * Link state of the subscribing connection: {@code false} when it drops, {@code true}
     * once it is active again. A transport that restores the subscription on its own keeps
     * the subscription flux open across the gap, so the gap is only visible here.
     */
    Flux<Boolean> subscriberLinkState();
}
