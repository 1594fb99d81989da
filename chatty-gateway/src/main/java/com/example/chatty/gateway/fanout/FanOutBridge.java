package com.example.chatty.gateway.fanout;

import com.example.chatty.gateway.channel.ChannelConnectionManager;
import com.example.chatty.gateway.channel.Topics;
import com.example.chatty.gateway.lifecycle.LifecycleStage;
import com.example.chatty.shared.config.GatewayProperties;
import com.example.chatty.shared.dto.BroadcastEnvelope;
import com.example.chatty.shared.exception.BackboneException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.util.retry.Retry;

import java.io.IOException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Makes a broadcast issued on one gateway process visible on every other one.
 * <p>
 * Publishing delivers to local connections first and then hands a {@link BroadcastEnvelope}
 * to the backbone under a bounded timeout. A failed publish never fails the caller; it
 * reports {@link FanOutResult.Outcome#LOCAL_ONLY} and puts the bridge in degraded mode.
 * <p>
 * Receiving runs on a pattern subscription that feeds a bounded drop-oldest inbox, drained
 * in arrival order by a single dispatcher thread. Envelopes published by this process are
 * skipped because they were already delivered locally at publish time.
 */
@Service
@Slf4j
public class FanOutBridge implements LifecycleStage {

    public enum BridgeState {
        STOPPED,
        CONNECTED,
        DEGRADED
    }

    private static final long DISPATCH_POLL_MILLIS = 250;

    private final Backbone backbone;
    private final ChannelConnectionManager connectionManager;
    private final ObjectMapper objectMapper;
    private final GatewayProperties properties;
    private final Clock clock;
    private final DropOldestInbox<BackboneMessage> inbox;

    private final Counter publishedCounter;
    private final Counter publishFailureCounter;
    private final Counter receivedCounter;
    private final Counter selfSkippedCounter;
    private final Counter droppedCounter;

    private final AtomicBoolean publisherHealthy = new AtomicBoolean(false);
    private final AtomicBoolean subscriberHealthy = new AtomicBoolean(false);
    private final AtomicBoolean subscriptionConfirmed = new AtomicBoolean(false);

    private volatile boolean running;
    private Sinks.Empty<Void> firstSubscription;
    private Disposable subscription;
    private Disposable subscriberLinkWatch;
    private Disposable publisherProbe;
    private ExecutorService dispatchExecutor;

    public FanOutBridge(Backbone backbone,
                        ChannelConnectionManager connectionManager,
                        ObjectMapper objectMapper,
                        GatewayProperties properties,
                        Clock clock,
                        MeterRegistry meterRegistry) {
        this.backbone = backbone;
        this.connectionManager = connectionManager;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
        this.inbox = new DropOldestInbox<>(properties.getFanout().getInboxCapacity());

        this.publishedCounter = meterRegistry.counter("chatty.fanout.published");
        this.publishFailureCounter = meterRegistry.counter("chatty.fanout.publish.failures");
        this.receivedCounter = meterRegistry.counter("chatty.fanout.received");
        this.selfSkippedCounter = meterRegistry.counter("chatty.fanout.self_skipped");
        this.droppedCounter = meterRegistry.counter("chatty.fanout.dropped");
    }

    @Override
    public String stageName() {
        return "fan-out-bridge";
    }

    /**
     * Subscribes to the backbone and waits until both the subscription is confirmed
     * and the publishing connection answers, bounded by the startup timeout.
     *
     * @throws BackboneException if the backbone is not ready in time
     */
    @Override
    public void start() {
        GatewayProperties.Fanout fanout = properties.getFanout();
        String pattern = channelFor("*");
        log.info("[FANOUT_START] Connecting to backbone, instanceId='{}', pattern='{}'", instanceId(), pattern);

        running = true;
        firstSubscription = Sinks.empty();
        dispatchExecutor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, properties.getServer().getThreadPrefix() + "-fanout-dispatch");
            thread.setDaemon(true);
            return thread;
        });
        dispatchExecutor.execute(this::drainInbox);
        subscriberLinkWatch = backbone.subscriberLinkState()
                .subscribe(this::onSubscriberLink,
                        e -> log.error("Backbone subscriber link events stopped: {}", e.getMessage(), e));
        subscription = subscribeToBackbone(pattern);

        try {
            Mono.when(firstSubscription.asMono(), backbone.ping().doOnSuccess(ignored -> publisherHealthy.set(true)))
                    .timeout(fanout.getStartupTimeout())
                    .block();
        } catch (RuntimeException e) {
            stop();
            throw new BackboneException("Backbone was not ready within " + fanout.getStartupTimeout(), e);
        }

        publisherProbe = Flux.interval(fanout.getProbeInterval())
                .concatMap(tick -> backbone.ping()
                        .timeout(fanout.getPublishTimeout())
                        .thenReturn(true)
                        .onErrorResume(e -> {
                            log.debug("Backbone publisher probe failed: {}", e.toString());
                            return Mono.just(false);
                        }))
                .subscribe(this::onPublisherProbe);

        log.info("[FANOUT_READY] Publisher and subscriber connections established for instance '{}'", instanceId());
    }

    @Override
    public void stop() {
        log.info("Commencing fan-out bridge shutdown...");
        running = false;

        if (publisherProbe != null && !publisherProbe.isDisposed()) {
            publisherProbe.dispose();
        }
        if (subscriberLinkWatch != null && !subscriberLinkWatch.isDisposed()) {
            subscriberLinkWatch.dispose();
        }
        if (subscription != null && !subscription.isDisposed()) {
            subscription.dispose();
            log.info("Backbone subscription cancelled.");
        }
        shutdownExecutorService(dispatchExecutor);
        inbox.clear();
        publisherHealthy.set(false);
        subscriberHealthy.set(false);
        subscriptionConfirmed.set(false);
        log.info("Fan-out bridge shutdown complete.");
    }

    /**
     * Delivers an event to local subscribers of {@code topic} and publishes it for every
     * other process. Only an invalid topic makes the returned {@code Mono} fail.
     */
    public Mono<FanOutResult> broadcast(String topic, String event, JsonNode payload) {
        return Mono.defer(() -> {
            Topics.requireValid(topic);
            int delivered = connectionManager.broadcastLocal(topic, event, payload);

            if (!running) {
                log.warn("[FANOUT_DEGRADED] Bridge is stopped, event '{}' on topic '{}' delivered locally only", event, topic);
                return Mono.just(new FanOutResult(FanOutResult.Outcome.LOCAL_ONLY, delivered));
            }

            BroadcastEnvelope envelope = BroadcastEnvelope.builder()
                    .envelopeId(UUID.randomUUID().toString())
                    .topic(topic)
                    .event(event)
                    .payload(payload)
                    .originId(instanceId())
                    .publishedAt(OffsetDateTime.now(clock))
                    .build();
            String body;
            try {
                body = objectMapper.writeValueAsString(envelope);
            } catch (JsonProcessingException e) {
                return Mono.error(new IllegalStateException("Envelope for topic '" + topic + "' could not be serialized", e));
            }

            return backbone.publish(channelFor(topic), body)
                    .timeout(properties.getFanout().getPublishTimeout())
                    .then(Mono.fromCallable(() -> {
                        publishedCounter.increment();
                        publisherHealthy.set(true);
                        log.debug("[FANOUT_PUBLISH] Envelope {} for topic '{}' published", envelope.getEnvelopeId(), topic);
                        return new FanOutResult(FanOutResult.Outcome.FANNED_OUT, delivered);
                    }))
                    .onErrorResume(e -> {
                        publishFailureCounter.increment();
                        publisherHealthy.set(false);
                        log.warn("[FANOUT_DEGRADED] Publish of event '{}' on topic '{}' failed, delivered to {} local connections only. Cause: {}",
                                event, topic, delivered, e.toString());
                        return Mono.just(new FanOutResult(FanOutResult.Outcome.LOCAL_ONLY, delivered));
                    });
        });
    }

    public BridgeState getState() {
        if (!running) {
            return BridgeState.STOPPED;
        }
        return publisherHealthy.get() && subscriberHealthy.get() ? BridgeState.CONNECTED : BridgeState.DEGRADED;
    }

    public boolean isDegraded() {
        return getState() == BridgeState.DEGRADED;
    }

    public int getInboxSize() {
        return inbox.size();
    }

    public Map<String, Object> getHealthDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("instanceId", instanceId());
        details.put("state", getState().name());
        details.put("publisher", publisherHealthy.get() ? "UP" : "DOWN");
        details.put("subscriber", subscriberHealthy.get() ? "UP" : "DOWN");
        details.put("inboxSize", inbox.size());
        details.put("droppedEnvelopes", inbox.getDroppedCount());
        details.put("publishFailures", (long) publishFailureCounter.count());
        return details;
    }

    private Disposable subscribeToBackbone(String pattern) {
        GatewayProperties.Fanout fanout = properties.getFanout();
        return Flux.defer(() -> backbone.subscribe(pattern)
                        .doOnNext(messages -> onSubscribed())
                        .flatMapMany(Function.identity()))
                .concatWith(Flux.defer(() -> Flux.error(new BackboneException("Subscription to '" + pattern + "' ended"))))
                .doOnError(this::onSubscriptionLost)
                .retryWhen(Retry.backoff(Long.MAX_VALUE, fanout.getReconnectMinBackoff())
                        .maxBackoff(fanout.getReconnectMaxBackoff())
                        .transientErrors(true)
                        .filter(e -> running)
                        .doBeforeRetry(signal -> log.info("[FANOUT_RESUBSCRIBE] Resubscribing to '{}', attempt {}",
                                pattern, signal.totalRetriesInARow() + 1)))
                .subscribe(this::enqueue, e -> {
                    if (running) {
                        log.error("[FANOUT_SUBSCRIBE_STOPPED] Backbone subscription terminated: {}", e.getMessage(), e);
                    } else {
                        log.debug("Backbone subscription closed during shutdown: {}", e.toString());
                    }
                });
    }

    private void onSubscribed() {
        subscriptionConfirmed.set(true);
        subscriberHealthy.set(true);
        // only the first confirmation completes the startup signal
        if (firstSubscription.tryEmitEmpty().isFailure()) {
            log.info("[FANOUT_RECOVERED] Backbone subscription re-established, cross-process fan-out resumed");
        }
    }

    private void onSubscriptionLost(Throwable e) {
        subscriberHealthy.set(false);
        if (running) {
            log.warn("[FANOUT_DEGRADED] Backbone subscription lost, cross-process fan-out paused: {}", e.toString());
        }
    }

    private void onSubscriberLink(boolean connected) {
        // an active link before the first confirmed subscription proves nothing
        if (connected && !subscriptionConfirmed.get()) {
            return;
        }
        boolean wasHealthy = subscriberHealthy.getAndSet(connected);
        if (!running) {
            return;
        }
        if (wasHealthy && !connected) {
            log.warn("[FANOUT_DEGRADED] Backbone subscriber connection dropped, cross-process fan-out paused");
        } else if (!wasHealthy && connected) {
            log.info("[FANOUT_RECOVERED] Backbone subscriber connection active again, cross-process fan-out resumed");
        }
    }

    private void onPublisherProbe(boolean healthy) {
        boolean wasHealthy = publisherHealthy.getAndSet(healthy);
        if (wasHealthy && !healthy) {
            log.warn("[FANOUT_DEGRADED] Backbone publisher connection is not answering");
        } else if (!wasHealthy && healthy) {
            log.info("[FANOUT_RECOVERED] Backbone publisher connection answering again");
        }
    }

    private void enqueue(BackboneMessage message) {
        if (inbox.offer(message)) {
            droppedCounter.increment();
            log.debug("Inbox full, oldest envelope dropped. Total dropped: {}", inbox.getDroppedCount());
        }
    }

    private void drainInbox() {
        while (running) {
            try {
                BackboneMessage message = inbox.poll(DISPATCH_POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (message != null) {
                    dispatch(message);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private void dispatch(BackboneMessage message) {
        try {
            BroadcastEnvelope envelope = objectMapper.readValue(message.getBody(), BroadcastEnvelope.class);
            receivedCounter.increment();

            if (instanceId().equals(envelope.getOriginId())) {
                selfSkippedCounter.increment();
                log.trace("Skipping own envelope {} on channel '{}'", envelope.getEnvelopeId(), message.getChannel());
                return;
            }
            if (!Topics.isValid(envelope.getTopic())) {
                log.warn("Discarding envelope {} from '{}' with invalid topic '{}'",
                        envelope.getEnvelopeId(), envelope.getOriginId(), envelope.getTopic());
                return;
            }

            log.debug("[FANOUT_RECEIVE] Envelope {} from instance '{}' for topic '{}'",
                    envelope.getEnvelopeId(), envelope.getOriginId(), envelope.getTopic());
            connectionManager.broadcastLocal(envelope.getTopic(), envelope.getEvent(), envelope.getPayload());
        } catch (IOException e) {
            log.error("Failed to deserialize envelope from backbone channel '{}'. Raw message: {}",
                    message.getChannel(), message.getBody(), e);
        } catch (Exception e) {
            log.error("Failed to dispatch envelope from backbone channel '{}'. Root cause: {}",
                    message.getChannel(), e.getMessage(), e);
        }
    }

    private void shutdownExecutorService(ExecutorService executorService) {
        if (executorService == null || executorService.isShutdown()) {
            return;
        }
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Fan-out dispatcher did not terminate in 5 seconds. Forcing shutdown...");
                executorService.shutdownNow();
            }
        } catch (InterruptedException ie) {
            log.error("Shutdown of fan-out dispatcher was interrupted.", ie);
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private String channelFor(String topic) {
        return properties.getBackbone().getChannelPrefix() + topic;
    }

    private String instanceId() {
        return properties.getInstanceId();
    }
}
