package com.example.chatty.gateway.fanout;

import com.example.chatty.gateway.channel.ChannelConnectionManager;
import com.example.chatty.gateway.channel.ChannelFrameFactory;
import com.example.chatty.gateway.support.ChannelTestClient;
import com.example.chatty.gateway.support.InMemoryBackbone;
import com.example.chatty.gateway.support.TestProperties;
import com.example.chatty.gateway.support.TestWaits;
import com.example.chatty.shared.config.GatewayProperties;
import com.example.chatty.shared.dto.ChannelFrame;
import com.example.chatty.shared.util.Constants.FrameType;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Several gateway processes sharing one backbone, each publishing on its own topic.
 */
@DisplayName("Fan-out across processes")
class FanOutClusterTest {

    private static final int PROCESSES = 3;
    private static final int ENVELOPES = 40;
    private static final Duration WAIT = Duration.ofSeconds(10);

    private final ObjectMapper objectMapper = Jackson2ObjectMapperBuilder.json().build();
    private final Clock clock = Clock.systemUTC();
    private final InMemoryBackbone backbone = new InMemoryBackbone();
    private final List<ChannelConnectionManager> managers = new ArrayList<>();
    private final List<FanOutBridge> bridges = new ArrayList<>();
    private final List<ChannelTestClient> clients = new ArrayList<>();

    @AfterEach
    void stopProcesses() {
        bridges.forEach(FanOutBridge::stop);
        managers.forEach(ChannelConnectionManager::stop);
    }

    private static String topic(int process) {
        return "topic-" + process;
    }

    // each process listens to its own topic and the next process's topic
    private static List<String> subscribedTopics(int process) {
        return List.of(topic(process), topic((process + 1) % PROCESSES));
    }

    @Test
    @DisplayName("every subscriber receives exactly its topics' envelopes across a backbone reconnect")
    void deliversExactlyTheSubscribedTopics() {
        for (int i = 0; i < PROCESSES; i++) {
            GatewayProperties properties = TestProperties.gatewayProperties("process-" + i);
            ChannelConnectionManager manager = new ChannelConnectionManager(properties, new ChannelFrameFactory(clock), clock);
            FanOutBridge bridge = new FanOutBridge(backbone, manager, objectMapper, properties, clock, new SimpleMeterRegistry());
            manager.start();
            bridge.start();
            managers.add(manager);
            bridges.add(bridge);

            String connectionId = "client-" + i;
            clients.add(new ChannelTestClient(manager.open(connectionId, null, null)));
            subscribedTopics(i).forEach(topic -> manager.subscribe(connectionId, topic));
        }

        int half = ENVELOPES / 2;
        publishRange(0, half);
        awaitDeliveries(half);

        backbone.dropSubscriptions();
        TestWaits.until(() -> backbone.getSubscriberCount() == PROCESSES
                        && bridges.stream().allMatch(bridge -> bridge.getState() == FanOutBridge.BridgeState.CONNECTED),
                WAIT, "every process to resubscribe");

        publishRange(half, ENVELOPES);
        awaitDeliveries(ENVELOPES);

        for (int i = 0; i < PROCESSES; i++) {
            Map<String, List<String>> eventsByTopic = clients.get(i).framesOfType(FrameType.EVENT).stream()
                    .collect(Collectors.groupingBy(ChannelFrame::getTopic,
                            Collectors.mapping(ChannelFrame::getEvent, Collectors.toList())));

            assertThat(eventsByTopic.keySet()).containsExactlyInAnyOrderElementsOf(subscribedTopics(i));
            for (String topic : subscribedTopics(i)) {
                assertThat(eventsByTopic.get(topic)).containsExactlyElementsOf(expectedEvents(topic));
            }
        }
    }

    private void publishRange(int fromInclusive, int toExclusive) {
        for (int n = fromInclusive; n < toExclusive; n++) {
            for (int i = 0; i < PROCESSES; i++) {
                FanOutResult result = bridges.get(i).broadcast(topic(i), topic(i) + "#" + n, null).block(WAIT);
                assertThat(result).isNotNull();
                assertThat(result.isFannedOut()).isTrue();
            }
        }
    }

    private void awaitDeliveries(int perTopic) {
        int expected = perTopic * 2;
        TestWaits.until(() -> clients.stream().allMatch(client -> client.eventNames().size() >= expected),
                WAIT, expected + " events on every client");
    }

    private static List<String> expectedEvents(String topic) {
        List<String> events = new ArrayList<>();
        for (int n = 0; n < ENVELOPES; n++) {
            events.add(topic + "#" + n);
        }
        return events;
    }
}
