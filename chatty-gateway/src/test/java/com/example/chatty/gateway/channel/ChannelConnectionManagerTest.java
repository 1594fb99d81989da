package com.example.chatty.gateway.channel;

import com.example.chatty.gateway.support.ChannelTestClient;
import com.example.chatty.gateway.support.TestProperties;
import com.example.chatty.gateway.support.TestWaits;
import com.example.chatty.shared.config.GatewayProperties;
import com.example.chatty.shared.dto.ChannelFrame;
import com.example.chatty.shared.exception.ErrorKind;
import com.example.chatty.shared.exception.GatewayException;
import com.example.chatty.shared.session.Session;
import com.example.chatty.shared.util.Constants.FrameType;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.reactivestreams.Subscription;
import reactor.core.publisher.BaseSubscriber;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ChannelConnectionManager")
class ChannelConnectionManagerTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private final Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
    private GatewayProperties properties;
    private ChannelConnectionManager manager;

    @BeforeEach
    void setUp() {
        properties = TestProperties.gatewayProperties("node-a");
        manager = new ChannelConnectionManager(properties, new ChannelFrameFactory(clock), clock);
        manager.start();
    }

    @AfterEach
    void tearDown() {
        manager.stop();
    }

    @Nested
    @DisplayName("opening connections")
    class Opening {

        @Test
        @DisplayName("queues a CONNECTED frame carrying the connection id")
        void queuesConnectedFrame() {
            Session session = Session.builder().id("s1").subject("user-1").build();
            ChannelConnection connection = manager.open("c1", "chat.v1", session);
            ChannelTestClient client = new ChannelTestClient(connection);

            assertThat(connection.getState()).isEqualTo(ConnectionState.ESTABLISHED);
            assertThat(connection.getSession().getSubject()).isEqualTo("user-1");
            assertThat(client.getFrames()).singleElement().satisfies(frame -> {
                assertThat(frame.getType()).isEqualTo(FrameType.CONNECTED);
                assertThat(frame.getConnectionId()).isEqualTo("c1");
            });
            assertThat(manager.getConnectionCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("rejects a second connection with the same id")
        void rejectsDuplicateId() {
            manager.open("c1", null, null);

            assertThatThrownBy(() -> manager.open("c1", null, null))
                    .isInstanceOf(GatewayException.class)
                    .satisfies(e -> assertThat(((GatewayException) e).getKind()).isEqualTo(ErrorKind.CONFLICT_FAILURE));
            assertThat(manager.getConnectionCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("refuses connections once stopped")
        void refusesWhenStopped() {
            manager.stop();

            assertThat(manager.isAccepting()).isFalse();
            assertThatThrownBy(() -> manager.open("c1", null, null)).isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    @DisplayName("delivery")
    class Delivery {

        @Test
        @DisplayName("reports a closed connection instead of failing")
        void emitToClosedConnection() {
            manager.open("c1", null, null);
            manager.onDisconnect("c1");

            assertThat(manager.emit("c1", "message", JsonNodeFactory.instance.textNode("late")))
                    .isEqualTo(DeliveryOutcome.CONNECTION_GONE);
            assertThat(manager.emit("never-opened", "message", null)).isEqualTo(DeliveryOutcome.CONNECTION_GONE);
        }

        @Test
        @DisplayName("broadcasts only to connections subscribed to the topic")
        void broadcastsToSubscribers() {
            ChannelTestClient first = new ChannelTestClient(manager.open("c1", null, null));
            ChannelTestClient second = new ChannelTestClient(manager.open("c2", null, null));
            ChannelTestClient third = new ChannelTestClient(manager.open("c3", null, null));
            manager.subscribe("c1", "room-1");
            manager.subscribe("c2", "room-1");
            manager.subscribe("c3", "room-2");

            int delivered = manager.broadcastLocal("room-1", "message", null);

            assertThat(delivered).isEqualTo(2);
            assertThat(first.eventNames()).containsExactly("message");
            assertThat(second.eventNames()).containsExactly("message");
            assertThat(third.eventNames()).isEmpty();
        }

        @Test
        @DisplayName("keeps events in publish order per connection")
        void preservesOrder() {
            ChannelTestClient client = new ChannelTestClient(manager.open("c1", null, null));
            manager.subscribe("c1", "room-1");

            for (int i = 0; i < 20; i++) {
                manager.broadcastLocal("room-1", "event-" + i, null);
            }

            List<String> expected = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                expected.add("event-" + i);
            }
            assertThat(client.eventNames()).containsExactlyElementsOf(expected);
        }

        @Test
        @DisplayName("closes a connection whose outbound buffer stays full")
        void closesSlowConsumer() {
            properties.getChannel().setOutboundBuffer(8);
            properties.getChannel().setMaxFailedEmits(3);
            // subscribed but never requesting, like a client that stopped reading
            manager.open("slow", null, null).outbound().subscribe(new BaseSubscriber<ChannelFrame>() {
                @Override
                protected void hookOnSubscribe(Subscription subscription) {
                }
            });

            List<DeliveryOutcome> outcomes = new ArrayList<>();
            for (int i = 0; i < 100; i++) {
                outcomes.add(manager.emit("slow", "event-" + i, null));
            }

            assertThat(outcomes).contains(DeliveryOutcome.DROPPED);
            TestWaits.until(() -> manager.find("slow").isEmpty(), WAIT, "slow consumer to be disconnected");
        }
    }

    @Nested
    @DisplayName("topics")
    class TopicSubscriptions {

        @Test
        @DisplayName("acknowledges subscribe and unsubscribe and tracks subscriber counts")
        void tracksSubscriptions() {
            ChannelTestClient client = new ChannelTestClient(manager.open("c1", null, null));
            manager.open("c2", null, null);

            manager.subscribe("c1", "room-1");
            manager.subscribe("c2", "room-1");
            manager.subscribe("c2", "room-2");
            assertThat(manager.getTopicSubscriberCounts()).containsEntry("room-1", 2L).containsEntry("room-2", 1L);

            manager.unsubscribe("c1", "room-1");

            assertThat(manager.getTopicSubscriberCounts()).containsEntry("room-1", 1L);
            assertThat(client.framesOfType(FrameType.SUBSCRIBED)).hasSize(1);
            assertThat(client.framesOfType(FrameType.UNSUBSCRIBED)).hasSize(1);
            assertThat(manager.find("c1").orElseThrow().getTopics()).isEmpty();
        }

        @Test
        @DisplayName("does not subscribe a connection that is gone")
        void subscribeAfterDisconnect() {
            manager.open("c1", null, null);
            manager.onDisconnect("c1");

            assertThat(manager.subscribe("c1", "room-1")).isEqualTo(DeliveryOutcome.CONNECTION_GONE);
            assertThat(manager.getTopicSubscriberCounts()).isEmpty();
        }
    }

    @Nested
    @DisplayName("disconnecting")
    class Disconnecting {

        @Test
        @DisplayName("releases a connection once, however often it is called")
        void disconnectIsIdempotent() {
            ChannelConnection connection = manager.open("c1", null, null);
            ChannelTestClient client = new ChannelTestClient(connection);
            manager.subscribe("c1", "room-1");

            assertThat(manager.onDisconnect("c1")).isTrue();
            assertThat(manager.onDisconnect("c1")).isFalse();

            assertThat(connection.getState()).isEqualTo(ConnectionState.CLOSED);
            assertThat(connection.getTopics()).isEmpty();
            assertThat(client.isCompleted()).isTrue();
            assertThat(manager.getConnectionCount()).isZero();
            assertThat(manager.broadcastLocal("room-1", "message", null)).isZero();
        }

        @Test
        @DisplayName("sends a shutdown notice to every connection on stop")
        void notifiesOnShutdown() {
            ChannelTestClient first = new ChannelTestClient(manager.open("c1", null, null));
            ChannelTestClient second = new ChannelTestClient(manager.open("c2", null, null));

            manager.stop();

            assertThat(first.framesOfType(FrameType.SERVER_SHUTDOWN)).hasSize(1);
            assertThat(second.framesOfType(FrameType.SERVER_SHUTDOWN)).hasSize(1);
            assertThat(first.isCompleted()).isTrue();
            assertThat(manager.getConnectionCount()).isZero();
        }
    }

    @Test
    @DisplayName("sends heartbeats to open connections")
    void sendsHeartbeats() {
        manager.stop();
        properties.getChannel().setHeartbeatInterval(Duration.ofMillis(50));
        manager.start();
        ChannelTestClient client = new ChannelTestClient(manager.open("c1", null, null));

        TestWaits.until(() -> !client.framesOfType(FrameType.HEARTBEAT).isEmpty(), WAIT, "a heartbeat frame");
    }
}
