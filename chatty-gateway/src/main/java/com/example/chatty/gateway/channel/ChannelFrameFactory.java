package com.example.chatty.gateway.channel;

import com.example.chatty.shared.dto.ChannelFrame;
import com.example.chatty.shared.dto.ErrorRecord;
import com.example.chatty.shared.util.Constants.FrameType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;

@Component
@RequiredArgsConstructor
public class ChannelFrameFactory {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final Clock clock;

    public ChannelFrame event(String topic, String event, JsonNode payload) {
        return ChannelFrame.builder()
                .type(FrameType.EVENT)
                .topic(topic)
                .event(event)
                .payload(payload)
                .timestamp(now())
                .build();
    }

    public ChannelFrame connected(String connectionId) {
        return ChannelFrame.builder()
                .type(FrameType.CONNECTED)
                .connectionId(connectionId)
                .payload(NODES.objectNode().put("message", "Event channel established"))
                .timestamp(now())
                .build();
    }

    public ChannelFrame subscribed(String topic) {
        return ChannelFrame.builder().type(FrameType.SUBSCRIBED).topic(topic).timestamp(now()).build();
    }

    public ChannelFrame unsubscribed(String topic) {
        return ChannelFrame.builder().type(FrameType.UNSUBSCRIBED).topic(topic).timestamp(now()).build();
    }

    public ChannelFrame error(ErrorRecord error) {
        return ChannelFrame.builder().type(FrameType.ERROR).error(error).timestamp(now()).build();
    }

    public ChannelFrame heartbeat() {
        return ChannelFrame.builder().type(FrameType.HEARTBEAT).timestamp(now()).build();
    }

    public ChannelFrame shutdown() {
        return ChannelFrame.builder()
                .type(FrameType.SERVER_SHUTDOWN)
                .payload(NODES.textNode("Server is shutting down. Please reconnect momentarily."))
                .timestamp(now())
                .build();
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
