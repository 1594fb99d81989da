package com.example.chatty.gateway.channel;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A text frame sent by a client over the event channel, e.g.
 * {@code {"action":"subscribe","topic":"room:42"}}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChannelCommand {
    private String action;
    private String topic;
    private String event;
    private JsonNode payload;
}
