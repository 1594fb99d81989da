package com.example.chatty.shared.dto;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * Unit carried across the backbone. {@code originId} names the process that published it.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BroadcastEnvelope {
    private String envelopeId;
    private String topic;
    private String event;
    private JsonNode payload;
    private String originId;
    private OffsetDateTime publishedAt;
}
