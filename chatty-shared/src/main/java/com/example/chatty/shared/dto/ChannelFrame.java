package com.example.chatty.shared.dto;

import com.example.chatty.shared.util.Constants.FrameType;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChannelFrame {
    private FrameType type;
    private String connectionId;
    private String topic;
    private String event;
    private JsonNode payload;
    private ErrorRecord error;
    private OffsetDateTime timestamp;
}
