package com.example.chatty.gateway.dto;

import com.example.chatty.gateway.fanout.FanOutResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PublishResponse {
    private String topic;
    private String event;
    private FanOutResult.Outcome outcome;
    private int localDeliveries;
    private String instanceId;
    private OffsetDateTime timestamp;
}
