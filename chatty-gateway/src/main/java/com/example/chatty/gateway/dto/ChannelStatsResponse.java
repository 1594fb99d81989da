package com.example.chatty.gateway.dto;

import com.example.chatty.gateway.fanout.FanOutBridge;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChannelStatsResponse {
    private String instanceId;
    private int localConnections;
    private FanOutBridge.BridgeState fanOutState;
    private boolean degraded;
    private Map<String, Long> topicSubscribers;
    private OffsetDateTime timestamp;
}
