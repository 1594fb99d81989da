package com.example.chatty.gateway.dto;

import com.example.chatty.gateway.channel.ConnectionState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConnectionStatusResponse {
    private String connectionId;
    private ConnectionState state;
    private String protocol;
    private String subject;
    private Set<String> topics;
    private OffsetDateTime connectedAt;
}
