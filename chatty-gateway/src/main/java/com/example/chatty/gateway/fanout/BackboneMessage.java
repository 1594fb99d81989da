package com.example.chatty.gateway.fanout;

import lombok.Value;

@Value
public class BackboneMessage {
    String channel;
    String body;
}
