package com.example.chatty.gateway.channel;

public enum ConnectionState {
    CONNECTING,
    ESTABLISHED,
    CLOSING,
    CLOSED
}
