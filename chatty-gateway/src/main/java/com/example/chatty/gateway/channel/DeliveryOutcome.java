package com.example.chatty.gateway.channel;

/**
 * Result of handing a frame to one connection. None of these is an error for the caller.
 */
public enum DeliveryOutcome {
    DELIVERED,
    /** The connection's outbound buffer is full; the frame was discarded. */
    DROPPED,
    /** The connection is closing, closed or not attached to this process. */
    CONNECTION_GONE
}
