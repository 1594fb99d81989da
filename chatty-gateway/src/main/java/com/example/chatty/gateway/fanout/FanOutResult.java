package com.example.chatty.gateway.fanout;

import lombok.Value;

@Value
public class FanOutResult {

    public enum Outcome {
        /** Delivered locally and accepted by the backbone. */
        FANNED_OUT,
        /** Delivered locally only; cross-process fan-out is degraded. */
        LOCAL_ONLY
    }

    Outcome outcome;
    int localDeliveries;

    public boolean isFannedOut() {
        return outcome == Outcome.FANNED_OUT;
    }
}
