package com.example.chatty.gateway.lifecycle;

import lombok.Getter;

/**
 * A startup stage failed; the gateway does not start.
 */
@Getter
public class LifecycleStageException extends RuntimeException {

    private final String stageName;

    public LifecycleStageException(String stageName, Throwable cause) {
        super("Gateway stage '" + stageName + "' failed to start: " + cause.getMessage(), cause);
        this.stageName = stageName;
    }
}
