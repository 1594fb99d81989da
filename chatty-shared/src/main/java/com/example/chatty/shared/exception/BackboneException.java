package com.example.chatty.shared.exception;

/**
 * Raised when the publish/subscribe backbone cannot be reached or drops a subscription.
 * Never shown to clients; the fan-out bridge turns it into degraded mode.
 */
public class BackboneException extends RuntimeException {

    public BackboneException(String message) {
        super(message);
    }

    public BackboneException(String message, Throwable cause) {
        super(message, cause);
    }
}
