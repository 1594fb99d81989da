package com.example.chatty.shared.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * Closed set of failure kinds the gateway reports to clients.
 * Every kind declares the status it is serialized with unless a
 * {@link GatewayException} overrides it.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorKind {
    ROUTE_NOT_FOUND(HttpStatus.NOT_FOUND),
    VALIDATION_FAILURE(HttpStatus.BAD_REQUEST),
    AUTHENTICATION_FAILURE(HttpStatus.UNAUTHORIZED),
    AUTHORIZATION_FAILURE(HttpStatus.FORBIDDEN),
    CONFLICT_FAILURE(HttpStatus.CONFLICT),
    FAN_OUT_DEGRADED(HttpStatus.SERVICE_UNAVAILABLE),
    UNEXPECTED_FAILURE(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;
}
