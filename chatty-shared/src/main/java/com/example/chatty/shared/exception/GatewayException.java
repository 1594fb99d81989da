package com.example.chatty.shared.exception;

import com.example.chatty.shared.dto.FieldViolation;
import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.List;

/**
 * A failure the gateway recognizes. Its kind, status, message and field list are
 * safe to show to clients.
 */
@Getter
public class GatewayException extends RuntimeException {

    private final ErrorKind kind;
    private final HttpStatus status;
    private final List<FieldViolation> fields;

    public GatewayException(ErrorKind kind, String message) {
        this(kind, kind.getStatus(), message, List.of());
    }

    public GatewayException(ErrorKind kind, HttpStatus status, String message, List<FieldViolation> fields) {
        super(message);
        this.kind = kind;
        this.status = status;
        this.fields = List.copyOf(fields);
    }

    public static GatewayException routeNotFound(String path) {
        return new GatewayException(ErrorKind.ROUTE_NOT_FOUND, path + " not found");
    }

    public static GatewayException notFound(String message) {
        return new GatewayException(ErrorKind.ROUTE_NOT_FOUND, message);
    }

    public static GatewayException validation(String message, FieldViolation... fields) {
        return new GatewayException(ErrorKind.VALIDATION_FAILURE, HttpStatus.BAD_REQUEST, message, List.of(fields));
    }

    public static GatewayException methodNotAllowed(String method) {
        return new GatewayException(ErrorKind.VALIDATION_FAILURE, HttpStatus.METHOD_NOT_ALLOWED,
                "Method " + method + " is not allowed", List.of());
    }

    public static GatewayException authentication(String message) {
        return new GatewayException(ErrorKind.AUTHENTICATION_FAILURE, message);
    }

    public static GatewayException authorization(String message) {
        return new GatewayException(ErrorKind.AUTHORIZATION_FAILURE, message);
    }

    public static GatewayException conflict(String message) {
        return new GatewayException(ErrorKind.CONFLICT_FAILURE, message);
    }

    public static GatewayException fanOutDegraded(String message) {
        return new GatewayException(ErrorKind.FAN_OUT_DEGRADED, message);
    }
}
