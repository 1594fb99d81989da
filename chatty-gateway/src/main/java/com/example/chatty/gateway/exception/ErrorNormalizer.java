package com.example.chatty.gateway.exception;

import com.example.chatty.shared.dto.ErrorRecord;
import com.example.chatty.shared.dto.FieldViolation;
import com.example.chatty.shared.exception.ErrorKind;
import com.example.chatty.shared.exception.GatewayException;
import com.example.chatty.shared.util.Constants;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebExceptionHandler;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Turns every failure into an {@link ErrorRecord}.
 * <p>
 * Recognized failures keep their own status, message and field list. Anything else is
 * logged in full here and replaced by one fixed internal-error record, so nothing about
 * the cause reaches the client. Ordered ahead of Spring Boot's own error handlers.
 */
@Component
@Order(ErrorNormalizer.ORDER)
@Slf4j
@RequiredArgsConstructor
public class ErrorNormalizer implements WebExceptionHandler {

    public static final int ORDER = -2;

    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public Mono<Void> handle(ServerWebExchange exchange, Throwable ex) {
        ServerHttpResponse response = exchange.getResponse();
        String path = exchange.getRequest().getPath().value();

        if (response.isCommitted()) {
            log.warn("Response for path {} already committed, failure logged only: {}", path, ex.toString(), ex);
            return Mono.empty();
        }

        ErrorRecord record = normalize(ex, path);
        byte[] body;
        try {
            body = objectMapper.writeValueAsBytes(record);
        } catch (JsonProcessingException e) {
            log.error("Error record for path {} could not be serialized", path, e);
            response.setStatusCode(HttpStatus.INTERNAL_SERVER_ERROR);
            return response.setComplete();
        }

        response.setStatusCode(HttpStatusCode.valueOf(record.getStatus()));
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        response.getHeaders().setContentLength(body.length);
        DataBuffer buffer = response.bufferFactory().wrap(body);
        return response.writeWith(Mono.just(buffer));
    }

    /**
     * Maps any failure to the record a client may see. Used for HTTP responses and for
     * {@code ERROR} frames on the event channel.
     */
    public ErrorRecord normalize(Throwable ex, String path) {
        if (ex instanceof GatewayException) {
            return fromGatewayException((GatewayException) ex, path);
        }
        if (ex instanceof WebExchangeBindException) {
            WebExchangeBindException bindException = (WebExchangeBindException) ex;
            List<FieldViolation> fields = bindException.getFieldErrors().stream()
                    .map(error -> new FieldViolation(error.getField(), error.getDefaultMessage()))
                    .collect(Collectors.toList());
            log.warn("Validation error on path {}: {}", path, fields);
            return record(ErrorKind.VALIDATION_FAILURE, HttpStatus.BAD_REQUEST, "Request validation failed", path, fields);
        }
        if (ex instanceof ResponseStatusException) {
            return fromResponseStatus((ResponseStatusException) ex, path);
        }
        return unexpected(ex, path);
    }

    private ErrorRecord fromGatewayException(GatewayException ex, String path) {
        switch (ex.getKind()) {
            case ROUTE_NOT_FOUND:
            case VALIDATION_FAILURE:
            case AUTHENTICATION_FAILURE:
            case AUTHORIZATION_FAILURE:
            case CONFLICT_FAILURE:
            case FAN_OUT_DEGRADED:
                log.warn("{} on path {}: {}", ex.getKind(), path, ex.getMessage());
                return record(ex.getKind(), ex.getStatus(), ex.getMessage(), path, ex.getFields());
            default:
                return unexpected(ex, path);
        }
    }

    private ErrorRecord fromResponseStatus(ResponseStatusException ex, String path) {
        HttpStatusCode statusCode = ex.getStatusCode();
        HttpStatus status = HttpStatus.resolve(statusCode.value());
        if (status == null || statusCode.is5xxServerError()) {
            return unexpected(ex, path);
        }

        log.warn("Client error: {} on path '{}' - Reason: {}", status.value(), path, ex.getReason());
        String reason = ex.getReason() != null ? ex.getReason() : status.getReasonPhrase();
        switch (status) {
            case NOT_FOUND:
                return fromGatewayException(GatewayException.routeNotFound(path), path);
            case UNAUTHORIZED:
                return record(ErrorKind.AUTHENTICATION_FAILURE, status, reason, path, List.of());
            case FORBIDDEN:
                return record(ErrorKind.AUTHORIZATION_FAILURE, status, reason, path, List.of());
            case CONFLICT:
                return record(ErrorKind.CONFLICT_FAILURE, status, reason, path, List.of());
            default:
                return record(ErrorKind.VALIDATION_FAILURE, status, reason, path, List.of());
        }
    }

    private ErrorRecord unexpected(Throwable ex, String path) {
        log.error("An unexpected error occurred at path {}:", path, ex);
        return record(ErrorKind.UNEXPECTED_FAILURE, HttpStatus.INTERNAL_SERVER_ERROR,
                Constants.UNEXPECTED_FAILURE_MESSAGE, path, List.of());
    }

    private ErrorRecord record(ErrorKind kind, HttpStatus status, String message, String path, List<FieldViolation> fields) {
        return ErrorRecord.builder()
                .timestamp(OffsetDateTime.now(clock))
                .status(status.value())
                .kind(kind.name())
                .error(status.getReasonPhrase())
                .message(message)
                .path(path)
                .fields(fields)
                .build();
    }
}
