package com.example.chatty.gateway.security;

import com.example.chatty.shared.exception.GatewayException;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ServerWebExchange;

/**
 * What a {@link SecurityPolicy} wants done with a request.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class PolicyDecision {

    public enum Action {
        /** Hand the (possibly replaced) exchange to the next policy. */
        PROCEED,
        /** Complete the response with a success status; nothing downstream runs. */
        RESPOND,
        /** Stop and report the failure to the error normalizer. */
        REJECT
    }

    private final Action action;
    private final ServerWebExchange exchange;
    private final HttpStatus status;
    private final GatewayException failure;

    public static PolicyDecision proceed(ServerWebExchange exchange) {
        return new PolicyDecision(Action.PROCEED, exchange, null, null);
    }

    public static PolicyDecision respond(HttpStatus status) {
        return new PolicyDecision(Action.RESPOND, null, status, null);
    }

    public static PolicyDecision reject(GatewayException failure) {
        return new PolicyDecision(Action.REJECT, null, failure.getStatus(), failure);
    }
}
