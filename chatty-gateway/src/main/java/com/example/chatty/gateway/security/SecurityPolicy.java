package com.example.chatty.gateway.security;

import org.springframework.web.server.ServerWebExchange;

/**
 * One request-level check of the security gate. Policies run in a fixed order and
 * must not write a response body themselves.
 */
public interface SecurityPolicy {

    String name();

    PolicyDecision apply(ServerWebExchange exchange);
}
