package com.example.chatty.gateway.security;

import org.springframework.http.HttpHeaders;
import org.springframework.web.server.ServerWebExchange;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Adds the fixed hardening header set to every response. Runs first, so error
 * responses written later carry the headers too.
 */
public class HardeningHeadersPolicy implements SecurityPolicy {

    static final Map<String, String> HEADERS;

    static {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("X-Content-Type-Options", "nosniff");
        headers.put("X-Frame-Options", "DENY");
        headers.put("Strict-Transport-Security", "max-age=15552000; includeSubDomains");
        headers.put("Referrer-Policy", "no-referrer");
        headers.put("X-DNS-Prefetch-Control", "off");
        headers.put("X-Download-Options", "noopen");
        headers.put("X-Permitted-Cross-Domain-Policies", "none");
        headers.put("Cross-Origin-Opener-Policy", "same-origin");
        headers.put("Cross-Origin-Resource-Policy", "same-origin");
        headers.put("X-XSS-Protection", "0");
        HEADERS = Collections.unmodifiableMap(headers);
    }

    @Override
    public String name() {
        return "hardening-headers";
    }

    @Override
    public PolicyDecision apply(ServerWebExchange exchange) {
        HttpHeaders responseHeaders = exchange.getResponse().getHeaders();
        HEADERS.forEach(responseHeaders::set);
        return PolicyDecision.proceed(exchange);
    }
}
