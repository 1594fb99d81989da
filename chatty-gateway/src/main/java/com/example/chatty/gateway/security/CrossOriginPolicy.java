package com.example.chatty.gateway.security;

import com.example.chatty.shared.config.GatewayProperties;
import com.example.chatty.shared.exception.GatewayException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.reactive.CorsUtils;
import org.springframework.web.server.ServerWebExchange;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Single allowed origin, credentials allowed, explicit method allow-list.
 * <p>
 * Preflights from the allowed origin are always answered with the configured success
 * status and the fixed method allow-list; the browser refuses methods outside it.
 * Actual requests whose method is outside the allow-list are rejected whether or not
 * they are cross-origin.
 */
@Slf4j
public class CrossOriginPolicy implements SecurityPolicy {

    private final CorsConfiguration configuration;
    private final HttpStatus preflightStatus;
    private final Set<HttpMethod> allowedMethods;

    public CrossOriginPolicy(GatewayProperties.Cors cors) {
        this.configuration = new CorsConfiguration();
        this.configuration.setAllowedOrigins(List.of(cors.getAllowedOrigin()));
        this.configuration.setAllowedMethods(cors.getAllowedMethods());
        this.configuration.addAllowedHeader(CorsConfiguration.ALL);
        this.configuration.setAllowCredentials(cors.isAllowCredentials());
        this.configuration.setMaxAge(cors.getMaxAge());
        this.preflightStatus = HttpStatus.valueOf(cors.getPreflightStatus());

        this.allowedMethods = new LinkedHashSet<>();
        cors.getAllowedMethods().forEach(method -> allowedMethods.add(HttpMethod.valueOf(method)));
    }

    @Override
    public String name() {
        return "cross-origin";
    }

    @Override
    public PolicyDecision apply(ServerWebExchange exchange) {
        ServerHttpRequest request = exchange.getRequest();
        HttpHeaders responseHeaders = exchange.getResponse().getHeaders();

        if (!CorsUtils.isCorsRequest(request)) {
            return checkMethod(exchange);
        }

        String origin = request.getHeaders().getOrigin();
        responseHeaders.add(HttpHeaders.VARY, HttpHeaders.ORIGIN);
        String allowedOrigin = configuration.checkOrigin(origin);
        if (allowedOrigin == null) {
            log.debug("Rejected cross-origin {} {} from origin '{}'", request.getMethod(), request.getPath(), origin);
            return PolicyDecision.reject(GatewayException.authorization("Origin " + origin + " is not allowed"));
        }

        if (CorsUtils.isPreFlightRequest(request)) {
            return preflight(exchange, allowedOrigin);
        }

        PolicyDecision methodDecision = checkMethod(exchange);
        if (methodDecision.getAction() != PolicyDecision.Action.PROCEED) {
            return methodDecision;
        }
        responseHeaders.setAccessControlAllowOrigin(allowedOrigin);
        if (Boolean.TRUE.equals(configuration.getAllowCredentials())) {
            responseHeaders.setAccessControlAllowCredentials(true);
        }
        return PolicyDecision.proceed(exchange);
    }

    private PolicyDecision preflight(ServerWebExchange exchange, String allowedOrigin) {
        HttpHeaders requestHeaders = exchange.getRequest().getHeaders();
        HttpHeaders responseHeaders = exchange.getResponse().getHeaders();
        responseHeaders.add(HttpHeaders.VARY, HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD);
        responseHeaders.add(HttpHeaders.VARY, HttpHeaders.ACCESS_CONTROL_REQUEST_HEADERS);

        HttpMethod requestedMethod = requestHeaders.getAccessControlRequestMethod();
        if (!allowedMethods.contains(requestedMethod)) {
            log.debug("Preflight for method {} on {} answered with the allow-list only", requestedMethod, exchange.getRequest().getPath());
        }

        List<String> requestedHeaders = requestHeaders.getAccessControlRequestHeaders();
        List<String> allowedHeaders = configuration.checkHeaders(requestedHeaders);
        if (!requestedHeaders.isEmpty() && allowedHeaders == null) {
            return PolicyDecision.reject(GatewayException.authorization("Requested headers are not allowed"));
        }

        responseHeaders.setAccessControlAllowOrigin(allowedOrigin);
        responseHeaders.setAccessControlAllowMethods(List.copyOf(allowedMethods));
        if (allowedHeaders != null && !allowedHeaders.isEmpty()) {
            responseHeaders.setAccessControlAllowHeaders(allowedHeaders);
        }
        if (Boolean.TRUE.equals(configuration.getAllowCredentials())) {
            responseHeaders.setAccessControlAllowCredentials(true);
        }
        if (configuration.getMaxAge() != null) {
            responseHeaders.setAccessControlMaxAge(configuration.getMaxAge());
        }
        return PolicyDecision.respond(preflightStatus);
    }

    private PolicyDecision checkMethod(ServerWebExchange exchange) {
        HttpMethod method = exchange.getRequest().getMethod();
        if (allowedMethods.contains(method)) {
            return PolicyDecision.proceed(exchange);
        }
        exchange.getResponse().getHeaders().setAllow(allowedMethods);
        return PolicyDecision.reject(GatewayException.methodNotAllowed(method.name()));
    }
}
