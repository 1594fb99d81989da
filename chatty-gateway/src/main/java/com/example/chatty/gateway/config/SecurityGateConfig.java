package com.example.chatty.gateway.config;

import com.example.chatty.gateway.security.CrossOriginPolicy;
import com.example.chatty.gateway.security.HardeningHeadersPolicy;
import com.example.chatty.gateway.security.ParameterPollutionPolicy;
import com.example.chatty.gateway.security.SecurityGateFilter;
import com.example.chatty.gateway.security.SessionPolicy;
import com.example.chatty.shared.config.CorrelationIdFilter;
import com.example.chatty.shared.config.GatewayProperties;
import com.example.chatty.shared.session.SessionCookieCodec;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * Wires the security policies in the order every request goes through them:
 * hardening headers, cross-origin, parameter pollution, session.
 */
@Configuration
public class SecurityGateConfig {

    @Bean
    public SessionCookieCodec sessionCookieCodec(GatewayProperties gatewayProperties, ObjectMapper objectMapper, Clock clock) {
        return SessionCookieCodec.from(gatewayProperties, objectMapper, clock);
    }

    @Bean
    public SecurityGateFilter securityGateFilter(GatewayProperties gatewayProperties, SessionCookieCodec sessionCookieCodec) {
        return new SecurityGateFilter(List.of(
                new HardeningHeadersPolicy(),
                new CrossOriginPolicy(gatewayProperties.getCors()),
                new ParameterPollutionPolicy(gatewayProperties.getHpp().getWhitelist()),
                new SessionPolicy(sessionCookieCodec)));
    }

    @Bean
    public CorrelationIdFilter correlationIdFilter() {
        return new CorrelationIdFilter();
    }
}
