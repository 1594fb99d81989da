package com.example.chatty.gateway.security;

import com.example.chatty.shared.exception.GatewayException;
import com.example.chatty.shared.session.Session;
import com.example.chatty.shared.session.SessionCookieCodec;
import com.example.chatty.shared.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpCookie;
import org.springframework.util.MultiValueMap;
import org.springframework.web.server.ServerWebExchange;

/**
 * Validates the session cookie pair when present and exposes the decoded session under
 * {@link Constants#SESSION_ATTRIBUTE}. Requests without a session cookie pass through
 * anonymously; an invalid or expired cookie is rejected and cleared on the client.
 */
@Slf4j
@RequiredArgsConstructor
public class SessionPolicy implements SecurityPolicy {

    private final SessionCookieCodec codec;

    @Override
    public String name() {
        return "session";
    }

    @Override
    public PolicyDecision apply(ServerWebExchange exchange) {
        MultiValueMap<String, HttpCookie> cookies = exchange.getRequest().getCookies();
        HttpCookie value = cookies.getFirst(codec.getCookieName());
        if (value == null) {
            return PolicyDecision.proceed(exchange);
        }
        HttpCookie signature = cookies.getFirst(codec.getSignatureCookieName());

        try {
            Session session = codec.decode(value.getValue(), signature != null ? signature.getValue() : null);
            exchange.getAttributes().put(Constants.SESSION_ATTRIBUTE, session);
            log.debug("Session {} validated for subject '{}'", session.getId(), session.getSubject());
            return PolicyDecision.proceed(exchange);
        } catch (GatewayException e) {
            log.debug("Session cookie rejected on {}: {}", exchange.getRequest().getPath(), e.getMessage());
            codec.expire().forEach(exchange.getResponse()::addCookie);
            return PolicyDecision.reject(e);
        }
    }
}
