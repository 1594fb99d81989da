package com.example.chatty.gateway.security;

import com.example.chatty.shared.exception.ErrorKind;
import com.example.chatty.shared.session.Session;
import com.example.chatty.shared.session.SessionCookieCodec;
import com.example.chatty.shared.util.Constants;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpCookie;
import org.springframework.http.ResponseCookie;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SessionPolicy")
class SessionPolicyTest {

    private static final String URL = "http://localhost:5000/api/channel/stats";
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private final ObjectMapper objectMapper = Jackson2ObjectMapperBuilder.json().build();
    private final SessionCookieCodec codec = new SessionCookieCodec("session",
            List.of("first-signing-key-0123456789", "second-signing-key-9876543210"),
            Duration.ofDays(7), true, objectMapper, Clock.fixed(NOW, ZoneOffset.UTC));
    private final SessionPolicy policy = new SessionPolicy(codec);

    private static MockServerHttpRequest.BaseBuilder<?> withCookies(List<ResponseCookie> cookies) {
        MockServerHttpRequest.BaseBuilder<?> request = MockServerHttpRequest.get(URL);
        cookies.forEach(cookie -> request.cookie(new HttpCookie(cookie.getName(), cookie.getValue())));
        return request;
    }

    @Test
    @DisplayName("lets requests without a session cookie through anonymously")
    void anonymousRequest() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get(URL));

        PolicyDecision decision = policy.apply(exchange);

        assertThat(decision.getAction()).isEqualTo(PolicyDecision.Action.PROCEED);
        assertThat(exchange.getAttributes()).doesNotContainKey(Constants.SESSION_ATTRIBUTE);
    }

    @Test
    @DisplayName("exposes a valid session to the rest of the request")
    void validSession() {
        Session issued = codec.issue("user-1", Map.of());
        MockServerWebExchange exchange = MockServerWebExchange.from(withCookies(codec.encode(issued)));

        PolicyDecision decision = policy.apply(exchange);

        assertThat(decision.getAction()).isEqualTo(PolicyDecision.Action.PROCEED);
        Session session = exchange.getAttribute(Constants.SESSION_ATTRIBUTE);
        assertThat(session).isNotNull();
        assertThat(session.getId()).isEqualTo(issued.getId());
        assertThat(session.getSubject()).isEqualTo("user-1");
    }

    @Test
    @DisplayName("rejects a tampered cookie and clears both cookies on the client")
    void tamperedSession() {
        List<ResponseCookie> cookies = codec.encode(codec.issue("user-1", Map.of()));
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get(URL)
                .cookie(new HttpCookie("session", cookies.get(0).getValue() + "x"))
                .cookie(new HttpCookie("session.sig", cookies.get(1).getValue())));

        PolicyDecision decision = policy.apply(exchange);

        assertThat(decision.getAction()).isEqualTo(PolicyDecision.Action.REJECT);
        assertThat(decision.getFailure().getKind()).isEqualTo(ErrorKind.AUTHENTICATION_FAILURE);
        assertThat(exchange.getResponse().getCookies().get("session")).singleElement()
                .satisfies(cookie -> assertThat(cookie.getMaxAge()).isEqualTo(Duration.ZERO));
        assertThat(exchange.getResponse().getCookies().get("session.sig")).singleElement()
                .satisfies(cookie -> assertThat(cookie.getMaxAge()).isEqualTo(Duration.ZERO));
    }
}
