package com.example.chatty.gateway.security;

import com.example.chatty.shared.config.GatewayProperties;
import com.example.chatty.shared.exception.ErrorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CrossOriginPolicy")
class CrossOriginPolicyTest {

    private static final String CLIENT = "https://app.example.com";
    private static final String URL = "http://localhost:5000/api/channel/stats";

    private final CrossOriginPolicy policy = new CrossOriginPolicy(cors());

    private static GatewayProperties.Cors cors() {
        GatewayProperties.Cors cors = new GatewayProperties.Cors();
        cors.setAllowedOrigin(CLIENT);
        return cors;
    }

    @Nested
    @DisplayName("same-origin requests")
    class SameOrigin {

        @Test
        @DisplayName("pass without CORS headers")
        void passesWithoutHeaders() {
            MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get(URL));

            PolicyDecision decision = policy.apply(exchange);

            assertThat(decision.getAction()).isEqualTo(PolicyDecision.Action.PROCEED);
            assertThat(exchange.getResponse().getHeaders().getAccessControlAllowOrigin()).isNull();
        }

        @Test
        @DisplayName("are still held to the method allow-list")
        void rejectsMethodOutsideAllowList() {
            MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.put(URL));

            PolicyDecision decision = policy.apply(exchange);

            assertThat(decision.getAction()).isEqualTo(PolicyDecision.Action.REJECT);
            assertThat(decision.getStatus()).isEqualTo(HttpStatus.METHOD_NOT_ALLOWED);
            assertThat(exchange.getResponse().getHeaders().getAllow()).contains(HttpMethod.GET, HttpMethod.POST);
        }
    }

    @Nested
    @DisplayName("cross-origin requests")
    class CrossOrigin {

        @Test
        @DisplayName("from the allowed origin get origin and credentials headers")
        void allowsConfiguredOrigin() {
            MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get(URL).header(HttpHeaders.ORIGIN, CLIENT));

            PolicyDecision decision = policy.apply(exchange);

            HttpHeaders headers = exchange.getResponse().getHeaders();
            assertThat(decision.getAction()).isEqualTo(PolicyDecision.Action.PROCEED);
            assertThat(headers.getAccessControlAllowOrigin()).isEqualTo(CLIENT);
            assertThat(headers.getAccessControlAllowCredentials()).isTrue();
            assertThat(headers.getVary()).contains(HttpHeaders.ORIGIN);
        }

        @Test
        @DisplayName("from any other origin are forbidden")
        void rejectsOtherOrigin() {
            MockServerWebExchange exchange = MockServerWebExchange.from(
                    MockServerHttpRequest.get(URL).header(HttpHeaders.ORIGIN, "https://evil.example.org"));

            PolicyDecision decision = policy.apply(exchange);

            assertThat(decision.getAction()).isEqualTo(PolicyDecision.Action.REJECT);
            assertThat(decision.getFailure().getKind()).isEqualTo(ErrorKind.AUTHORIZATION_FAILURE);
            assertThat(exchange.getResponse().getHeaders().getAccessControlAllowOrigin()).isNull();
        }

        @Test
        @DisplayName("actual requests with a method outside the allow-list are not allowed")
        void rejectsActualRequestWithOtherMethod() {
            MockServerWebExchange exchange = MockServerWebExchange.from(
                    MockServerHttpRequest.put(URL).header(HttpHeaders.ORIGIN, CLIENT));

            PolicyDecision decision = policy.apply(exchange);

            assertThat(decision.getAction()).isEqualTo(PolicyDecision.Action.REJECT);
            assertThat(decision.getStatus()).isEqualTo(HttpStatus.METHOD_NOT_ALLOWED);
            assertThat(exchange.getResponse().getHeaders().getAccessControlAllowOrigin()).isNull();
        }

        @Test
        @DisplayName("preflights are answered with the configured status")
        void answersPreflight() {
            MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.options(URL)
                    .header(HttpHeaders.ORIGIN, CLIENT)
                    .header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, "POST")
                    .header(HttpHeaders.ACCESS_CONTROL_REQUEST_HEADERS, "content-type"));

            PolicyDecision decision = policy.apply(exchange);

            HttpHeaders headers = exchange.getResponse().getHeaders();
            assertThat(decision.getAction()).isEqualTo(PolicyDecision.Action.RESPOND);
            assertThat(decision.getStatus()).isEqualTo(HttpStatus.OK);
            assertThat(headers.getAccessControlAllowOrigin()).isEqualTo(CLIENT);
            assertThat(headers.getAccessControlAllowMethods()).contains(HttpMethod.POST);
            assertThat(headers.getAccessControlAllowHeaders()).contains("content-type");
            assertThat(headers.getAccessControlMaxAge()).isEqualTo(3600L);
        }

        @Test
        @DisplayName("preflights for a method outside the allow-list still get the configured status and allow-list")
        void answersPreflightForOtherMethodWithAllowList() {
            MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.options(URL)
                    .header(HttpHeaders.ORIGIN, CLIENT)
                    .header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, "PUT"));

            PolicyDecision decision = policy.apply(exchange);

            HttpHeaders headers = exchange.getResponse().getHeaders();
            assertThat(decision.getAction()).isEqualTo(PolicyDecision.Action.RESPOND);
            assertThat(decision.getStatus()).isEqualTo(HttpStatus.OK);
            assertThat(headers.getAccessControlAllowOrigin()).isEqualTo(CLIENT);
            assertThat(headers.getAccessControlAllowMethods())
                    .containsExactly(HttpMethod.GET, HttpMethod.POST, HttpMethod.DELETE, HttpMethod.OPTIONS)
                    .doesNotContain(HttpMethod.PUT);
        }
    }
}
