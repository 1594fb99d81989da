package com.example.chatty.gateway.lifecycle;

import com.example.chatty.gateway.support.TestProperties;
import com.example.chatty.shared.config.GatewayProperties;
import com.example.chatty.shared.exception.InvalidConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatNoException;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ConfigurationStage")
class ConfigurationStageTest {

    @Test
    @DisplayName("accepts a complete configuration")
    void acceptsValidConfiguration() {
        GatewayProperties properties = TestProperties.gatewayProperties("node-a");

        assertThat(ConfigurationStage.validate(properties)).isEmpty();
        assertThatNoException().isThrownBy(() -> new ConfigurationStage(properties).start());
    }

    @Test
    @DisplayName("reports every problem at once")
    void reportsAllProblems() {
        GatewayProperties properties = TestProperties.gatewayProperties("node-a");
        properties.getCors().setAllowedOrigin("app.example.com");
        properties.getCors().setAllowedMethods(List.of("GET", "FETCH"));
        properties.getBackbone().setUrl("http://localhost:6379");
        properties.getBackbone().setChannelPrefix("chatty:*:");
        properties.getFanout().setReconnectMinBackoff(Duration.ofMinutes(5));

        List<String> problems = ConfigurationStage.validate(properties);

        assertThat(problems).hasSize(5);
        assertThat(problems).anySatisfy(problem -> assertThat(problem).contains("CLIENT_URL"));
        assertThat(problems).anySatisfy(problem -> assertThat(problem).contains("FETCH"));
        assertThat(problems).anySatisfy(problem -> assertThat(problem).contains("REDIS_HOST"));
        assertThat(problems).anySatisfy(problem -> assertThat(problem).contains("channel-prefix"));
        assertThat(problems).anySatisfy(problem -> assertThat(problem).contains("reconnect-min-backoff"));
    }

    @Test
    @DisplayName("fails the stage on an invalid configuration")
    void failsStart() {
        GatewayProperties properties = TestProperties.gatewayProperties("node-a");
        properties.getFanout().setPublishTimeout(Duration.ZERO);

        assertThatThrownBy(() -> new ConfigurationStage(properties).start())
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("chatty.fanout.publish-timeout");
    }
}
