package com.example.chatty.gateway.config;

import com.example.chatty.shared.config.GatewayProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.util.UUID;

@Configuration
@Slf4j
public class PropertiesConfig {

    @Value("${pod.name:${POD_NAME:}}")
    private String podName;

    @Bean
    @ConfigurationProperties(prefix = "chatty")
    public GatewayProperties gatewayProperties() {
        GatewayProperties properties = new GatewayProperties();

        // Instance id comes from the pod name when deployed; anything else gets a random one.
        // @ConfigurationProperties binds the rest (chatty.cors.*, chatty.fanout.*, ...) afterwards.
        if (StringUtils.hasText(podName)) {
            properties.setInstanceId(podName);
        } else {
            properties.setInstanceId("chatty-" + UUID.randomUUID());
            log.info("POD_NAME not set, using generated instance id '{}'", properties.getInstanceId());
        }
        return properties;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
