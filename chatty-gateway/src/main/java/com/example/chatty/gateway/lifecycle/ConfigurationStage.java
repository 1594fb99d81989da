package com.example.chatty.gateway.lifecycle;

import com.example.chatty.shared.config.GatewayProperties;
import com.example.chatty.shared.exception.InvalidConfigurationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Semantic checks that bean validation on {@link GatewayProperties} cannot express.
 * All problems are reported together.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ConfigurationStage implements LifecycleStage {

    private static final Set<String> KNOWN_METHODS = Arrays.stream(HttpMethod.values())
            .map(HttpMethod::name)
            .collect(Collectors.toUnmodifiableSet());

    private final GatewayProperties properties;

    @Override
    public String stageName() {
        return "configuration";
    }

    @Override
    public void start() {
        List<String> problems = validate(properties);
        if (!problems.isEmpty()) {
            throw new InvalidConfigurationException(problems);
        }

        GatewayProperties.SessionCookie sessionCookie = properties.getSessionCookie();
        if (sessionCookie.getPrimaryKey() != null && sessionCookie.getPrimaryKey().equals(sessionCookie.getSecondaryKey())) {
            log.warn("SECRET_KEY_ONE and SECRET_KEY_TWO are identical; key rotation has no overlap window");
        }

        log.info("Configuration valid: instanceId='{}', environment='{}', allowedOrigin='{}', backbone='{}', secureCookies={}",
                properties.getInstanceId(), properties.getEnvironment(), properties.getCors().getAllowedOrigin(),
                redact(properties.getBackbone().getUrl()), !properties.isDevelopmentMode());
    }

    @Override
    public void stop() {
        log.debug("Configuration stage has nothing to release");
    }

    static List<String> validate(GatewayProperties properties) {
        List<String> problems = new ArrayList<>();

        String origin = properties.getCors().getAllowedOrigin();
        URI originUri = parse(origin);
        if (originUri == null || originUri.getHost() == null
                || !("http".equals(originUri.getScheme()) || "https".equals(originUri.getScheme()))) {
            problems.add("chatty.cors.allowed-origin (CLIENT_URL) must be an absolute http(s) origin, was '" + origin + "'");
        }
        for (String method : properties.getCors().getAllowedMethods()) {
            if (!KNOWN_METHODS.contains(method)) {
                problems.add("chatty.cors.allowed-methods contains unknown method '" + method + "'");
            }
        }

        URI backboneUri = parse(properties.getBackbone().getUrl());
        if (backboneUri == null || backboneUri.getHost() == null
                || !("redis".equals(backboneUri.getScheme()) || "rediss".equals(backboneUri.getScheme()))) {
            problems.add("chatty.backbone.url (REDIS_HOST) must be a redis:// or rediss:// URL");
        }
        String prefix = properties.getBackbone().getChannelPrefix();
        if (prefix == null || prefix.chars().anyMatch(c -> c == '*' || c == '?' || c == '[')) {
            problems.add("chatty.backbone.channel-prefix must not contain pattern characters");
        }

        String path = properties.getChannel().getPath();
        if (path == null || !path.startsWith("/")) {
            problems.add("chatty.channel.path must start with '/'");
        }

        requirePositive(problems, "chatty.session-cookie.max-age", properties.getSessionCookie().getMaxAge());
        requirePositive(problems, "chatty.channel.heartbeat-interval", properties.getChannel().getHeartbeatInterval());
        GatewayProperties.Fanout fanout = properties.getFanout();
        requirePositive(problems, "chatty.fanout.publish-timeout", fanout.getPublishTimeout());
        requirePositive(problems, "chatty.fanout.startup-timeout", fanout.getStartupTimeout());
        requirePositive(problems, "chatty.fanout.probe-interval", fanout.getProbeInterval());
        requirePositive(problems, "chatty.fanout.reconnect-min-backoff", fanout.getReconnectMinBackoff());
        requirePositive(problems, "chatty.fanout.reconnect-max-backoff", fanout.getReconnectMaxBackoff());
        if (fanout.getReconnectMinBackoff() != null && fanout.getReconnectMaxBackoff() != null
                && fanout.getReconnectMinBackoff().compareTo(fanout.getReconnectMaxBackoff()) > 0) {
            problems.add("chatty.fanout.reconnect-min-backoff must not exceed chatty.fanout.reconnect-max-backoff");
        }
        return problems;
    }

    private static void requirePositive(List<String> problems, String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            problems.add(name + " must be a positive duration");
        }
    }

    private static URI parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            return null;
        }
    }

    private static String redact(String url) {
        URI uri = parse(url);
        return uri == null ? "?" : uri.getScheme() + "://" + uri.getHost() + ":" + uri.getPort();
    }
}
