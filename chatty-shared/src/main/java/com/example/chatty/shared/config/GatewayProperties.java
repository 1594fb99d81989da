package com.example.chatty.shared.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Process-wide gateway configuration. Bound once from {@code chatty.*} at startup,
 * validated eagerly and injected into every component that needs it.
 */
@Data
@Validated
public class GatewayProperties {

    /**
     * Identifier of this process inside the fleet. Stamped on every envelope
     * published to the backbone.
     */
    @NotBlank
    private String instanceId;

    /**
     * Environment mode, e.g. {@code development}, {@code staging}, {@code production}.
     */
    @NotBlank(message = "must not be blank (set NODE_ENV)")
    private String environment;

    @Valid
    private final Server server = new Server();
    @Valid
    private final Cors cors = new Cors();
    @Valid
    private final SessionCookie sessionCookie = new SessionCookie();
    @Valid
    private final Backbone backbone = new Backbone();
    @Valid
    private final Channel channel = new Channel();
    @Valid
    private final Fanout fanout = new Fanout();
    private final Hpp hpp = new Hpp();

    public boolean isDevelopmentMode() {
        return "development".equalsIgnoreCase(environment) || "local".equalsIgnoreCase(environment);
    }

    @Data
    public static class Server {
        @NotBlank
        private String threadPrefix = "chatty";
    }

    @Data
    public static class Cors {
        @NotBlank(message = "must not be blank (set CLIENT_URL)")
        private String allowedOrigin;
        @NotEmpty
        private List<String> allowedMethods = new ArrayList<>(List.of("GET", "POST", "DELETE", "OPTIONS"));
        private boolean allowCredentials = true;
        @Positive
        private int preflightStatus = 200;
        @NotNull
        private Duration maxAge = Duration.ofHours(1);
    }

    @Data
    public static class SessionCookie {
        @NotBlank
        private String name = "session";
        @NotBlank(message = "must not be blank (set SECRET_KEY_ONE)")
        private String primaryKey;
        @NotBlank(message = "must not be blank (set SECRET_KEY_TWO)")
        private String secondaryKey;
        @NotNull
        private Duration maxAge = Duration.ofDays(7);
    }

    @Data
    public static class Backbone {
        @NotBlank(message = "must not be blank (set REDIS_HOST)")
        private String url;
        @NotBlank
        private String channelPrefix = "chatty:events:";
    }

    @Data
    public static class Channel {
        @NotBlank
        private String path = "/ws";
        @Positive
        private int outboundBuffer = 256;
        @Positive
        private int maxFailedEmits = 3;
        @NotNull
        private Duration heartbeatInterval = Duration.ofSeconds(25);
    }

    @Data
    public static class Fanout {
        @NotNull
        private Duration publishTimeout = Duration.ofSeconds(2);
        @NotNull
        private Duration startupTimeout = Duration.ofSeconds(15);
        @NotNull
        private Duration probeInterval = Duration.ofSeconds(10);
        @NotNull
        private Duration reconnectMinBackoff = Duration.ofMillis(500);
        @NotNull
        private Duration reconnectMaxBackoff = Duration.ofSeconds(30);
        @Positive
        private int inboxCapacity = 10_000;
    }

    @Data
    public static class Hpp {
        /**
         * Query and form keys that may legitimately repeat.
         */
        private List<String> whitelist = new ArrayList<>();
    }
}
