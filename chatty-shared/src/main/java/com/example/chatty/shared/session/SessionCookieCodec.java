package com.example.chatty.shared.session;

import com.example.chatty.shared.config.GatewayProperties;
import com.example.chatty.shared.exception.GatewayException;
import com.example.chatty.shared.util.Constants;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseCookie;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Issues and verifies the session cookie pair ({@code session} and {@code session.sig}).
 * <p>
 * New cookies are always signed with the first key. Verification accepts a signature
 * made with any configured key, so a rotated-out key keeps validating the cookies it
 * signed until they expire.
 */
@Slf4j
public class SessionCookieCodec {

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    @Getter
    private final String cookieName;
    @Getter
    private final String signatureCookieName;
    @Getter
    private final boolean secure;
    private final List<SecretKeySpec> keys;
    private final Duration maxAge;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public SessionCookieCodec(String cookieName, List<String> keys, Duration maxAge, boolean secure,
                              ObjectMapper objectMapper, Clock clock) {
        if (keys.isEmpty()) {
            throw new IllegalArgumentException("At least one signing key is required");
        }
        this.cookieName = cookieName;
        this.signatureCookieName = cookieName + Constants.SIGNATURE_COOKIE_SUFFIX;
        this.keys = keys.stream()
                .map(key -> new SecretKeySpec(key.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM))
                .collect(Collectors.toUnmodifiableList());
        this.maxAge = maxAge;
        this.secure = secure;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public static SessionCookieCodec from(GatewayProperties properties, ObjectMapper objectMapper, Clock clock) {
        GatewayProperties.SessionCookie cookie = properties.getSessionCookie();
        return new SessionCookieCodec(
                cookie.getName(),
                List.of(cookie.getPrimaryKey(), cookie.getSecondaryKey()),
                cookie.getMaxAge(),
                !properties.isDevelopmentMode(),
                objectMapper,
                clock);
    }

    public Session issue(String subject, Map<String, String> attributes) {
        Instant now = clock.instant();
        return Session.builder()
                .id(UUID.randomUUID().toString())
                .subject(subject)
                .issuedAt(now)
                .expiresAt(now.plus(maxAge))
                .attributes(Map.copyOf(attributes))
                .build();
    }

    public List<ResponseCookie> encode(Session session) {
        String value;
        try {
            value = ENCODER.encodeToString(objectMapper.writeValueAsBytes(session));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Session " + session.getId() + " could not be serialized", e);
        }
        String signature = sign(keys.get(0), signedContent(value));
        return List.of(cookie(cookieName, value, maxAge), cookie(signatureCookieName, signature, maxAge));
    }

    /**
     * Verifies and decodes a session cookie.
     *
     * @throws GatewayException with kind {@code AUTHENTICATION_FAILURE} when the signature is
     *                          missing or wrong, the payload is unreadable, or the session expired
     */
    public Session decode(String value, String signature) {
        if (signature == null || signature.isEmpty()) {
            throw GatewayException.authentication("Session signature is missing");
        }
        if (!verify(signedContent(value), signature)) {
            throw GatewayException.authentication("Session signature is invalid");
        }

        Session session;
        try {
            session = objectMapper.readValue(DECODER.decode(value), Session.class);
        } catch (IOException | IllegalArgumentException e) {
            log.debug("Signed session cookie could not be decoded: {}", e.getMessage());
            throw GatewayException.authentication("Session cookie is malformed");
        }

        Instant now = clock.instant();
        if (session.isExpired(now) || session.getIssuedAt() == null || !now.isBefore(session.getIssuedAt().plus(maxAge))) {
            throw GatewayException.authentication("Session has expired");
        }
        return session;
    }

    public List<ResponseCookie> expire() {
        return List.of(cookie(cookieName, "", Duration.ZERO), cookie(signatureCookieName, "", Duration.ZERO));
    }

    private String signedContent(String value) {
        return cookieName + "=" + value;
    }

    private boolean verify(String content, String signature) {
        byte[] presented = signature.getBytes(StandardCharsets.US_ASCII);
        boolean matched = false;
        // no early exit: every key is compared
        for (SecretKeySpec key : keys) {
            matched |= MessageDigest.isEqual(sign(key, content).getBytes(StandardCharsets.US_ASCII), presented);
        }
        return matched;
    }

    private String sign(SecretKeySpec key, String content) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(key);
            return ENCODER.encodeToString(mac.doFinal(content.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(HMAC_ALGORITHM + " is not available", e);
        }
    }

    private ResponseCookie cookie(String name, String value, Duration age) {
        return ResponseCookie.from(name, value)
                .httpOnly(true)
                .secure(secure)
                .path("/")
                .sameSite("Lax")
                .maxAge(age)
                .build();
    }
}
