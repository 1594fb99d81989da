package com.example.chatty.shared.session;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * Proof of a prior authentication, carried by the client in a signed cookie.
 * Never modified after issue; a new session replaces it.
 */
@Value
@Builder
@Jacksonized
public class Session {
    String id;
    String subject;
    Instant issuedAt;
    Instant expiresAt;
    @Builder.Default
    Map<String, String> attributes = Map.of();

    public boolean isExpired(Instant now) {
        return expiresAt == null || !now.isBefore(expiresAt);
    }
}
