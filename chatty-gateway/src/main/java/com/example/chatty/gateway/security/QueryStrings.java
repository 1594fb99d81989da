package com.example.chatty.gateway.security;

import com.example.chatty.shared.dto.FieldViolation;
import com.example.chatty.shared.exception.GatewayException;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Raw query string handling for the parameter pollution policy. Keys are compared
 * decoded, values are kept in their original encoding.
 */
public final class QueryStrings {

    private QueryStrings() {}

    /**
     * Result of collapsing one raw query: the rewritten query and, per repeated key,
     * every decoded value that was seen.
     */
    public static final class Collapsed {
        private final String rawQuery;
        private final Map<String, List<String>> polluted;

        Collapsed(String rawQuery, Map<String, List<String>> polluted) {
            this.rawQuery = rawQuery;
            this.polluted = polluted;
        }

        public String getRawQuery() {
            return rawQuery;
        }

        public Map<String, List<String>> getPolluted() {
            return polluted;
        }

        public boolean isPolluted() {
            return !polluted.isEmpty();
        }
    }

    /**
     * Keeps only the last occurrence of each repeated key, at the position the key first
     * appeared. Keys in {@code whitelist} keep every occurrence.
     *
     * @throws GatewayException with kind {@code VALIDATION_FAILURE} on a malformed escape sequence
     */
    public static Collapsed collapse(String rawQuery, Set<String> whitelist) {
        if (rawQuery == null || rawQuery.isEmpty()) {
            return new Collapsed(rawQuery, Map.of());
        }

        Map<String, List<String>> pairsByKey = new LinkedHashMap<>();
        for (String part : rawQuery.split("&")) {
            if (part.isEmpty()) continue;
            int eq = part.indexOf('=');
            String key = decode(eq < 0 ? part : part.substring(0, eq));
            pairsByKey.computeIfAbsent(key, k -> new ArrayList<>()).add(part);
        }

        Map<String, List<String>> polluted = new LinkedHashMap<>();
        List<String> kept = new ArrayList<>();
        pairsByKey.forEach((key, pairs) -> {
            if (pairs.size() > 1 && !whitelist.contains(key)) {
                List<String> values = new ArrayList<>();
                for (String pair : pairs) {
                    int eq = pair.indexOf('=');
                    values.add(eq < 0 ? "" : decode(pair.substring(eq + 1)));
                }
                polluted.put(key, values);
                kept.add(pairs.get(pairs.size() - 1));
            } else {
                kept.addAll(pairs);
            }
        });

        if (polluted.isEmpty()) {
            return new Collapsed(rawQuery, Map.of());
        }
        return new Collapsed(String.join("&", kept), polluted);
    }

    private static String decode(String s) {
        try {
            return URLDecoder.decode(s, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw GatewayException.validation("Malformed query string",
                    new FieldViolation("query", "contains an invalid escape sequence"));
        }
    }
}
