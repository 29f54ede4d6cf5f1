package com.vybe.backend.modules.auth.application;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vybe.backend.modules.auth.domain.AuthException;

import org.springframework.stereotype.Component;

/**
 * Reads the claims of a Google or Apple identity token and checks issuer, audience and expiry.
 * The signature is not checked against the provider's published keys yet.
 */
@Component
public class IdentityTokenDecoder {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public IdentityTokenDecoder(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * @param providerName  used in error messages only
     * @param issuers       accepted {@code iss} values
     * @param audience      required {@code aud} entry; skipped when blank
     */
    public JsonNode decode(String token, String providerName, Set<String> issuers, String audience) {
        String[] parts = token == null ? new String[0] : token.split("\\.", -1);
        if (parts.length != 3 || parts[1].isEmpty()) {
            throw AuthException.invalidCredential("Invalid " + providerName + " identity token");
        }

        JsonNode payload;
        try {
            byte[] json = Base64.getUrlDecoder().decode(parts[1]);
            payload = objectMapper.readTree(json);
        } catch (IllegalArgumentException | IOException ex) {
            throw AuthException.invalidCredential("Invalid " + providerName + " identity token", ex);
        }

        if (payload == null || !payload.isObject() || !hasText(payload, "sub")) {
            throw AuthException.invalidCredential("Invalid " + providerName + " identity token");
        }
        if (!issuers.contains(payload.path("iss").asText(""))) {
            throw AuthException.invalidCredential(providerName + " identity token has an unexpected issuer");
        }
        if (audience != null && !audience.isBlank() && !audienceMatches(payload.path("aud"), audience)) {
            throw AuthException.invalidCredential(providerName + " identity token was issued for another client");
        }
        JsonNode exp = payload.path("exp");
        if (!exp.isNumber()) {
            throw AuthException.invalidCredential(providerName + " identity token has no expiry");
        }
        if (!Instant.ofEpochSecond(exp.asLong()).isAfter(clock.instant())) {
            throw AuthException.invalidCredential(providerName + " identity token has expired");
        }
        return payload;
    }

    static String textOrNull(JsonNode payload, String field) {
        return hasText(payload, field) ? payload.get(field).asText().trim() : null;
    }

    /**
     * The {@code email} claim, only when the provider vouches for it. Google sends {@code email_verified}
     * as a boolean, Apple as the string {@code "true"}.
     */
    static String verifiedEmailOrNull(JsonNode payload) {
        JsonNode verified = payload.path("email_verified");
        boolean vouched = verified.isBoolean() ? verified.booleanValue() : "true".equals(verified.asText(""));
        return vouched ? textOrNull(payload, "email") : null;
    }

    private static boolean hasText(JsonNode payload, String field) {
        JsonNode node = payload.get(field);
        return node != null && node.isTextual() && !node.asText().isBlank();
    }

    private static boolean audienceMatches(JsonNode aud, String audience) {
        if (aud.isTextual()) {
            return audience.equals(aud.asText());
        }
        if (aud.isArray()) {
            for (JsonNode entry : aud) {
                if (audience.equals(entry.asText())) {
                    return true;
                }
            }
        }
        return false;
    }
}
