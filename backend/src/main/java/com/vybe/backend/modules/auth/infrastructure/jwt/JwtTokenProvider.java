package com.vybe.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Holds the two HMAC keys. Access and refresh tokens are signed with different secrets so a
 * leaked access token can never pass refresh verification.
 */
@Component
public class JwtTokenProvider {

    private static final String HMAC_SHA_256 = "HmacSHA256";
    private static final int MIN_KEY_BYTES = 32;

    private final SecretKey accessKey;
    private final SecretKey refreshKey;

    public JwtTokenProvider(
            @Value("${jwt.access-secret}") String accessSecret,
            @Value("${jwt.refresh-secret}") String refreshSecret
    ) {
        byte[] accessBytes = decode(accessSecret);
        byte[] refreshBytes = decode(refreshSecret);
        if (Arrays.equals(accessBytes, refreshBytes)) {
            throw new IllegalStateException("jwt.access-secret and jwt.refresh-secret must differ");
        }
        this.accessKey = new SecretKeySpec(accessBytes, HMAC_SHA_256);
        this.refreshKey = new SecretKeySpec(refreshBytes, HMAC_SHA_256);
    }

    public SecretKey getAccessKey() {
        return accessKey;
    }

    public SecretKey getRefreshKey() {
        return refreshKey;
    }

    private static byte[] decode(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("JWT secret must not be blank");
        }
        byte[] key;
        try {
            key = Base64.getDecoder().decode(secret);
        } catch (IllegalArgumentException ex) {
            key = secret.getBytes(StandardCharsets.UTF_8);
        }
        // A plain-text secret can happen to be valid Base64 and decode to fewer bytes
        if (key.length < MIN_KEY_BYTES) {
            key = secret.getBytes(StandardCharsets.UTF_8);
        }
        if (key.length < MIN_KEY_BYTES) {
            throw new IllegalStateException("JWT secret must be at least " + MIN_KEY_BYTES + " bytes");
        }
        return key;
    }
}
