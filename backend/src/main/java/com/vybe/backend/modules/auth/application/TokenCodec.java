package com.vybe.backend.modules.auth.application;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.HexFormat;
import java.util.UUID;

import javax.crypto.SecretKey;

import com.vybe.backend.modules.auth.domain.TokenKind;
import com.vybe.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Signs and verifies the stateless access/refresh tokens. Performs no I/O.
 */
@Service
public class TokenCodec {

    static final String SESSION_CLAIM = "sid";
    static final String TYPE_CLAIM = "typ";

    private final JwtTokenProvider tokenProvider;
    private final Duration accessTokenTtl;
    private final Duration refreshTokenTtl;
    private final Clock clock;

    public TokenCodec(
            JwtTokenProvider tokenProvider,
            @Value("${jwt.access-expiration:15m}") Duration accessTokenTtl,
            @Value("${jwt.refresh-expiration:30d}") Duration refreshTokenTtl,
            Clock clock
    ) {
        if (accessTokenTtl.compareTo(refreshTokenTtl) >= 0) {
            throw new IllegalArgumentException("Access token lifetime must be shorter than refresh token lifetime");
        }
        this.tokenProvider = tokenProvider;
        this.accessTokenTtl = accessTokenTtl;
        this.refreshTokenTtl = refreshTokenTtl;
        this.clock = clock;
    }

    public String issueAccess(UUID userId, UUID sessionId) {
        return issue(TokenKind.ACCESS, userId, sessionId);
    }

    public String issueRefresh(UUID userId, UUID sessionId) {
        return issue(TokenKind.REFRESH, userId, sessionId);
    }

    public TokenClaims verify(String token, TokenKind kind) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException("Token is missing", null);
        }
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(keyFor(kind))
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            if (!kind.claimValue().equals(claims.get(TYPE_CLAIM, String.class))) {
                throw new InvalidTokenException("Unexpected token type", null);
            }
            if (claims.getExpiration() == null) {
                throw new InvalidTokenException("Token has no expiry", null);
            }

            String subject = claims.getSubject();
            String sessionClaim = claims.get(SESSION_CLAIM, String.class);
            if (subject == null || sessionClaim == null) {
                throw new InvalidTokenException("Token is missing subject or session", null);
            }
            UUID userId = UUID.fromString(subject);
            UUID sessionId = UUID.fromString(sessionClaim);
            Instant issuedAt = claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : clock.instant();
            return new TokenClaims(userId, sessionId, issuedAt, claims.getExpiration().toInstant());
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid " + kind.claimValue() + " token", e);
        }
    }

    /**
     * SHA-256 hex digest of a refresh token; the only form in which it is persisted.
     */
    public String hash(String token) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(token.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    public Duration getAccessTokenTtl() {
        return accessTokenTtl;
    }

    public Duration getRefreshTokenTtl() {
        return refreshTokenTtl;
    }

    private String issue(TokenKind kind, UUID userId, UUID sessionId) {
        Instant now = clock.instant();
        Instant expiry = now.plus(kind == TokenKind.ACCESS ? accessTokenTtl : refreshTokenTtl);

        return Jwts.builder()
                .id(UUID.randomUUID().toString())
                .subject(userId.toString())
                .claim(SESSION_CLAIM, sessionId.toString())
                .claim(TYPE_CLAIM, kind.claimValue())
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiry))
                .signWith(keyFor(kind), SIG.HS256)
                .compact();
    }

    private SecretKey keyFor(TokenKind kind) {
        return kind == TokenKind.ACCESS ? tokenProvider.getAccessKey() : tokenProvider.getRefreshKey();
    }

    public record TokenClaims(UUID userId, UUID sessionId, Instant issuedAt, Instant expiresAt) {
    }

    public static class InvalidTokenException extends RuntimeException {
        public InvalidTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
