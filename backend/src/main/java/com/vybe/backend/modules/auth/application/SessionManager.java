package com.vybe.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.vybe.backend.modules.auth.application.TokenCodec.InvalidTokenException;
import com.vybe.backend.modules.auth.application.TokenCodec.TokenClaims;
import com.vybe.backend.modules.auth.domain.Account;
import com.vybe.backend.modules.auth.domain.AuthException;
import com.vybe.backend.modules.auth.domain.TokenKind;
import com.vybe.backend.modules.auth.domain.UserSession;
import com.vybe.backend.modules.auth.infrastructure.persistence.AccountRepository;
import com.vybe.backend.modules.auth.infrastructure.persistence.UserSessionRepository;
import com.vybe.backend.modules.auth.presentation.dto.TokenPairResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Session lifecycle: creation with a per-account cap, refresh-token rotation with reuse detection,
 * revocation and validity checks.
 * <p>
 * A session is <em>active</em> while its row exists, is unexpired and holds the digest of the refresh
 * token issued last. Rotation replaces the digest with a compare-and-swap, so an older refresh token
 * can never match again; presenting one is treated as theft and revokes every session of the account.
 * Durable rows are the source of truth. The cache is written after each durable change and only ever
 * used to answer "valid" faster. Evictions run twice, right after the delete and again once the
 * transaction commits, because a concurrent {@link #isValid} can re-cache a row that is deleted but
 * not yet committed.
 */
@Service
@Transactional(noRollbackFor = AuthException.class)
public class SessionManager {

    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);
    private static final int DEVICE_TYPE_MAX_LENGTH = 50;
    private static final int SWEEP_BATCH_SIZE = 500;

    private final UserSessionRepository userSessionRepository;
    private final AccountRepository accountRepository;
    private final TokenCodec tokenCodec;
    private final SessionCache sessionCache;
    private final Clock clock;
    private final int maxActiveSessions;

    public SessionManager(
            UserSessionRepository userSessionRepository,
            AccountRepository accountRepository,
            TokenCodec tokenCodec,
            SessionCache sessionCache,
            Clock clock,
            @Value("${app.auth.session.max-active:5}") int maxActiveSessions
    ) {
        if (maxActiveSessions < 1) {
            throw new IllegalArgumentException("app.auth.session.max-active must be at least 1");
        }
        this.userSessionRepository = userSessionRepository;
        this.accountRepository = accountRepository;
        this.tokenCodec = tokenCodec;
        this.sessionCache = sessionCache;
        this.clock = clock;
        this.maxActiveSessions = maxActiveSessions;
    }

    public TokenPairResponse createSession(UUID accountId, String deviceType, String ipAddress) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime expiresAt = now.plus(tokenCodec.getRefreshTokenTtl());
        Account account = accountRepository.getReferenceById(accountId);

        // The row id must exist before the tokens can embed it
        UserSession session = new UserSession();
        session.setAccount(account);
        session.setRefreshTokenHash(UserSession.PLACEHOLDER_HASH);
        session.setDeviceType(normalizeDeviceType(deviceType));
        session.setIpAddress(ipAddress);
        session.setExpiresAt(expiresAt);
        session = userSessionRepository.saveAndFlush(session);

        UUID sessionId = session.getId();
        String accessToken = tokenCodec.issueAccess(accountId, sessionId);
        String refreshToken = tokenCodec.issueRefresh(accountId, sessionId);
        session.setRefreshTokenHash(tokenCodec.hash(refreshToken));
        userSessionRepository.saveAndFlush(session);

        sessionCache.put(sessionId, accountId, Duration.between(now, expiresAt));
        accountRepository.touchLastActive(accountId, now);
        evictBeyondCap(accountId);

        log.info("[AUTH][SESSION] created sessionId={} accountId={} deviceType={}",
                sessionId, accountId, session.getDeviceType());
        return tokenPair(accessToken, refreshToken);
    }

    public TokenPairResponse rotate(String presentedRefreshToken, String ipAddress) {
        TokenClaims claims;
        try {
            claims = tokenCodec.verify(presentedRefreshToken, TokenKind.REFRESH);
        } catch (InvalidTokenException ex) {
            throw AuthException.invalidRefreshToken("Invalid or expired refresh token", ex);
        }

        String presentedHash = tokenCodec.hash(presentedRefreshToken);
        Optional<UserSession> found = userSessionRepository.findById(claims.sessionId());
        if (found.isEmpty()
                || !presentedHash.equals(found.get().getRefreshTokenHash())
                || !claims.userId().equals(found.get().getAccountId())) {
            throw reuseDetected(claims);
        }

        UserSession session = found.get();
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (session.isExpiredAt(now)) {
            userSessionRepository.deleteSessionById(session.getId());
            evictAroundCommit(List.of(session.getId()));
            throw AuthException.invalidRefreshToken("Session expired");
        }

        String accessToken = tokenCodec.issueAccess(claims.userId(), claims.sessionId());
        String refreshToken = tokenCodec.issueRefresh(claims.userId(), claims.sessionId());
        OffsetDateTime expiresAt = now.plus(tokenCodec.getRefreshTokenTtl());

        int updated = userSessionRepository.rotateRefreshHash(
                claims.sessionId(), presentedHash, tokenCodec.hash(refreshToken), expiresAt, ipAddress, now);
        if (updated == 0) {
            // A concurrent rotation consumed the same token first
            throw reuseDetected(claims);
        }

        sessionCache.put(claims.sessionId(), claims.userId(), Duration.between(now, expiresAt));
        log.debug("[AUTH][SESSION] rotated sessionId={} accountId={}", claims.sessionId(), claims.userId());
        return tokenPair(accessToken, refreshToken);
    }

    /**
     * Idempotent: revoking an unknown or already revoked session is not an error.
     */
    public void revoke(UUID sessionId) {
        int deleted = userSessionRepository.deleteSessionById(sessionId);
        evictAroundCommit(List.of(sessionId));
        if (deleted > 0) {
            log.info("[AUTH][SESSION] revoked sessionId={}", sessionId);
        }
    }

    /**
     * Deletes exactly the sessions it read, so every deleted row is also evicted. A session created
     * concurrently after the read survives in both stores.
     */
    public int revokeAll(UUID accountId) {
        List<UUID> sessionIds = userSessionRepository.findIdsByAccountId(accountId);
        if (sessionIds.isEmpty()) {
            return 0;
        }
        int deleted = userSessionRepository.deleteSessionsByIds(sessionIds);
        evictAroundCommit(sessionIds);
        return deleted;
    }

    /**
     * A cache hit is sufficient. A miss is confirmed against the durable row and, when the row is live,
     * the cache entry is restored with the remaining lifetime.
     */
    @Transactional(readOnly = true)
    public boolean isValid(UUID sessionId) {
        if (sessionCache.lookup(sessionId) == SessionCache.Lookup.HIT) {
            return true;
        }
        Optional<UserSession> session = userSessionRepository.findById(sessionId);
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (session.isEmpty() || session.get().isExpiredAt(now)) {
            return false;
        }
        sessionCache.put(sessionId, session.get().getAccountId(), Duration.between(now, session.get().getExpiresAt()));
        return true;
    }

    public int sweepExpired() {
        List<UUID> expired = userSessionRepository.findExpiredIds(OffsetDateTime.now(clock));
        int deleted = 0;
        for (int from = 0; from < expired.size(); from += SWEEP_BATCH_SIZE) {
            List<UUID> batch = expired.subList(from, Math.min(from + SWEEP_BATCH_SIZE, expired.size()));
            deleted += userSessionRepository.deleteSessionsByIds(batch);
            evictAroundCommit(List.copyOf(batch));
        }
        return deleted;
    }

    private AuthException reuseDetected(TokenClaims claims) {
        int revoked = revokeAll(claims.userId());
        log.warn("[AUTH][REUSE] refresh token reuse detected accountId={} sessionId={} revokedSessions={}",
                claims.userId(), claims.sessionId(), revoked);
        return AuthException.sessionCompromised();
    }

    /**
     * Keeps the newest sessions by creation time and deletes the rest from both stores.
     */
    private void evictBeyondCap(UUID accountId) {
        List<UserSession> sessions = userSessionRepository.findByAccountIdNewestFirst(accountId);
        if (sessions.size() <= maxActiveSessions) {
            return;
        }
        List<UUID> excess = sessions.subList(maxActiveSessions, sessions.size()).stream()
                .map(UserSession::getId)
                .toList();
        userSessionRepository.deleteSessionsByIds(excess);
        evictAroundCommit(excess);
        log.info("[AUTH][SESSION] evicted {} oldest sessions accountId={} cap={}",
                excess.size(), accountId, maxActiveSessions);
    }

    private void evictAroundCommit(Collection<UUID> sessionIds) {
        sessionCache.evictAll(sessionIds);
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                sessionCache.evictAll(sessionIds);
            }
        });
    }

    private TokenPairResponse tokenPair(String accessToken, String refreshToken) {
        return new TokenPairResponse(
                accessToken,
                TokenPairResponse.DEFAULT_TOKEN_TYPE,
                tokenCodec.getAccessTokenTtl().toSeconds(),
                refreshToken,
                tokenCodec.getRefreshTokenTtl().toSeconds()
        );
    }

    private static String normalizeDeviceType(String rawDeviceType) {
        if (rawDeviceType == null) {
            return null;
        }
        String trimmed = rawDeviceType.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        return trimmed.length() > DEVICE_TYPE_MAX_LENGTH ? trimmed.substring(0, DEVICE_TYPE_MAX_LENGTH) : trimmed;
    }
}
