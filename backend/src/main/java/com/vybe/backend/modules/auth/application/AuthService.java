package com.vybe.backend.modules.auth.application;

import java.time.Duration;
import java.util.UUID;

import com.vybe.backend.global.security.JwtAuthenticationPrincipal;
import com.vybe.backend.modules.auth.application.IdentityResolver.ResolvedAccount;
import com.vybe.backend.modules.auth.application.TokenCodec.InvalidTokenException;
import com.vybe.backend.modules.auth.application.TokenCodec.TokenClaims;
import com.vybe.backend.modules.auth.domain.Account;
import com.vybe.backend.modules.auth.domain.AuthException;
import com.vybe.backend.modules.auth.domain.ExternalIdentity;
import com.vybe.backend.modules.auth.domain.TokenKind;
import com.vybe.backend.modules.auth.infrastructure.persistence.AccountRepository;
import com.vybe.backend.modules.auth.presentation.dto.AccountSummaryResponse;
import com.vybe.backend.modules.auth.presentation.dto.AuthResponse;
import com.vybe.backend.modules.auth.presentation.dto.SendCodeResponse;
import com.vybe.backend.modules.auth.presentation.dto.TokenPairResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Entry point for every authentication flow. Each credential submission is admitted per client IP,
 * verified, resolved to an account and turned into a new session.
 * <p>
 * Not transactional itself: identity resolution and session creation commit independently so that a
 * domain error in one never marks the other for rollback.
 */
@Service
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    static final String AUTH_GUARD_PREFIX = "auth:";
    static final String SMS_GUARD_PREFIX = "sms:";
    private static final String UNKNOWN_CLIENT = "unknown";

    private final CredentialVerifier credentialVerifier;
    private final IdentityResolver identityResolver;
    private final SessionManager sessionManager;
    private final TokenCodec tokenCodec;
    private final RateGuard rateGuard;
    private final AccountRepository accountRepository;
    private final int authMaxAttempts;
    private final Duration authWindow;
    private final int smsMaxAttempts;
    private final Duration smsWindow;

    public AuthService(
            CredentialVerifier credentialVerifier,
            IdentityResolver identityResolver,
            SessionManager sessionManager,
            TokenCodec tokenCodec,
            RateGuard rateGuard,
            AccountRepository accountRepository,
            @Value("${app.auth.rate-limit.auth.max-attempts:10}") int authMaxAttempts,
            @Value("${app.auth.rate-limit.auth.window:PT60S}") Duration authWindow,
            @Value("${app.auth.rate-limit.sms.max-attempts:3}") int smsMaxAttempts,
            @Value("${app.auth.rate-limit.sms.window:PT300S}") Duration smsWindow
    ) {
        this.credentialVerifier = credentialVerifier;
        this.identityResolver = identityResolver;
        this.sessionManager = sessionManager;
        this.tokenCodec = tokenCodec;
        this.rateGuard = rateGuard;
        this.accountRepository = accountRepository;
        this.authMaxAttempts = authMaxAttempts;
        this.authWindow = authWindow;
        this.smsMaxAttempts = smsMaxAttempts;
        this.smsWindow = smsWindow;
    }

    public SendCodeResponse sendVerificationCode(String phone, String clientIp) {
        rateGuard.admit(SMS_GUARD_PREFIX + clientKey(clientIp), smsMaxAttempts, smsWindow);
        credentialVerifier.requestCode(phone);
        return SendCodeResponse.sent();
    }

    public AuthResponse verifyPhoneCode(String phone, String code, String deviceType, String clientIp) {
        admitCredentialAttempt(clientIp);
        ExternalIdentity identity = credentialVerifier.verifyCode(phone, code);
        return signIn(identity, deviceType, clientIp);
    }

    public AuthResponse authenticateWithGoogle(String idToken, String deviceType, String clientIp) {
        admitCredentialAttempt(clientIp);
        ExternalIdentity identity = credentialVerifier.verifyGoogle(idToken);
        return signIn(identity, deviceType, clientIp);
    }

    public AuthResponse authenticateWithApple(
            String identityToken,
            String givenName,
            String familyName,
            String deviceType,
            String clientIp
    ) {
        admitCredentialAttempt(clientIp);
        ExternalIdentity identity = credentialVerifier.verifyApple(identityToken, givenName, familyName);
        return signIn(identity, deviceType, clientIp);
    }

    public TokenPairResponse refresh(String refreshToken, String clientIp) {
        admitCredentialAttempt(clientIp);
        return sessionManager.rotate(refreshToken, clientIp);
    }

    public void logout(UUID sessionId) {
        sessionManager.revoke(sessionId);
    }

    /**
     * Resolves a bearer access token to its principal. The signature and expiry alone are not enough:
     * the session behind the token must still be live.
     */
    public JwtAuthenticationPrincipal authenticate(String accessToken) {
        TokenClaims claims;
        try {
            claims = tokenCodec.verify(accessToken, TokenKind.ACCESS);
        } catch (InvalidTokenException ex) {
            throw AuthException.unauthorized("Invalid or expired access token", ex);
        }
        if (!sessionManager.isValid(claims.sessionId())) {
            throw AuthException.unauthorized("Session is no longer active");
        }
        return new JwtAuthenticationPrincipal(claims.userId(), claims.sessionId());
    }

    @Transactional(readOnly = true)
    public AccountSummaryResponse loadAccount(UUID userId) {
        Account account = accountRepository.findById(userId)
                .orElseThrow(() -> AuthException.unauthorized("Account not found"));
        return AccountSummaryResponse.from(account, false);
    }

    private AuthResponse signIn(ExternalIdentity identity, String deviceType, String clientIp) {
        ResolvedAccount resolved = identityResolver.resolve(identity);
        Account account = resolved.account();
        TokenPairResponse tokens = sessionManager.createSession(account.getId(), deviceType, clientIp);
        log.info("[AUTH][LOGIN] accountId={} via={} newAccount={}",
                account.getId(), identity.kind(), resolved.newAccount());
        return new AuthResponse(AccountSummaryResponse.from(account, resolved.newAccount()), tokens);
    }

    private void admitCredentialAttempt(String clientIp) {
        rateGuard.admit(AUTH_GUARD_PREFIX + clientKey(clientIp), authMaxAttempts, authWindow);
    }

    private static String clientKey(String clientIp) {
        return clientIp == null || clientIp.isBlank() ? UNKNOWN_CLIENT : clientIp;
    }
}
