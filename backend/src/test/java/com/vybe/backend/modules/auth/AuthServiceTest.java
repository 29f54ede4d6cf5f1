package com.vybe.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import com.vybe.backend.modules.auth.application.AuthService;
import com.vybe.backend.modules.auth.application.SessionManager;
import com.vybe.backend.modules.auth.application.TokenCodec;
import com.vybe.backend.modules.auth.domain.AuthErrorKind;
import com.vybe.backend.modules.auth.domain.AuthException;
import com.vybe.backend.modules.auth.domain.TokenKind;
import com.vybe.backend.modules.auth.domain.UserSession;
import com.vybe.backend.modules.auth.domain.VerificationBadge;
import com.vybe.backend.modules.auth.infrastructure.persistence.AccountRepository;
import com.vybe.backend.modules.auth.infrastructure.persistence.UserSessionRepository;
import com.vybe.backend.modules.auth.presentation.dto.AuthResponse;
import com.vybe.backend.modules.auth.presentation.dto.TokenPairResponse;
import com.vybe.backend.support.AbstractIntegrationTest;
import com.vybe.backend.support.IdentityTokens;

import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;

@SpringBootTest
class AuthServiceTest extends AbstractIntegrationTest {

    private static final String PHONE = "+14155551234";
    private static final String IP = "198.51.100.10";

    @Autowired
    private AuthService authService;

    @Autowired
    private SessionManager sessionManager;

    @Autowired
    private TokenCodec tokenCodec;

    @Autowired
    private AccountRepository accountRepository;

    @Autowired
    private UserSessionRepository userSessionRepository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Test
    @DisplayName("phone sign-up creates an account once and later logins reuse it")
    void phoneCodeCreatesThenReusesAccount() {
        assertThat(authService.sendVerificationCode(PHONE, IP).success()).isTrue();
        AuthResponse first = authService.verifyPhoneCode(PHONE, pendingCode(PHONE), "ios", IP);

        assertThat(first.user().newUser()).isTrue();
        assertThat(first.user().phone()).isEqualTo(PHONE);
        assertThat(first.user().badges()).containsExactly(VerificationBadge.PHONE);

        authService.sendVerificationCode(PHONE, IP);
        AuthResponse second = authService.verifyPhoneCode(PHONE, pendingCode(PHONE), "ios", IP);

        assertThat(second.user().newUser()).isFalse();
        assertThat(second.user().id()).isEqualTo(first.user().id());
        assertThat(accountRepository.count()).isEqualTo(1);
    }

    @Test
    void verificationCodeIsSingleUse() {
        authService.sendVerificationCode(PHONE, IP);
        String code = pendingCode(PHONE);
        authService.verifyPhoneCode(PHONE, code, null, IP);

        assertKind(() -> authService.verifyPhoneCode(PHONE, code, null, IP), AuthErrorKind.INVALID_CREDENTIAL);
    }

    @Test
    @DisplayName("a token rotated twice yields three distinct tokens and the first then compromises the account")
    void reusingFirstRefreshTokenAfterTwoRotationsRevokesEverything() {
        AuthResponse login = authService.authenticateWithGoogle(IdentityTokens.google("g-1", "ana@example.com"), "web", IP);
        AuthResponse otherDevice = authService.authenticateWithGoogle(IdentityTokens.google("g-1", "ana@example.com"), "ios", IP);
        String r1 = login.tokens().refreshToken();

        TokenPairResponse second = authService.refresh(r1, IP);
        TokenPairResponse third = authService.refresh(second.refreshToken(), IP);
        assertThat(List.of(r1, second.refreshToken(), third.refreshToken())).doesNotHaveDuplicates();

        assertKind(() -> authService.refresh(r1, IP), AuthErrorKind.SESSION_COMPROMISED);

        UUID rotatedSession = sessionIdOf(third.accessToken());
        UUID otherSession = sessionIdOf(otherDevice.tokens().accessToken());
        assertThat(sessionManager.isValid(rotatedSession)).isFalse();
        assertThat(sessionManager.isValid(otherSession)).isFalse();
        assertKind(() -> authService.refresh(third.refreshToken(), IP), AuthErrorKind.SESSION_COMPROMISED);
        assertKind(() -> authService.authenticate(third.accessToken()), AuthErrorKind.UNAUTHORIZED);
    }

    @Test
    void refreshWithGarbageIsInvalidRefreshToken() {
        assertKind(() -> authService.refresh("not-a-token", IP), AuthErrorKind.INVALID_REFRESH_TOKEN);
    }

    @Test
    @DisplayName("never more than five sessions per account; the five newest survive")
    void sessionCapKeepsFiveNewest() {
        UUID accountId = authService.authenticateWithGoogle(IdentityTokens.google("g-cap", "cap@example.com"), "web", IP)
                .user().id();
        List<UUID> sessionIds = new ArrayList<>();
        sessionIds.add(userSessionRepository.findIdsByAccountId(accountId).get(0));
        for (int i = 0; i < 5; i++) {
            TokenPairResponse tokens = sessionManager.createSession(accountId, "device-" + i, IP);
            sessionIds.add(sessionIdOf(tokens.accessToken()));
        }

        List<UUID> remaining = userSessionRepository.findByAccountIdNewestFirst(accountId).stream()
                .map(UserSession::getId)
                .toList();
        assertThat(remaining).hasSize(5);
        assertThat(remaining).containsExactlyInAnyOrderElementsOf(sessionIds.subList(1, 6));
        assertThat(sessionManager.isValid(sessionIds.get(0))).isFalse();
        assertThat(sessionManager.isValid(sessionIds.get(5))).isTrue();
    }

    @Test
    @DisplayName("isValid follows the durable row whether or not the cache is warm")
    void isValidTracksRevocationRegardlessOfCache() {
        AuthResponse login = authService.authenticateWithGoogle(IdentityTokens.google("g-2", "bo@example.com"), "web", IP);
        UUID sessionId = sessionIdOf(login.tokens().accessToken());
        assertThat(sessionManager.isValid(sessionId)).isTrue();

        redisTemplate.delete("session:" + sessionId);
        assertThat(sessionManager.isValid(sessionId)).isTrue();
        assertThat(redisTemplate.hasKey("session:" + sessionId)).isTrue();

        authService.logout(sessionId);
        assertThat(sessionManager.isValid(sessionId)).isFalse();
        authService.logout(sessionId);
    }

    @Test
    @DisplayName("Google then Apple with the same email resolve to one account")
    void googleThenAppleWithSameEmailLinks() {
        AuthResponse google = authService.authenticateWithGoogle(IdentityTokens.google("g-3", "cy@example.com"), null, IP);
        AuthResponse apple = authService.authenticateWithApple(IdentityTokens.apple("a-3", "cy@example.com"),
                "Cy", "Ng", null, IP);

        assertThat(google.user().newUser()).isTrue();
        assertThat(apple.user().newUser()).isFalse();
        assertThat(apple.user().id()).isEqualTo(google.user().id());
        assertThat(apple.user().badges()).containsExactly(VerificationBadge.GOOGLE, VerificationBadge.APPLE);
        assertThat(accountRepository.count()).isEqualTo(1);
    }

    @Test
    void secondGoogleSubjectForLinkedEmailConflicts() {
        authService.authenticateWithGoogle(IdentityTokens.google("g-4", "di@example.com"), null, IP);

        assertKind(() -> authService.authenticateWithGoogle(IdentityTokens.google("g-5", "di@example.com"), null, IP),
                AuthErrorKind.ACCOUNT_CONFLICT);
    }

    @Test
    @DisplayName("a client IP may request three codes per five minutes")
    void smsGuardLimitsCodeRequestsPerIp() {
        authService.sendVerificationCode("+14155550001", IP);
        authService.sendVerificationCode("+14155550002", IP);
        authService.sendVerificationCode("+14155550003", IP);

        assertKind(() -> authService.sendVerificationCode("+14155550004", IP), AuthErrorKind.RATE_LIMITED);
        assertThat(authService.sendVerificationCode("+14155550004", "198.51.100.11").success()).isTrue();
    }

    @Test
    void sweepRemovesExpiredSessions() {
        AuthResponse login = authService.authenticateWithGoogle(IdentityTokens.google("g-6", "ed@example.com"), null, IP);
        UUID sessionId = sessionIdOf(login.tokens().accessToken());
        jdbcTemplate.update("UPDATE user_session SET expires_at = now() - interval '1 minute' WHERE id = ?", sessionId);

        assertThat(sessionManager.sweepExpired()).isEqualTo(1);
        assertThat(userSessionRepository.findById(sessionId)).isEmpty();
        assertThat(sessionManager.isValid(sessionId)).isFalse();
    }

    @Test
    void loadAccountReturnsProfile() {
        AuthResponse login = authService.authenticateWithGoogle(IdentityTokens.google("g-7", "fu@example.com"), null, IP);

        assertThat(authService.loadAccount(login.user().id()).email()).isEqualTo("fu@example.com");
        assertKind(() -> authService.loadAccount(UUID.randomUUID()), AuthErrorKind.UNAUTHORIZED);
    }

    private String pendingCode(String phone) {
        return redisTemplate.opsForValue().get("verification:" + phone);
    }

    private UUID sessionIdOf(String accessToken) {
        return tokenCodec.verify(accessToken, TokenKind.ACCESS).sessionId();
    }

    private static void assertKind(ThrowingCallable call, AuthErrorKind kind) {
        assertThatThrownBy(call)
                .isInstanceOfSatisfying(AuthException.class, ex -> assertThat(ex.getKind()).isEqualTo(kind));
    }
}
