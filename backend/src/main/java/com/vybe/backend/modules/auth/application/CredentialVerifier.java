package com.vybe.backend.modules.auth.application;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.StringJoiner;

import com.fasterxml.jackson.databind.JsonNode;
import com.vybe.backend.modules.auth.domain.AuthException;
import com.vybe.backend.modules.auth.domain.CredentialKind;
import com.vybe.backend.modules.auth.domain.ExternalIdentity;
import com.vybe.backend.modules.auth.infrastructure.redis.FastStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Checks a presented credential and extracts the external identity behind it.
 * Holds no state itself: phone challenges live in the fast store.
 */
@Component
public class CredentialVerifier {

    private static final Logger log = LoggerFactory.getLogger(CredentialVerifier.class);

    static final String CODE_KEY_PREFIX = "verification:";
    static final String SEND_ATTEMPTS_KEY_PREFIX = "verification:attempts:";
    static final String FAILURES_KEY_PREFIX = "verification:failures:";

    static final Set<String> GOOGLE_ISSUERS = Set.of("https://accounts.google.com", "accounts.google.com");
    static final Set<String> APPLE_ISSUERS = Set.of("https://appleid.apple.com");

    private static final int CODE_BOUND = 1_000_000;

    private final FastStore fastStore;
    private final RateGuard rateGuard;
    private final IdentityTokenDecoder identityTokenDecoder;
    private final SecureRandom secureRandom;
    private final Duration codeTtl;
    private final int maxSendsPerWindow;
    private final Duration sendWindow;
    private final int maxFailedChecks;
    private final boolean logCodes;
    private final String googleClientId;
    private final String appleClientId;

    public CredentialVerifier(
            FastStore fastStore,
            RateGuard rateGuard,
            IdentityTokenDecoder identityTokenDecoder,
            SecureRandom secureRandom,
            @Value("${app.auth.phone.code-ttl:PT5M}") Duration codeTtl,
            @Value("${app.auth.phone.max-sends:5}") int maxSendsPerWindow,
            @Value("${app.auth.phone.send-window:PT1H}") Duration sendWindow,
            @Value("${app.auth.phone.max-failed-checks:5}") int maxFailedChecks,
            @Value("${app.auth.phone.log-codes:false}") boolean logCodes,
            @Value("${app.auth.google.client-id:}") String googleClientId,
            @Value("${app.auth.apple.client-id:}") String appleClientId
    ) {
        this.fastStore = fastStore;
        this.rateGuard = rateGuard;
        this.identityTokenDecoder = identityTokenDecoder;
        this.secureRandom = secureRandom;
        this.codeTtl = codeTtl;
        this.maxSendsPerWindow = maxSendsPerWindow;
        this.sendWindow = sendWindow;
        this.maxFailedChecks = maxFailedChecks;
        this.logCodes = logCodes;
        this.googleClientId = googleClientId;
        this.appleClientId = appleClientId;
    }

    /**
     * Issues a fresh 6-digit code for the phone number, replacing any pending one.
     * Delivery over SMS is not wired in; the code is only logged when {@code app.auth.phone.log-codes} is on.
     */
    public void requestCode(String phone) {
        rateGuard.admit(SEND_ATTEMPTS_KEY_PREFIX + phone, maxSendsPerWindow, sendWindow);

        String code = String.format("%06d", secureRandom.nextInt(CODE_BOUND));
        fastStore.set(CODE_KEY_PREFIX + phone, code, codeTtl);
        fastStore.delete(FAILURES_KEY_PREFIX + phone);

        if (logCodes) {
            log.info("[AUTH][PHONE] verification code issued phone={} code={}", phone, code);
        } else {
            log.info("[AUTH][PHONE] verification code issued phone={}", phone);
        }
    }

    /**
     * Consumes the pending challenge for the phone number. A code verifies at most once.
     */
    public ExternalIdentity verifyCode(String phone, String code) {
        String codeKey = CODE_KEY_PREFIX + phone;
        Optional<String> stored = fastStore.get(codeKey);
        if (stored.isEmpty()) {
            throw AuthException.invalidCredential("Verification code expired or not found");
        }

        if (code == null || !constantTimeEquals(stored.get(), code)) {
            long failures = fastStore.incrementWithTtl(FAILURES_KEY_PREFIX + phone, codeTtl);
            if (failures >= maxFailedChecks) {
                fastStore.delete(codeKey);
                log.warn("[AUTH][PHONE] challenge discarded after {} wrong codes phone={}", failures, phone);
            }
            throw AuthException.invalidCredential("Invalid verification code");
        }

        // Only the caller that actually removes the key wins a concurrent double submit
        if (!fastStore.delete(codeKey)) {
            throw AuthException.invalidCredential("Verification code expired or not found");
        }
        fastStore.delete(FAILURES_KEY_PREFIX + phone);
        return ExternalIdentity.phone(phone);
    }

    public ExternalIdentity verifyGoogle(String idToken) {
        JsonNode payload = identityTokenDecoder.decode(idToken, "Google", GOOGLE_ISSUERS, googleClientId);
        return new ExternalIdentity(
                CredentialKind.GOOGLE,
                IdentityTokenDecoder.textOrNull(payload, "sub"),
                IdentityTokenDecoder.verifiedEmailOrNull(payload),
                IdentityTokenDecoder.textOrNull(payload, "name"),
                IdentityTokenDecoder.textOrNull(payload, "picture")
        );
    }

    /**
     * Apple only sends the user's name on the very first authorization, and outside the token,
     * so it arrives as separate hints.
     */
    public ExternalIdentity verifyApple(String identityToken, String givenName, String familyName) {
        JsonNode payload = identityTokenDecoder.decode(identityToken, "Apple", APPLE_ISSUERS, appleClientId);
        return new ExternalIdentity(
                CredentialKind.APPLE,
                IdentityTokenDecoder.textOrNull(payload, "sub"),
                IdentityTokenDecoder.verifiedEmailOrNull(payload),
                joinName(givenName, familyName),
                null
        );
    }

    private static String joinName(String givenName, String familyName) {
        StringJoiner joiner = new StringJoiner(" ");
        if (givenName != null && !givenName.isBlank()) {
            joiner.add(givenName.trim());
        }
        if (familyName != null && !familyName.isBlank()) {
            joiner.add(familyName.trim());
        }
        return joiner.length() == 0 ? null : joiner.toString();
    }

    private static boolean constantTimeEquals(String expected, String actual) {
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                actual.getBytes(StandardCharsets.UTF_8));
    }
}
