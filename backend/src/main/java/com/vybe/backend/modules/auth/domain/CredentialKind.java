package com.vybe.backend.modules.auth.domain;

/**
 * Credential paths that can establish a session. Each maps to the badge granted on success.
 */
public enum CredentialKind {
    PHONE(VerificationBadge.PHONE),
    GOOGLE(VerificationBadge.GOOGLE),
    APPLE(VerificationBadge.APPLE);

    private final VerificationBadge badge;

    CredentialKind(VerificationBadge badge) {
        this.badge = badge;
    }

    public VerificationBadge badge() {
        return badge;
    }
}
