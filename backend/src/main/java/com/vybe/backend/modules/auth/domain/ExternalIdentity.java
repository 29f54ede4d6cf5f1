package com.vybe.backend.modules.auth.domain;

/**
 * A verified identity from one credential path plus whatever profile hints came with it.
 * For {@link CredentialKind#PHONE} the subject is the E.164 phone number.
 */
public record ExternalIdentity(
        CredentialKind kind,
        String subject,
        String email,
        String displayName,
        String avatarUrl
) {

    public static ExternalIdentity phone(String phone) {
        return new ExternalIdentity(CredentialKind.PHONE, phone, null, null, null);
    }

    public boolean hasEmail() {
        return email != null && !email.isBlank();
    }
}
