package com.vybe.backend.modules.auth.domain;

import org.springframework.http.HttpStatus;

/**
 * Closed set of authentication failures. Callers switch on the kind instead of inspecting status codes.
 */
public enum AuthErrorKind {

    /** Too many code sends or login attempts; carries a retry-after hint. */
    RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS),
    /** Wrong or expired code, malformed or foreign federated token. User-correctable. */
    INVALID_CREDENTIAL(HttpStatus.BAD_REQUEST),
    /** Expired or unparseable refresh token. The caller must sign in again. */
    INVALID_REFRESH_TOKEN(HttpStatus.UNAUTHORIZED),
    /** Refresh token reuse detected. Every session of the account has been revoked. */
    SESSION_COMPROMISED(HttpStatus.UNAUTHORIZED),
    /** Linking would bind one external identifier to two accounts. */
    ACCOUNT_CONFLICT(HttpStatus.CONFLICT),
    /** Missing, invalid or revoked access token. */
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED);

    private final HttpStatus status;

    AuthErrorKind(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
