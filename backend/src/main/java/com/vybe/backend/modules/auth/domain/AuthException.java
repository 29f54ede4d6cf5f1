package com.vybe.backend.modules.auth.domain;

import com.vybe.backend.global.error.ProblemException;

public class AuthException extends ProblemException {

    private final AuthErrorKind kind;
    private final Integer retryAfterSeconds;

    private AuthException(AuthErrorKind kind, String detail, Integer retryAfterSeconds, Throwable cause) {
        super(kind.status(), kind.name(), detail, cause);
        this.kind = kind;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public static AuthException rateLimited(String detail, long retryAfterSeconds) {
        return new AuthException(AuthErrorKind.RATE_LIMITED, detail, (int) Math.max(retryAfterSeconds, 0), null);
    }

    public static AuthException invalidCredential(String detail) {
        return new AuthException(AuthErrorKind.INVALID_CREDENTIAL, detail, null, null);
    }

    public static AuthException invalidCredential(String detail, Throwable cause) {
        return new AuthException(AuthErrorKind.INVALID_CREDENTIAL, detail, null, cause);
    }

    public static AuthException invalidRefreshToken(String detail) {
        return new AuthException(AuthErrorKind.INVALID_REFRESH_TOKEN, detail, null, null);
    }

    public static AuthException invalidRefreshToken(String detail, Throwable cause) {
        return new AuthException(AuthErrorKind.INVALID_REFRESH_TOKEN, detail, null, cause);
    }

    public static AuthException sessionCompromised() {
        return new AuthException(AuthErrorKind.SESSION_COMPROMISED,
                "Refresh token reuse detected; all sessions were revoked", null, null);
    }

    public static AuthException accountConflict(String detail) {
        return new AuthException(AuthErrorKind.ACCOUNT_CONFLICT, detail, null, null);
    }

    public static AuthException accountConflict(String detail, Throwable cause) {
        return new AuthException(AuthErrorKind.ACCOUNT_CONFLICT, detail, null, cause);
    }

    public static AuthException unauthorized(String detail) {
        return new AuthException(AuthErrorKind.UNAUTHORIZED, detail, null, null);
    }

    public static AuthException unauthorized(String detail, Throwable cause) {
        return new AuthException(AuthErrorKind.UNAUTHORIZED, detail, null, cause);
    }

    public AuthErrorKind getKind() {
        return kind;
    }

    /**
     * Seconds until the caller may retry, only set for {@link AuthErrorKind#RATE_LIMITED}.
     */
    public Integer getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
