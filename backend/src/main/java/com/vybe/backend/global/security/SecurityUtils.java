package com.vybe.backend.global.security;

import java.util.UUID;

import com.vybe.backend.modules.auth.domain.AuthException;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

public final class SecurityUtils {

    private SecurityUtils() {
    }

    public static JwtAuthenticationPrincipal getCurrentPrincipal() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !(authentication.getPrincipal() instanceof JwtAuthenticationPrincipal principal)) {
            throw AuthException.unauthorized("Authentication required");
        }
        return principal;
    }

    public static UUID getCurrentUserId() {
        return getCurrentPrincipal().userId();
    }

    public static UUID getCurrentSessionId() {
        return getCurrentPrincipal().sessionId();
    }
}
