package com.vybe.backend.global.security;

import java.util.UUID;

public record JwtAuthenticationPrincipal(UUID userId, UUID sessionId) {
}
