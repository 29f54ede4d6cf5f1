package com.vybe.backend.modules.auth.presentation.dto;

public record AuthResponse(
        AccountSummaryResponse user,
        TokenPairResponse tokens
) {
}
