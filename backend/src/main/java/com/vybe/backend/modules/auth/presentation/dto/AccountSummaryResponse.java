package com.vybe.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vybe.backend.modules.auth.domain.Account;
import com.vybe.backend.modules.auth.domain.VerificationBadge;

public record AccountSummaryResponse(
        UUID id,
        String phone,
        String email,
        String displayName,
        String avatarUrl,
        List<VerificationBadge> badges,
        OffsetDateTime createdAt,
        @JsonProperty("isNewUser") boolean newUser
) {

    public static AccountSummaryResponse from(Account account, boolean newUser) {
        List<VerificationBadge> badges = account.getBadges().stream()
                .sorted()
                .toList();
        return new AccountSummaryResponse(
                account.getId(),
                account.getPhone(),
                account.getEmail(),
                account.getDisplayName(),
                account.getAvatarUrl(),
                badges,
                account.getCreatedAt(),
                newUser
        );
    }
}
