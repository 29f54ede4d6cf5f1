package com.vybe.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record GoogleAuthRequest(
        @NotBlank(message = "idToken is required") String idToken,
        @Size(max = 50, message = "deviceType must be at most 50 characters") String deviceType
) {
}
