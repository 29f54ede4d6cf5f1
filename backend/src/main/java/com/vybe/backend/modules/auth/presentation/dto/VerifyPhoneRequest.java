package com.vybe.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record VerifyPhoneRequest(
        @NotBlank(message = "phone is required")
        @Pattern(regexp = PhoneFormat.E164, message = "phone must be in E.164 format")
        String phone,
        @NotBlank(message = "code is required")
        @Pattern(regexp = "^\\d{6}$", message = "code must be 6 digits")
        String code,
        @Size(max = 50, message = "deviceType must be at most 50 characters")
        String deviceType
) {
}
