package com.vybe.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

public record SendCodeRequest(
        @NotBlank(message = "phone is required")
        @Pattern(regexp = PhoneFormat.E164, message = "phone must be in E.164 format")
        String phone
) {
}
