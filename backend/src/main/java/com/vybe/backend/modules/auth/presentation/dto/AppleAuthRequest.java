package com.vybe.backend.modules.auth.presentation.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * {@code fullName} is only sent by Apple on the first authorization of the app. Other fields Apple's
 * sign-in SDK posts, such as {@code authorizationCode}, are ignored.
 */
public record AppleAuthRequest(
        @NotBlank(message = "identityToken is required") String identityToken,
        @Valid FullName fullName,
        @Size(max = 50, message = "deviceType must be at most 50 characters") String deviceType
) {

    public record FullName(
            @Size(max = 50) String givenName,
            @Size(max = 50) String familyName
    ) {
    }

    public String givenName() {
        return fullName != null ? fullName.givenName() : null;
    }

    public String familyName() {
        return fullName != null ? fullName.familyName() : null;
    }
}
