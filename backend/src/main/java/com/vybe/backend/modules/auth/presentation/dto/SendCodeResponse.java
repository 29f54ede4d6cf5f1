package com.vybe.backend.modules.auth.presentation.dto;

public record SendCodeResponse(boolean success) {

    public static SendCodeResponse sent() {
        return new SendCodeResponse(true);
    }
}
