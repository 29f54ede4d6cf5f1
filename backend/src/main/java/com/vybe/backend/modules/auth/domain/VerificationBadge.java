package com.vybe.backend.modules.auth.domain;

public enum VerificationBadge {
    PHONE,
    GOOGLE,
    APPLE
}
