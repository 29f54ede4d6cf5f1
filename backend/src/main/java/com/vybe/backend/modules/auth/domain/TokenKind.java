package com.vybe.backend.modules.auth.domain;

public enum TokenKind {
    ACCESS("access"),
    REFRESH("refresh");

    private final String claimValue;

    TokenKind(String claimValue) {
        this.claimValue = claimValue;
    }

    public String claimValue() {
        return claimValue;
    }
}
