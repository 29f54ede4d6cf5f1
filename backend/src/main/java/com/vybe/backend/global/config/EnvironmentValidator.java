package com.vybe.backend.global.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Refuses to serve traffic with missing or weak token secrets.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final int MIN_SECRET_LENGTH = 32;
    static final String ACCESS_SECRET_KEY = "jwt.access-secret";
    static final String REFRESH_SECRET_KEY = "jwt.refresh-secret";

    private static final String[] REQUIRED_KEYS = {
            "spring.datasource.url",
            ACCESS_SECRET_KEY,
            REFRESH_SECRET_KEY,
            "app.cors.allowed-origins"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = new ArrayList<>();

        for (String key : REQUIRED_KEYS) {
            String value = environment.getProperty(key);
            if (value == null || value.isBlank()) {
                problems.add(key + " is missing");
            }
        }

        String accessSecret = environment.getProperty(ACCESS_SECRET_KEY);
        String refreshSecret = environment.getProperty(REFRESH_SECRET_KEY);
        checkSecretLength(ACCESS_SECRET_KEY, accessSecret, problems);
        checkSecretLength(REFRESH_SECRET_KEY, refreshSecret, problems);
        if (accessSecret != null && !accessSecret.isBlank() && Objects.equals(accessSecret, refreshSecret)) {
            problems.add(ACCESS_SECRET_KEY + " and " + REFRESH_SECRET_KEY + " must differ");
        }

        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("[CONFIG] {}", problem));
            throw new IllegalStateException("Environment validation failed: " + String.join("; ", problems));
        }
        log.info("[CONFIG] environment validated");
    }

    private static void checkSecretLength(String key, String secret, List<String> problems) {
        if (secret != null && !secret.isBlank() && secret.length() < MIN_SECRET_LENGTH) {
            problems.add(key + " must be at least " + MIN_SECRET_LENGTH + " characters");
        }
    }
}
