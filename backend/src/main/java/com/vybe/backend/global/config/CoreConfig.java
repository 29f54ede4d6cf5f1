package com.vybe.backend.global.config;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.ZoneOffset;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Shared infrastructure beans: a single UTC clock source and the random generator
 * used for verification codes and token identifiers.
 */
@Configuration
@EnableScheduling
public class CoreConfig {

    @Bean
    public Clock utcClock() {
        return Clock.system(ZoneOffset.UTC);
    }

    @Bean
    public SecureRandom secureRandom() {
        return new SecureRandom();
    }
}
