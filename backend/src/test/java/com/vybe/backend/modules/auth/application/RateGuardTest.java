package com.vybe.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;

import com.vybe.backend.modules.auth.domain.AuthErrorKind;
import com.vybe.backend.modules.auth.domain.AuthException;
import com.vybe.backend.support.InMemoryFastStore;
import com.vybe.backend.support.MutableClock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RateGuardTest {

    private static final Duration WINDOW = Duration.ofSeconds(60);

    private MutableClock clock;
    private InMemoryFastStore fastStore;
    private RateGuard rateGuard;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-01-01T00:00:00Z");
        fastStore = new InMemoryFastStore(clock);
        rateGuard = new RateGuard(fastStore);
    }

    @Test
    void admitsUpToTheLimitThenRejectsWithRetryAfter() {
        for (int i = 0; i < 3; i++) {
            rateGuard.admit("auth:10.0.0.1", 3, WINDOW);
        }
        clock.advance(Duration.ofMillis(20_500));

        assertThatThrownBy(() -> rateGuard.admit("auth:10.0.0.1", 3, WINDOW))
                .isInstanceOfSatisfying(AuthException.class, ex -> {
                    assertThat(ex.getKind()).isEqualTo(AuthErrorKind.RATE_LIMITED);
                    assertThat(ex.getRetryAfterSeconds()).isEqualTo(40);
                });
    }

    @Test
    void windowResetsAfterExpiry() {
        for (int i = 0; i < 3; i++) {
            rateGuard.admit("auth:10.0.0.1", 3, WINDOW);
        }

        clock.advance(WINDOW);

        assertThatCode(() -> rateGuard.admit("auth:10.0.0.1", 3, WINDOW)).doesNotThrowAnyException();
    }

    @Test
    void keysAreCountedIndependently() {
        for (int i = 0; i < 3; i++) {
            rateGuard.admit("auth:10.0.0.1", 3, WINDOW);
        }

        assertThatCode(() -> rateGuard.admit("auth:10.0.0.2", 3, WINDOW)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("an unreachable fast store admits the attempt")
    void failsOpenWhenStoreIsDown() {
        fastStore.setAvailable(false);

        for (int i = 0; i < 10; i++) {
            assertThatCode(() -> rateGuard.admit("auth:10.0.0.1", 3, WINDOW)).doesNotThrowAnyException();
        }
    }
}
