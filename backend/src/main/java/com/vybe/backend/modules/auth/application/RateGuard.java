package com.vybe.backend.modules.auth.application;

import java.time.Duration;

import com.vybe.backend.modules.auth.domain.AuthException;
import com.vybe.backend.modules.auth.infrastructure.redis.FastStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Fixed-window attempt counter kept in the fast store.
 * Fails open: when the store is unavailable the attempt is admitted and the outage logged.
 */
@Component
public class RateGuard {

    private static final Logger log = LoggerFactory.getLogger(RateGuard.class);
    private static final String KEY_PREFIX = "rl:";

    private final FastStore fastStore;

    public RateGuard(FastStore fastStore) {
        this.fastStore = fastStore;
    }

    /**
     * Counts one attempt against {@code key}.
     *
     * @throws AuthException {@code RATE_LIMITED} once more than {@code maxAttempts} hits land in the window
     */
    public void admit(String key, int maxAttempts, Duration window) {
        String counterKey = KEY_PREFIX + key;
        long attempts;
        Duration retryAfter;
        try {
            attempts = fastStore.incrementWithTtl(counterKey, window);
            if (attempts <= maxAttempts) {
                return;
            }
            retryAfter = fastStore.remainingTtl(counterKey);
        } catch (DataAccessException ex) {
            log.warn("[AUTH][RATE_LIMIT] fast store unavailable, failing open key={} cause={}", key, ex.getMessage());
            return;
        }

        long retryAfterSeconds = retryAfter.isZero() ? window.toSeconds() : ceilSeconds(retryAfter);
        log.warn("[AUTH][RATE_LIMIT] rejected key={} attempts={} max={} retryAfter={}s",
                key, attempts, maxAttempts, retryAfterSeconds);
        throw AuthException.rateLimited("Too many attempts. Try again later.", retryAfterSeconds);
    }

    private static long ceilSeconds(Duration duration) {
        long seconds = duration.toSeconds();
        return duration.toMillis() % 1000 == 0 ? seconds : seconds + 1;
    }
}
