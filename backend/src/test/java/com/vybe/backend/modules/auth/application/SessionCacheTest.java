package com.vybe.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

import com.vybe.backend.support.InMemoryFastStore;
import com.vybe.backend.support.MutableClock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SessionCacheTest {

    private final UUID accountId = UUID.randomUUID();

    private MutableClock clock;
    private InMemoryFastStore fastStore;
    private SessionCache sessionCache;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-01-01T00:00:00Z");
        fastStore = new InMemoryFastStore(clock);
        sessionCache = new SessionCache(fastStore);
    }

    @Test
    void entryLivesForTheGivenTtl() {
        UUID sessionId = UUID.randomUUID();

        sessionCache.put(sessionId, accountId, Duration.ofMinutes(10));

        assertThat(sessionCache.lookup(sessionId)).isEqualTo(SessionCache.Lookup.HIT);
        assertThat(fastStore.get("session:" + sessionId)).contains(accountId.toString());
        clock.advance(Duration.ofMinutes(10));
        assertThat(sessionCache.lookup(sessionId)).isEqualTo(SessionCache.Lookup.MISS);
    }

    @Test
    void nonPositiveTtlRemovesTheEntry() {
        UUID sessionId = UUID.randomUUID();
        sessionCache.put(sessionId, accountId, Duration.ofMinutes(10));

        sessionCache.put(sessionId, accountId, Duration.ZERO);

        assertThat(sessionCache.lookup(sessionId)).isEqualTo(SessionCache.Lookup.MISS);
    }

    @Test
    void evictAllRemovesEveryListedSession() {
        UUID first = UUID.randomUUID();
        UUID second = UUID.randomUUID();
        UUID kept = UUID.randomUUID();
        sessionCache.put(first, accountId, Duration.ofMinutes(10));
        sessionCache.put(second, accountId, Duration.ofMinutes(10));
        sessionCache.put(kept, accountId, Duration.ofMinutes(10));

        sessionCache.evictAll(List.of(first, second));

        assertThat(sessionCache.lookup(first)).isEqualTo(SessionCache.Lookup.MISS);
        assertThat(sessionCache.lookup(second)).isEqualTo(SessionCache.Lookup.MISS);
        assertThat(sessionCache.lookup(kept)).isEqualTo(SessionCache.Lookup.HIT);
    }

    @Test
    void outageIsReportedOnReadAndSwallowedOnWrite() {
        UUID sessionId = UUID.randomUUID();
        fastStore.setAvailable(false);

        assertThat(sessionCache.lookup(sessionId)).isEqualTo(SessionCache.Lookup.UNAVAILABLE);
        assertThatCode(() -> {
            sessionCache.put(sessionId, accountId, Duration.ofMinutes(10));
            sessionCache.evict(sessionId);
            sessionCache.evictAll(List.of(sessionId));
        }).doesNotThrowAnyException();
    }
}
