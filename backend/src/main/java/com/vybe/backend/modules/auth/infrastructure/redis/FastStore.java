package com.vybe.backend.modules.auth.infrastructure.redis;

import java.time.Duration;
import java.util.Collection;
import java.util.Optional;

/**
 * Key/value operations the auth module needs from the ephemeral store.
 * Implementations throw {@link org.springframework.dao.DataAccessException} when the store is unreachable.
 */
public interface FastStore {

    Optional<String> get(String key);

    boolean exists(String key);

    void set(String key, String value, Duration ttl);

    boolean delete(String key);

    /**
     * Deletes all keys in a single round trip.
     *
     * @return number of keys that existed
     */
    long deleteAll(Collection<String> keys);

    /**
     * Atomically increments the counter and starts its expiry on the first hit of a window.
     *
     * @return counter value after the increment
     */
    long incrementWithTtl(String key, Duration ttl);

    /**
     * Remaining lifetime of the key, or {@link Duration#ZERO} when the key has none.
     */
    Duration remainingTtl(String key);
}
