package com.vybe.backend.modules.auth.application;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

import com.vybe.backend.modules.auth.infrastructure.redis.FastStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Write-through projection of "session X is live" in the fast store.
 * Advisory only: a miss proves nothing, and every write failure is logged and swallowed because the
 * durable record stays authoritative.
 */
@Component
public class SessionCache {

    private static final Logger log = LoggerFactory.getLogger(SessionCache.class);
    static final String KEY_PREFIX = "session:";

    public enum Lookup {
        HIT,
        MISS,
        UNAVAILABLE
    }

    private final FastStore fastStore;

    public SessionCache(FastStore fastStore) {
        this.fastStore = fastStore;
    }

    public void put(UUID sessionId, UUID accountId, Duration ttl) {
        if (ttl.isNegative() || ttl.isZero()) {
            evict(sessionId);
            return;
        }
        try {
            fastStore.set(key(sessionId), accountId.toString(), ttl);
        } catch (DataAccessException ex) {
            log.warn("[AUTH][SESSION_CACHE] write failed sessionId={} cause={}", sessionId, ex.getMessage());
        }
    }

    public Lookup lookup(UUID sessionId) {
        try {
            return fastStore.exists(key(sessionId)) ? Lookup.HIT : Lookup.MISS;
        } catch (DataAccessException ex) {
            log.warn("[AUTH][SESSION_CACHE] read failed sessionId={} cause={}", sessionId, ex.getMessage());
            return Lookup.UNAVAILABLE;
        }
    }

    public void evict(UUID sessionId) {
        try {
            fastStore.delete(key(sessionId));
        } catch (DataAccessException ex) {
            log.warn("[AUTH][SESSION_CACHE] evict failed sessionId={} cause={}", sessionId, ex.getMessage());
        }
    }

    public void evictAll(Collection<UUID> sessionIds) {
        if (sessionIds.isEmpty()) {
            return;
        }
        List<String> keys = sessionIds.stream().map(SessionCache::key).toList();
        try {
            fastStore.deleteAll(keys);
        } catch (DataAccessException ex) {
            log.warn("[AUTH][SESSION_CACHE] bulk evict failed count={} cause={}", keys.size(), ex.getMessage());
        }
    }

    static String key(UUID sessionId) {
        return KEY_PREFIX + sessionId;
    }
}
