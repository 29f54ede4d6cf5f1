package com.vybe.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.vybe.backend.modules.auth.domain.UserSession;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserSessionRepository extends JpaRepository<UserSession, UUID> {

    @Query("""
            select us
              from UserSession us
             where us.accountId = :accountId
             order by us.createdAt desc, us.id desc
            """)
    List<UserSession> findByAccountIdNewestFirst(@Param("accountId") UUID accountId);

    @Query("select us.id from UserSession us where us.accountId = :accountId")
    List<UUID> findIdsByAccountId(@Param("accountId") UUID accountId);

    /**
     * Compare-and-swap of the refresh digest. Returns 0 when another rotation already replaced
     * {@code expectedHash}.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update UserSession us
               set us.refreshTokenHash = :newHash,
                   us.expiresAt = :expiresAt,
                   us.ipAddress = :ipAddress,
                   us.updatedAt = :updatedAt
             where us.id = :sessionId
               and us.refreshTokenHash = :expectedHash
            """)
    int rotateRefreshHash(@Param("sessionId") UUID sessionId,
                          @Param("expectedHash") String expectedHash,
                          @Param("newHash") String newHash,
                          @Param("expiresAt") OffsetDateTime expiresAt,
                          @Param("ipAddress") String ipAddress,
                          @Param("updatedAt") OffsetDateTime updatedAt);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from UserSession us where us.id = :sessionId")
    int deleteSessionById(@Param("sessionId") UUID sessionId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from UserSession us where us.id in :sessionIds")
    int deleteSessionsByIds(@Param("sessionIds") List<UUID> sessionIds);

    @Query("select us.id from UserSession us where us.expiresAt <= :now")
    List<UUID> findExpiredIds(@Param("now") OffsetDateTime now);
}
