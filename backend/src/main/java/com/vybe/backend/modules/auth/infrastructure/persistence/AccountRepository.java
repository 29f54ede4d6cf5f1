package com.vybe.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.vybe.backend.modules.auth.domain.Account;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AccountRepository extends JpaRepository<Account, UUID> {

    Optional<Account> findByPhone(String phone);

    Optional<Account> findByGoogleSubject(String googleSubject);

    Optional<Account> findByAppleSubject(String appleSubject);

    @Query("select a from Account a where lower(a.email) = lower(:email)")
    Optional<Account> findByEmailIgnoreCase(@Param("email") String email);

    @Modifying
    @Query("update Account a set a.lastActiveAt = :lastActiveAt where a.id = :accountId")
    int touchLastActive(@Param("accountId") UUID accountId, @Param("lastActiveAt") OffsetDateTime lastActiveAt);
}
