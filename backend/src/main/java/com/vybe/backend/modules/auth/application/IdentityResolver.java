package com.vybe.backend.modules.auth.application;

import java.util.Optional;

import com.vybe.backend.modules.auth.domain.Account;
import com.vybe.backend.modules.auth.domain.AuthException;
import com.vybe.backend.modules.auth.domain.CredentialKind;
import com.vybe.backend.modules.auth.domain.ExternalIdentity;
import com.vybe.backend.modules.auth.infrastructure.persistence.AccountRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Maps a verified external identity to exactly one internal account.
 * <p>
 * Lookup order: the identifier column of the credential kind, then an account sharing the email hint
 * (linked rather than duplicated), then a new account. The unique constraints of the {@code account}
 * table are the final guard; a violation surfaces as {@code ACCOUNT_CONFLICT}.
 */
@Service
public class IdentityResolver {

    private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

    private final AccountRepository accountRepository;

    public IdentityResolver(AccountRepository accountRepository) {
        this.accountRepository = accountRepository;
    }

    @Transactional
    public ResolvedAccount resolve(ExternalIdentity identity) {
        CredentialKind kind = identity.kind();

        Optional<Account> existing = findBySubject(kind, identity.subject());
        if (existing.isPresent()) {
            Account account = existing.get();
            if (account.addBadge(kind.badge())) {
                persist(account);
            }
            return new ResolvedAccount(account, false);
        }

        if (identity.hasEmail()) {
            Optional<Account> sameEmail = accountRepository.findByEmailIgnoreCase(identity.email());
            if (sameEmail.isPresent()) {
                return new ResolvedAccount(link(sameEmail.get(), identity), false);
            }
        }

        Account account = new Account();
        account.bindSubject(kind, identity.subject());
        account.setEmail(identity.hasEmail() ? identity.email() : null);
        account.setDisplayName(identity.displayName());
        account.setAvatarUrl(identity.avatarUrl());
        account.addBadge(kind.badge());
        Account created = persist(account);
        log.info("[AUTH][ACCOUNT] created accountId={} via={}", created.getId(), kind);
        return new ResolvedAccount(created, true);
    }

    private Account link(Account account, ExternalIdentity identity) {
        CredentialKind kind = identity.kind();
        String bound = account.subjectFor(kind);
        if (bound != null && !bound.equals(identity.subject())) {
            log.warn("[AUTH][ACCOUNT] link refused accountId={} via={} reason=subject-already-bound",
                    account.getId(), kind);
            throw AuthException.accountConflict(
                    "The email is already linked to a different " + kind.name().toLowerCase() + " identity");
        }

        account.bindSubject(kind, identity.subject());
        account.addBadge(kind.badge());
        if (account.getDisplayName() == null) {
            account.setDisplayName(identity.displayName());
        }
        if (account.getAvatarUrl() == null) {
            account.setAvatarUrl(identity.avatarUrl());
        }
        Account linked = persist(account);
        log.info("[AUTH][ACCOUNT] linked accountId={} via={}", linked.getId(), kind);
        return linked;
    }

    private Optional<Account> findBySubject(CredentialKind kind, String subject) {
        return switch (kind) {
            case PHONE -> accountRepository.findByPhone(subject);
            case GOOGLE -> accountRepository.findByGoogleSubject(subject);
            case APPLE -> accountRepository.findByAppleSubject(subject);
        };
    }

    private Account persist(Account account) {
        try {
            return accountRepository.saveAndFlush(account);
        } catch (DataIntegrityViolationException ex) {
            throw AuthException.accountConflict("An account already exists for this identity", ex);
        }
    }

    public record ResolvedAccount(Account account, boolean newAccount) {
    }
}
