package com.vybe.backend.modules.auth.domain;

import java.time.OffsetDateTime;
import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;

import com.vybe.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Marketplace user account. Each external identifier column is unique.
 */
@Entity
@Table(name = "account")
public class Account extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "phone", unique = true, length = 20)
    private String phone;

    @Column(name = "email", unique = true, length = 320)
    private String email;

    @Column(name = "google_subject", unique = true, length = 255)
    private String googleSubject;

    @Column(name = "apple_subject", unique = true, length = 255)
    private String appleSubject;

    @Column(name = "display_name", length = 100)
    private String displayName;

    @Column(name = "avatar_url", length = 2048)
    private String avatarUrl;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "account_badge", joinColumns = @JoinColumn(name = "account_id"))
    @Enumerated(EnumType.STRING)
    @Column(name = "badge", nullable = false, length = 16)
    private Set<VerificationBadge> badges = EnumSet.noneOf(VerificationBadge.class);

    @Column(name = "last_active_at")
    private OffsetDateTime lastActiveAt;

    public UUID getId() {
        return id;
    }

    public String getPhone() {
        return phone;
    }

    public void setPhone(String phone) {
        this.phone = phone;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getGoogleSubject() {
        return googleSubject;
    }

    public void setGoogleSubject(String googleSubject) {
        this.googleSubject = googleSubject;
    }

    public String getAppleSubject() {
        return appleSubject;
    }

    public void setAppleSubject(String appleSubject) {
        this.appleSubject = appleSubject;
    }

    public String getDisplayName() {
        return displayName;
    }

    public void setDisplayName(String displayName) {
        this.displayName = displayName;
    }

    public String getAvatarUrl() {
        return avatarUrl;
    }

    public void setAvatarUrl(String avatarUrl) {
        this.avatarUrl = avatarUrl;
    }

    public Set<VerificationBadge> getBadges() {
        return badges;
    }

    /**
     * @return {@code true} if the badge was not present before
     */
    public boolean addBadge(VerificationBadge badge) {
        return badges.add(badge);
    }

    public OffsetDateTime getLastActiveAt() {
        return lastActiveAt;
    }

    public void setLastActiveAt(OffsetDateTime lastActiveAt) {
        this.lastActiveAt = lastActiveAt;
    }

    /**
     * The identifier stored for the given credential path, or {@code null} when not linked.
     */
    public String subjectFor(CredentialKind kind) {
        return switch (kind) {
            case PHONE -> phone;
            case GOOGLE -> googleSubject;
            case APPLE -> appleSubject;
        };
    }

    public void bindSubject(CredentialKind kind, String subject) {
        switch (kind) {
            case PHONE -> this.phone = subject;
            case GOOGLE -> this.googleSubject = subject;
            case APPLE -> this.appleSubject = subject;
        }
    }
}
