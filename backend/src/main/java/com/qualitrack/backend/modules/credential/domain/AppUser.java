package com.qualitrack.backend.modules.credential.domain;

import java.time.OffsetDateTime;

import com.qualitrack.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Account record holding the login and its credential representations.
 * Adaptive hash and legacy digest may coexist only while the account is being migrated;
 * {@code passwordFormat} tags which one is authoritative.
 */
@Entity
@Table(name = "app_user")
public class AppUser extends AbstractTimestampedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "login", nullable = false, unique = true, length = 50)
    private String login;

    @Column(name = "full_name", nullable = false, length = 100)
    private String fullName;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private AppUserStatus status;

    @Column(name = "deactivated_at")
    private OffsetDateTime deactivatedAt;

    @Column(name = "legacy_digest", length = 64)
    private String legacyDigest;

    @Column(name = "adaptive_hash", length = 100)
    private String adaptiveHash;

    @Enumerated(EnumType.STRING)
    @Column(name = "password_format", nullable = false, length = 16)
    private CredentialFormat passwordFormat;

    public Long getId() {
        return id;
    }

    public String getLogin() {
        return login;
    }

    public void setLogin(String login) {
        this.login = login;
    }

    public String getFullName() {
        return fullName;
    }

    public void setFullName(String fullName) {
        this.fullName = fullName;
    }

    public AppUserStatus getStatus() {
        return status;
    }

    public void setStatus(AppUserStatus status) {
        this.status = status;
    }

    public OffsetDateTime getDeactivatedAt() {
        return deactivatedAt;
    }

    public void setDeactivatedAt(OffsetDateTime deactivatedAt) {
        this.deactivatedAt = deactivatedAt;
    }

    public String getLegacyDigest() {
        return legacyDigest;
    }

    public String getAdaptiveHash() {
        return adaptiveHash;
    }

    public CredentialFormat getPasswordFormat() {
        return passwordFormat;
    }

    public boolean isActive() {
        return status == AppUserStatus.ACTIVE;
    }

    /**
     * Adaptive wins whenever present, whatever the stored tag says.
     */
    public CredentialFormat authoritativeFormat() {
        if (adaptiveHash != null) {
            return CredentialFormat.ADAPTIVE;
        }
        if (legacyDigest != null) {
            return CredentialFormat.LEGACY;
        }
        return CredentialFormat.NONE;
    }

    public void useAdaptiveHash(String hash) {
        this.adaptiveHash = hash;
        this.legacyDigest = null;
        this.passwordFormat = CredentialFormat.ADAPTIVE;
    }

    /**
     * Only for accounts imported from the legacy store.
     */
    public void useLegacyDigest(String digest) {
        this.legacyDigest = digest;
        this.adaptiveHash = null;
        this.passwordFormat = CredentialFormat.LEGACY;
    }
}
