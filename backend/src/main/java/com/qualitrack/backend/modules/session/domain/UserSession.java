package com.qualitrack.backend.modules.session.domain;

import java.time.OffsetDateTime;

import com.qualitrack.backend.global.jpa.AbstractTimestampedEntity;
import com.qualitrack.backend.modules.credential.domain.AppUser;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

/**
 * Login session. Only the SHA-256 digest of the bearer token is stored; a session is never
 * deleted, it is closed by setting {@code revokedAt}.
 */
@Entity
@Table(name = "user_session")
public class UserSession extends AbstractTimestampedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false, updatable = false)
    private AppUser user;

    @Column(name = "token_hash", nullable = false, unique = true, length = 64, updatable = false)
    private String tokenHash;

    @Column(name = "remember_me", nullable = false)
    private boolean rememberMe;

    @Column(name = "device_info", length = 200)
    private String deviceInfo;

    @Column(name = "issued_at", nullable = false)
    private OffsetDateTime issuedAt;

    @Column(name = "expires_at", nullable = false)
    private OffsetDateTime expiresAt;

    @Column(name = "last_activity_at", nullable = false)
    private OffsetDateTime lastActivityAt;

    @Column(name = "revoked_at")
    private OffsetDateTime revokedAt;

    @Column(name = "revoked_reason", length = 50)
    private String revokedReason;

    protected UserSession() {
    }

    public UserSession(
            AppUser user,
            String tokenHash,
            boolean rememberMe,
            String deviceInfo,
            OffsetDateTime issuedAt,
            OffsetDateTime expiresAt
    ) {
        this.user = user;
        this.tokenHash = tokenHash;
        this.rememberMe = rememberMe;
        this.deviceInfo = deviceInfo;
        this.issuedAt = issuedAt;
        this.expiresAt = expiresAt;
        this.lastActivityAt = issuedAt;
    }

    public Long getId() {
        return id;
    }

    public AppUser getUser() {
        return user;
    }

    public String getTokenHash() {
        return tokenHash;
    }

    public boolean isRememberMe() {
        return rememberMe;
    }

    public String getDeviceInfo() {
        return deviceInfo;
    }

    public OffsetDateTime getIssuedAt() {
        return issuedAt;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }

    public OffsetDateTime getLastActivityAt() {
        return lastActivityAt;
    }

    public OffsetDateTime getRevokedAt() {
        return revokedAt;
    }

    public String getRevokedReason() {
        return revokedReason;
    }

    public void touch(OffsetDateTime now) {
        this.lastActivityAt = now;
    }

    public void revoke(OffsetDateTime now, String reason) {
        if (revokedAt != null) {
            return;
        }
        this.revokedAt = now;
        this.revokedReason = reason;
    }

    public boolean isActiveAt(OffsetDateTime now) {
        return revokedAt == null && expiresAt.isAfter(now);
    }
}
