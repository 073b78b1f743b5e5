package com.qualitrack.backend.modules.rbac.domain;

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
import jakarta.persistence.UniqueConstraint;

/**
 * Grant of a role to a user. One row per (user, role); revocation only clears {@code active}.
 */
@Entity
@Table(name = "user_role", uniqueConstraints = @UniqueConstraint(columnNames = {"user_id", "role_id"}))
public class UserRole extends AbstractTimestampedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false, updatable = false)
    private AppUser user;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "role_id", nullable = false, updatable = false)
    private Role role;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "assigned_by")
    private AppUser assignedBy;

    @Column(name = "assigned_at", nullable = false)
    private OffsetDateTime assignedAt;

    @Column(name = "expires_at")
    private OffsetDateTime expiresAt;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    protected UserRole() {
    }

    public UserRole(AppUser user, Role role, AppUser assignedBy, OffsetDateTime assignedAt, OffsetDateTime expiresAt) {
        this.user = user;
        this.role = role;
        this.assignedBy = assignedBy;
        this.assignedAt = assignedAt;
        this.expiresAt = expiresAt;
        this.active = true;
    }

    public Long getId() {
        return id;
    }

    public AppUser getUser() {
        return user;
    }

    public Role getRole() {
        return role;
    }

    public AppUser getAssignedBy() {
        return assignedBy;
    }

    public OffsetDateTime getAssignedAt() {
        return assignedAt;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }

    public boolean isActive() {
        return active;
    }

    /**
     * A grant counts iff it is active and not expired at {@code now}.
     */
    public boolean isEffectiveAt(OffsetDateTime now) {
        return active && (expiresAt == null || expiresAt.isAfter(now));
    }

    public GrantStatus statusAt(OffsetDateTime now) {
        if (!active) {
            return GrantStatus.REVOKED;
        }
        return isEffectiveAt(now) ? GrantStatus.ACTIVE : GrantStatus.EXPIRED;
    }

    public void reactivate(AppUser assignedBy, OffsetDateTime assignedAt, OffsetDateTime expiresAt) {
        this.assignedBy = assignedBy;
        this.assignedAt = assignedAt;
        this.expiresAt = expiresAt;
        this.active = true;
    }

    public void revoke() {
        this.active = false;
    }
}
