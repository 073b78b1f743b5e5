package com.qualitrack.backend.modules.rbac.application;

import java.time.OffsetDateTime;

import com.qualitrack.backend.modules.rbac.domain.GrantStatus;
import com.qualitrack.backend.modules.rbac.domain.UserRole;

public record GrantView(
        Long grantId,
        Long userId,
        String roleName,
        Long assignedBy,
        OffsetDateTime assignedAt,
        OffsetDateTime expiresAt,
        GrantStatus status
) {

    static GrantView of(UserRole grant, Long userId, OffsetDateTime now) {
        return new GrantView(
                grant.getId(),
                userId,
                grant.getRole().getName(),
                grant.getAssignedBy() != null ? grant.getAssignedBy().getId() : null,
                grant.getAssignedAt(),
                grant.getExpiresAt(),
                grant.statusAt(now)
        );
    }
}
