package com.qualitrack.backend.modules.authorization.domain;

import java.time.OffsetDateTime;
import java.util.Set;

/**
 * Authenticated user as seen by callers. Not persisted; the role and permission sets are a
 * snapshot taken at {@code resolvedAt}. Guards re-check against the permission cache.
 */
public record Identity(
        Long userId,
        String login,
        Set<String> roles,
        Set<String> permissions,
        OffsetDateTime resolvedAt
) {

    public Identity {
        roles = Set.copyOf(roles);
        permissions = Set.copyOf(permissions);
    }

    public static Identity of(Long userId, String login, ResolvedAccess access) {
        return new Identity(userId, login, access.roles(), access.permissions(), access.resolvedAt());
    }

    public boolean hasPermission(String permission) {
        return permissions.contains(permission);
    }

    public boolean hasRole(String roleName) {
        return roles.contains(roleName);
    }
}
