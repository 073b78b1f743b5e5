package com.qualitrack.backend.modules.authorization.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.qualitrack.backend.global.error.StorageException;
import com.qualitrack.backend.modules.authorization.domain.ResolvedAccess;
import com.qualitrack.backend.modules.rbac.domain.UserRole;
import com.qualitrack.backend.modules.rbac.infrastructure.persistence.RolePermissionRepository;
import com.qualitrack.backend.modules.rbac.infrastructure.persistence.UserRoleRepository;

import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Computes effective permissions: active, unexpired grants joined through the role-permission
 * association, unioned. Read-only; expired grants are skipped, never rewritten.
 */
@Service
@Transactional(readOnly = true)
public class PermissionResolver {

    private final UserRoleRepository userRoleRepository;
    private final RolePermissionRepository rolePermissionRepository;
    private final Clock clock;

    public PermissionResolver(
            UserRoleRepository userRoleRepository,
            RolePermissionRepository rolePermissionRepository,
            Clock clock
    ) {
        this.userRoleRepository = userRoleRepository;
        this.rolePermissionRepository = rolePermissionRepository;
        this.clock = clock;
    }

    public Set<String> resolve(Long userId) {
        return resolveAccess(userId).permissions();
    }

    public ResolvedAccess resolveAccess(Long userId) {
        // one reading for the whole call so a grant cannot be both expired and active
        OffsetDateTime now = OffsetDateTime.now(clock);
        try {
            List<UserRole> effective = userRoleRepository.findActiveGrants(userId).stream()
                    .filter(grant -> grant.isEffectiveAt(now))
                    .toList();
            if (effective.isEmpty()) {
                return ResolvedAccess.none(now);
            }

            Set<Long> roleIds = new HashSet<>();
            Set<String> roleNames = new HashSet<>();
            OffsetDateTime nextExpiry = null;
            for (UserRole grant : effective) {
                roleIds.add(grant.getRole().getId());
                roleNames.add(grant.getRole().getName());
                OffsetDateTime expiresAt = grant.getExpiresAt();
                if (expiresAt != null && (nextExpiry == null || expiresAt.isBefore(nextExpiry))) {
                    nextExpiry = expiresAt;
                }
            }
            Set<String> permissions = new HashSet<>(rolePermissionRepository.findPermissionNamesByRoleIds(roleIds));
            return new ResolvedAccess(roleNames, permissions, now, nextExpiry);
        } catch (DataAccessException ex) {
            throw new StorageException("Failed to resolve permissions of user " + userId, ex);
        }
    }
}
