package com.qualitrack.backend.modules.rbac.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

import com.qualitrack.backend.global.error.ConflictException;
import com.qualitrack.backend.global.error.PolicyViolationException;
import com.qualitrack.backend.global.error.ResourceNotFoundException;
import com.qualitrack.backend.global.error.StorageException;
import com.qualitrack.backend.modules.credential.domain.AppUser;
import com.qualitrack.backend.modules.credential.infrastructure.persistence.AppUserRepository;
import com.qualitrack.backend.modules.rbac.domain.Role;
import com.qualitrack.backend.modules.rbac.domain.UserRole;
import com.qualitrack.backend.modules.rbac.infrastructure.persistence.RoleRepository;
import com.qualitrack.backend.modules.rbac.infrastructure.persistence.UserRoleRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.convert.DurationStyle;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * User to role assignments. A (user, role) pair has at most one row; revoked or expired
 * grants are reactivated in place and revocation never deletes the row.
 */
@Service
@Transactional
public class GrantStore {

    private static final Logger log = LoggerFactory.getLogger(GrantStore.class);

    private final AppUserRepository appUserRepository;
    private final RoleRepository roleRepository;
    private final UserRoleRepository userRoleRepository;
    private final AccessChangeListener accessChangeListener;
    private final Clock clock;
    private final Duration defaultGrantDuration;

    public GrantStore(
            AppUserRepository appUserRepository,
            RoleRepository roleRepository,
            UserRoleRepository userRoleRepository,
            AccessChangeListener accessChangeListener,
            Clock clock,
            @Value("${app.access.grants.default-duration:}") String defaultGrantDuration
    ) {
        this.appUserRepository = appUserRepository;
        this.roleRepository = roleRepository;
        this.userRoleRepository = userRoleRepository;
        this.accessChangeListener = accessChangeListener;
        this.clock = clock;
        this.defaultGrantDuration = StringUtils.hasText(defaultGrantDuration)
                ? DurationStyle.detectAndParse(defaultGrantDuration.trim())
                : null;
    }

    /**
     * Grants a role. Re-assigning an effective grant changes nothing; a revoked or expired
     * grant is reactivated with the new assigner and expiry.
     *
     * @param assignedById the administrator performing the assignment, may be null for system seeding
     * @param expiresAt    null means the configured default duration, or no expiry when none is configured
     */
    public GrantView assignRoleToUser(@NonNull Long userId, String roleName, Long assignedById, OffsetDateTime expiresAt) {
        AppUser user = findUser(userId);
        if (!user.isActive()) {
            throw new ConflictException("grant.user_inactive", "Cannot grant roles to inactive user " + userId);
        }
        Role role = findRole(roleName);
        AppUser assignedBy = assignedById != null ? findUser(assignedById) : null;

        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime effectiveExpiry = expiresAt;
        if (effectiveExpiry == null && defaultGrantDuration != null) {
            effectiveExpiry = now.plus(defaultGrantDuration);
        }
        if (effectiveExpiry != null && !effectiveExpiry.isAfter(now)) {
            throw new PolicyViolationException("grant.expiry_in_past", "Grant expiry must be in the future");
        }

        Optional<UserRole> existing = userRoleRepository.findForUpdate(userId, role.getId());
        UserRole grant;
        if (existing.isPresent()) {
            grant = existing.get();
            if (grant.isEffectiveAt(now)) {
                return GrantView.of(grant, userId, now);
            }
            grant.reactivate(assignedBy, now, effectiveExpiry);
        } else {
            grant = new UserRole(user, role, assignedBy, now, effectiveExpiry);
        }
        UserRole saved;
        try {
            saved = userRoleRepository.save(grant);
        } catch (DataIntegrityViolationException ex) {
            // a concurrent assignment inserted the same (user, role) row first
            throw new StorageException("Concurrent assignment of role " + roleName + " to user " + userId, ex);
        }
        accessChangeListener.grantsChanged(userId);
        log.info("Role '{}' granted to user {} by {} (expires {})", roleName, userId, assignedById, effectiveExpiry);
        return GrantView.of(saved, userId, now);
    }

    /**
     * @return false when there was no active grant to revoke
     */
    public boolean revokeRoleFromUser(@NonNull Long userId, String roleName) {
        findUser(userId);
        Role role = findRole(roleName);
        Optional<UserRole> existing = userRoleRepository.findForUpdate(userId, role.getId());
        if (existing.isEmpty() || !existing.get().isActive()) {
            return false;
        }
        UserRole grant = existing.get();
        grant.revoke();
        userRoleRepository.save(grant);
        accessChangeListener.grantsChanged(userId);
        log.info("Role '{}' revoked from user {}", roleName, userId);
        return true;
    }

    /**
     * Revokes every active grant of the user, used when the account is deactivated.
     *
     * @return number of grants revoked
     */
    public int revokeAllGrants(@NonNull Long userId) {
        List<UserRole> activeGrants = userRoleRepository.findActiveGrants(userId);
        activeGrants.forEach(grant -> {
            grant.revoke();
            userRoleRepository.save(grant);
        });
        accessChangeListener.grantsChanged(userId);
        if (!activeGrants.isEmpty()) {
            log.info("Revoked {} grant(s) of user {}", activeGrants.size(), userId);
        }
        return activeGrants.size();
    }

    /**
     * Grants that currently contribute permissions.
     */
    @Transactional(readOnly = true)
    public List<GrantView> listActiveGrants(@NonNull Long userId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        return userRoleRepository.findActiveGrants(userId).stream()
                .filter(grant -> grant.isEffectiveAt(now))
                .map(grant -> GrantView.of(grant, userId, now))
                .toList();
    }

    /**
     * Every grant row of the user, including revoked and expired ones.
     */
    @Transactional(readOnly = true)
    public List<GrantView> listGrantHistory(@NonNull Long userId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        return userRoleRepository.findGrantHistory(userId).stream()
                .map(grant -> GrantView.of(grant, userId, now))
                .toList();
    }

    private AppUser findUser(@NonNull Long userId) {
        return appUserRepository.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("grant.user_not_found", "No user with id " + userId));
    }

    private Role findRole(String roleName) {
        return roleRepository.findByName(roleName)
                .orElseThrow(() -> new ResourceNotFoundException("grant.role_not_found", "No role named " + roleName));
    }
}
