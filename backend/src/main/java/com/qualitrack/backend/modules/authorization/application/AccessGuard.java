package com.qualitrack.backend.modules.authorization.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

import com.qualitrack.backend.global.error.AuthorizationException;
import com.qualitrack.backend.modules.audit.application.AuditEvent;
import com.qualitrack.backend.modules.audit.application.AuditSink;
import com.qualitrack.backend.modules.audit.domain.AuditOutcome;
import com.qualitrack.backend.modules.authorization.domain.Identity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Permission checks for callers. Decisions use the cached effective permissions of the
 * identity's user, not the snapshot carried by the {@link Identity}, so a revoke is honoured
 * without a new login.
 */
@Component
public class AccessGuard {

    private static final Logger log = LoggerFactory.getLogger(AccessGuard.class);

    static final String CHECK_ACTION = "authz.check";

    private final PermissionCache permissionCache;
    private final AuditSink auditSink;
    private final Clock clock;

    public AccessGuard(PermissionCache permissionCache, AuditSink auditSink, Clock clock) {
        this.permissionCache = permissionCache;
        this.auditSink = auditSink;
        this.clock = clock;
    }

    public boolean authorize(Identity identity, String permission) {
        Objects.requireNonNull(identity, "identity is required");
        return authorize(identity.userId(), permission);
    }

    public boolean authorize(Long userId, String permission) {
        if (userId == null || permission == null) {
            return false;
        }
        return permissionCache.getOrResolve(userId).contains(permission);
    }

    public void requirePermission(Identity identity, String permission) {
        Objects.requireNonNull(permission, "permission is required");
        requireAll(identity, List.of(permission));
    }

    /**
     * Passes when at least one permission is held. On denial every candidate is reported.
     */
    public void requireAny(Identity identity, Collection<String> permissions) {
        List<String> candidates = requireCandidates(permissions);
        Set<String> held = currentPermissions(identity);
        if (candidates.stream().anyMatch(held::contains)) {
            return;
        }
        throw deny(identity, candidates);
    }

    public void requireAll(Identity identity, Collection<String> permissions) {
        List<String> required = requireCandidates(permissions);
        Set<String> held = currentPermissions(identity);
        List<String> missing = required.stream()
                .filter(permission -> !held.contains(permission))
                .toList();
        if (!missing.isEmpty()) {
            throw deny(identity, missing);
        }
    }

    public void requireRole(Identity identity, String roleName) {
        Objects.requireNonNull(identity, "identity is required");
        Objects.requireNonNull(roleName, "roleName is required");
        if (permissionCache.getOrResolveAccess(identity.userId()).roles().contains(roleName)) {
            return;
        }
        AuthorizationException denial = AuthorizationException.missingRole(roleName);
        recordDenial(identity, denial.getRequired());
        throw denial;
    }

    public <T> T callGuarded(Identity identity, String permission, Supplier<T> action) {
        requirePermission(identity, permission);
        return action.get();
    }

    public void runGuarded(Identity identity, String permission, Runnable action) {
        requirePermission(identity, permission);
        action.run();
    }

    /**
     * An empty requirement has no meaning for either check, so it is a caller bug.
     */
    private List<String> requireCandidates(Collection<String> permissions) {
        Objects.requireNonNull(permissions, "permissions are required");
        if (permissions.isEmpty()) {
            throw new IllegalArgumentException("at least one permission is required");
        }
        // List.copyOf rejects null elements
        return List.copyOf(permissions);
    }

    private Set<String> currentPermissions(Identity identity) {
        Objects.requireNonNull(identity, "identity is required");
        return permissionCache.getOrResolve(identity.userId());
    }

    private AuthorizationException deny(Identity identity, List<String> missing) {
        recordDenial(identity, missing);
        return new AuthorizationException(missing);
    }

    private void recordDenial(Identity identity, List<String> missing) {
        log.debug("Denied user {} missing {}", identity.login(), missing);
        auditSink.record(new AuditEvent(
                identity.userId(),
                identity.login(),
                CHECK_ACTION,
                String.join(",", missing),
                AuditOutcome.DENIED,
                Map.of("missing", missing),
                OffsetDateTime.now(clock)
        ));
    }
}
