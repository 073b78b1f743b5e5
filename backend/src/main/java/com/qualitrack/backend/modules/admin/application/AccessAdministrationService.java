package com.qualitrack.backend.modules.admin.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.qualitrack.backend.global.error.PolicyViolationException;
import com.qualitrack.backend.modules.audit.application.AuditEvent;
import com.qualitrack.backend.modules.audit.application.AuditSink;
import com.qualitrack.backend.modules.audit.domain.AuditOutcome;
import com.qualitrack.backend.modules.authorization.application.AccessGuard;
import com.qualitrack.backend.modules.authorization.domain.Identity;
import com.qualitrack.backend.modules.credential.application.CredentialStore;
import com.qualitrack.backend.modules.credential.domain.AppUser;
import com.qualitrack.backend.modules.rbac.application.GrantStore;
import com.qualitrack.backend.modules.rbac.application.GrantView;
import com.qualitrack.backend.modules.rbac.application.RoleRegistry;
import com.qualitrack.backend.modules.rbac.application.RoleRegistry.CreatePermissionCommand;
import com.qualitrack.backend.modules.rbac.application.RoleRegistry.CreateRoleCommand;
import com.qualitrack.backend.modules.rbac.domain.Permission;
import com.qualitrack.backend.modules.rbac.domain.Role;
import com.qualitrack.backend.modules.session.application.SessionService;
import com.qualitrack.backend.modules.session.application.SessionView;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Administrative mutations of users, roles and grants, each checked against the acting
 * identity and audited once committed.
 */
@Service
@Transactional
public class AccessAdministrationService {

    private static final Logger log = LoggerFactory.getLogger(AccessAdministrationService.class);

    public static final String MANAGE_ROLES = "admin.roles";
    public static final String MANAGE_USERS = "admin.users";

    private final AccessGuard accessGuard;
    private final RoleRegistry roleRegistry;
    private final GrantStore grantStore;
    private final CredentialStore credentialStore;
    private final SessionService sessionService;
    private final AuditSink auditSink;
    private final Clock clock;

    public AccessAdministrationService(
            AccessGuard accessGuard,
            RoleRegistry roleRegistry,
            GrantStore grantStore,
            CredentialStore credentialStore,
            SessionService sessionService,
            AuditSink auditSink,
            Clock clock
    ) {
        this.accessGuard = accessGuard;
        this.roleRegistry = roleRegistry;
        this.grantStore = grantStore;
        this.credentialStore = credentialStore;
        this.sessionService = sessionService;
        this.auditSink = auditSink;
        this.clock = clock;
    }

    public Role createRole(Identity actor, CreateRoleCommand command) {
        accessGuard.requirePermission(actor, MANAGE_ROLES);
        Role role = roleRegistry.createRole(command);
        auditAfterCommit(actor, "admin.role_create", role.getName(), Map.of());
        return role;
    }

    public Permission createPermission(Identity actor, CreatePermissionCommand command) {
        accessGuard.requirePermission(actor, MANAGE_ROLES);
        Permission permission = roleRegistry.createPermission(command);
        auditAfterCommit(actor, "admin.permission_create", permission.getName(), Map.of());
        return permission;
    }

    public boolean assignPermissionToRole(Identity actor, String roleName, String permissionName) {
        accessGuard.requirePermission(actor, MANAGE_ROLES);
        boolean changed = roleRegistry.assignPermissionToRole(roleName, permissionName);
        if (changed) {
            auditAfterCommit(actor, "admin.role_permission_assign", roleName, Map.of("permission", permissionName));
        }
        return changed;
    }

    public boolean revokePermissionFromRole(Identity actor, String roleName, String permissionName) {
        accessGuard.requirePermission(actor, MANAGE_ROLES);
        boolean changed = roleRegistry.revokePermissionFromRole(roleName, permissionName);
        if (changed) {
            auditAfterCommit(actor, "admin.role_permission_revoke", roleName, Map.of("permission", permissionName));
        }
        return changed;
    }

    public void deleteRole(Identity actor, String roleName) {
        accessGuard.requirePermission(actor, MANAGE_ROLES);
        roleRegistry.deleteRole(roleName);
        auditAfterCommit(actor, "admin.role_delete", roleName, Map.of());
    }

    public void deletePermission(Identity actor, String permissionName) {
        accessGuard.requirePermission(actor, MANAGE_ROLES);
        roleRegistry.deletePermission(permissionName);
        auditAfterCommit(actor, "admin.permission_delete", permissionName, Map.of());
    }

    public GrantView assignRole(Identity actor, @NonNull Long userId, String roleName, OffsetDateTime expiresAt) {
        accessGuard.requirePermission(actor, MANAGE_ROLES);
        GrantView grant = grantStore.assignRoleToUser(userId, roleName, actor.userId(), expiresAt);
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("role", roleName);
        if (grant.expiresAt() != null) {
            detail.put("expiresAt", grant.expiresAt().toString());
        }
        auditAfterCommit(actor, "admin.grant_assign", "user:" + userId, detail);
        return grant;
    }

    public boolean revokeRole(Identity actor, @NonNull Long userId, String roleName) {
        accessGuard.requirePermission(actor, MANAGE_ROLES);
        boolean revoked = grantStore.revokeRoleFromUser(userId, roleName);
        if (revoked) {
            auditAfterCommit(actor, "admin.grant_revoke", "user:" + userId, Map.of("role", roleName));
        }
        return revoked;
    }

    @Transactional(readOnly = true)
    public List<GrantView> listGrantHistory(Identity actor, @NonNull Long userId) {
        accessGuard.requireAny(actor, List.of(MANAGE_ROLES, MANAGE_USERS));
        return grantStore.listGrantHistory(userId);
    }

    /**
     * Creates an account with an adaptive credential and, when {@code initialRole} is given,
     * grants it in the same transaction.
     */
    public AppUser provisionUser(Identity actor, String login, String fullName, String password, String initialRole) {
        accessGuard.requirePermission(actor, MANAGE_USERS);
        if (initialRole != null) {
            accessGuard.requirePermission(actor, MANAGE_ROLES);
        }
        AppUser user = credentialStore.createUser(login, fullName, password);
        if (initialRole != null) {
            grantStore.assignRoleToUser(user.getId(), initialRole, actor.userId(), null);
        }
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("userId", user.getId());
        if (initialRole != null) {
            detail.put("role", initialRole);
        }
        auditAfterCommit(actor, "admin.user_create", user.getLogin(), detail);
        log.info("User {} provisioned by {}", user.getLogin(), actor.login());
        return user;
    }

    /**
     * Soft-deletes the account, revokes its active grants and closes its sessions.
     */
    public void deactivateUser(Identity actor, @NonNull Long userId) {
        accessGuard.requirePermission(actor, MANAGE_USERS);
        if (Objects.equals(actor.userId(), userId)) {
            throw new PolicyViolationException("admin.self_deactivation", "Administrators cannot deactivate their own account");
        }
        AppUser user = credentialStore.deactivateUser(userId);
        int revoked = grantStore.revokeAllGrants(userId);
        int closedSessions = sessionService.invalidateAllUserSessions(userId, SessionService.REASON_USER_DEACTIVATED);
        auditAfterCommit(actor, "admin.user_deactivate", user.getLogin(),
                Map.of("revokedGrants", revoked, "closedSessions", closedSessions));
        log.info("User {} deactivated by {}", user.getLogin(), actor.login());
    }

    @Transactional(readOnly = true)
    public List<SessionView> listUserSessions(Identity actor, @NonNull Long userId, boolean activeOnly) {
        accessGuard.requirePermission(actor, MANAGE_USERS);
        return sessionService.listUserSessions(userId, activeOnly);
    }

    /**
     * Forces the user out of every open session without touching the account.
     */
    public int closeUserSessions(Identity actor, @NonNull Long userId) {
        accessGuard.requirePermission(actor, MANAGE_USERS);
        AppUser user = credentialStore.findUser(userId);
        int closed = sessionService.invalidateAllUserSessions(userId, SessionService.REASON_LOGOUT);
        auditAfterCommit(actor, "admin.user_sessions_close", user.getLogin(), Map.of("closedSessions", closed));
        return closed;
    }

    private void auditAfterCommit(Identity actor, String action, String target, Map<String, Object> detail) {
        AuditEvent event = new AuditEvent(actor.userId(), actor.login(), action, target,
                AuditOutcome.SUCCESS, detail, OffsetDateTime.now(clock));
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            auditSink.record(event);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                auditSink.record(event);
            }
        });
    }
}
