package com.qualitrack.backend.modules.rbac.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.regex.Pattern;

import com.qualitrack.backend.global.error.ConflictException;
import com.qualitrack.backend.global.error.PolicyViolationException;
import com.qualitrack.backend.global.error.ResourceNotFoundException;
import com.qualitrack.backend.modules.rbac.domain.Permission;
import com.qualitrack.backend.modules.rbac.domain.Role;
import com.qualitrack.backend.modules.rbac.domain.RolePermission;
import com.qualitrack.backend.modules.rbac.infrastructure.persistence.PermissionRepository;
import com.qualitrack.backend.modules.rbac.infrastructure.persistence.RolePermissionRepository;
import com.qualitrack.backend.modules.rbac.infrastructure.persistence.RoleRepository;
import com.qualitrack.backend.modules.rbac.infrastructure.persistence.UserRoleRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Role and permission vocabularies and the association between them.
 * Names are unique and never change; a rename is a delete followed by a create.
 */
@Service
@Transactional
public class RoleRegistry {

    private static final Logger log = LoggerFactory.getLogger(RoleRegistry.class);

    private static final Pattern ROLE_NAME = Pattern.compile("[a-z][a-z0-9_]{0,63}");
    private static final Pattern PERMISSION_NAME = Pattern.compile("[a-z][a-z0-9_]*(\\.[a-z][a-z0-9_]*)+");

    private final RoleRepository roleRepository;
    private final PermissionRepository permissionRepository;
    private final RolePermissionRepository rolePermissionRepository;
    private final UserRoleRepository userRoleRepository;
    private final AccessChangeListener accessChangeListener;
    private final Clock clock;

    public RoleRegistry(
            RoleRepository roleRepository,
            PermissionRepository permissionRepository,
            RolePermissionRepository rolePermissionRepository,
            UserRoleRepository userRoleRepository,
            AccessChangeListener accessChangeListener,
            Clock clock
    ) {
        this.roleRepository = roleRepository;
        this.permissionRepository = permissionRepository;
        this.rolePermissionRepository = rolePermissionRepository;
        this.userRoleRepository = userRoleRepository;
        this.accessChangeListener = accessChangeListener;
        this.clock = clock;
    }

    public Role createRole(CreateRoleCommand command) {
        String name = command.name() != null ? command.name().trim() : "";
        if (!ROLE_NAME.matcher(name).matches()) {
            throw new PolicyViolationException("rbac.role_name_invalid",
                    "Role name must be lower-case letters, digits or '_': " + command.name());
        }
        if (roleRepository.existsByName(name)) {
            throw new ConflictException("rbac.role_exists", "Role already exists: " + name);
        }
        String displayName = hasText(command.displayName()) ? command.displayName().trim() : name;
        Role role = roleRepository.save(new Role(name, displayName, command.description(), command.systemRole()));
        log.info("Created role '{}'", name);
        return role;
    }

    public Permission createPermission(CreatePermissionCommand command) {
        String name = command.name() != null ? command.name().trim() : "";
        if (!PERMISSION_NAME.matcher(name).matches()) {
            throw new PolicyViolationException("rbac.permission_name_invalid",
                    "Permission name must be a dotted lower-case name such as 'materials.create': " + command.name());
        }
        if (permissionRepository.existsByName(name)) {
            throw new ConflictException("rbac.permission_exists", "Permission already exists: " + name);
        }
        String category = hasText(command.category())
                ? command.category().trim()
                : name.substring(0, name.indexOf('.'));
        String displayName = hasText(command.displayName()) ? command.displayName().trim() : name;
        Permission permission = permissionRepository.save(
                new Permission(name, displayName, command.description(), category, command.systemPermission()));
        log.info("Created permission '{}' in category '{}'", name, category);
        return permission;
    }

    /**
     * @return false when the role already had the permission
     */
    public boolean assignPermissionToRole(String roleName, String permissionName) {
        Role role = findRole(roleName);
        Permission permission = findPermission(permissionName);
        if (rolePermissionRepository.findByRoleIdAndPermissionId(role.getId(), permission.getId()).isPresent()) {
            return false;
        }
        rolePermissionRepository.save(new RolePermission(role, permission, OffsetDateTime.now(clock)));
        accessChangeListener.rolesChanged();
        log.info("Granted permission '{}' to role '{}'", permissionName, roleName);
        return true;
    }

    /**
     * @return false when the role did not have the permission
     */
    public boolean revokePermissionFromRole(String roleName, String permissionName) {
        Role role = findRole(roleName);
        Permission permission = findPermission(permissionName);
        return rolePermissionRepository.findByRoleIdAndPermissionId(role.getId(), permission.getId())
                .map(association -> {
                    rolePermissionRepository.delete(association);
                    accessChangeListener.rolesChanged();
                    log.info("Removed permission '{}' from role '{}'", permissionName, roleName);
                    return true;
                })
                .orElse(false);
    }

    /**
     * Removes the role together with its permission associations and grants.
     */
    public void deleteRole(String roleName) {
        Role role = findRole(roleName);
        if (role.isSystemRole()) {
            throw new PolicyViolationException("rbac.system_role", "System role cannot be deleted: " + roleName);
        }
        int associations = rolePermissionRepository.deleteByRoleId(role.getId());
        int grants = userRoleRepository.deleteByRoleId(role.getId());
        roleRepository.delete(role);
        accessChangeListener.rolesChanged();
        log.info("Deleted role '{}' ({} permission links, {} grants)", roleName, associations, grants);
    }

    public void deletePermission(String permissionName) {
        Permission permission = findPermission(permissionName);
        if (permission.isSystemPermission()) {
            throw new PolicyViolationException("rbac.system_permission",
                    "System permission cannot be deleted: " + permissionName);
        }
        int associations = rolePermissionRepository.deleteByPermissionId(permission.getId());
        permissionRepository.delete(permission);
        accessChangeListener.rolesChanged();
        log.info("Deleted permission '{}' ({} role links)", permissionName, associations);
    }

    @Transactional(readOnly = true)
    public List<Role> listRoles() {
        return roleRepository.findAllByOrderByNameAsc();
    }

    @Transactional(readOnly = true)
    public List<Permission> listPermissions() {
        return permissionRepository.findAllByOrderByNameAsc();
    }

    @Transactional(readOnly = true)
    public List<Permission> listPermissionsForRole(String roleName) {
        return rolePermissionRepository.findPermissionsByRoleId(findRole(roleName).getId());
    }

    @Transactional(readOnly = true)
    public List<Permission> listPermissionsByCategory(String category) {
        return permissionRepository.findByCategoryOrderByNameAsc(category);
    }

    @Transactional(readOnly = true)
    public Role findRole(String roleName) {
        return roleRepository.findByName(roleName)
                .orElseThrow(() -> new ResourceNotFoundException("rbac.role_not_found", "No role named " + roleName));
    }

    @Transactional(readOnly = true)
    public Permission findPermission(String permissionName) {
        return permissionRepository.findByName(permissionName)
                .orElseThrow(() -> new ResourceNotFoundException("rbac.permission_not_found",
                        "No permission named " + permissionName));
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    public record CreateRoleCommand(String name, String displayName, String description, boolean systemRole) {
    }

    public record CreatePermissionCommand(
            String name,
            String displayName,
            String description,
            String category,
            boolean systemPermission
    ) {
    }
}
