package com.qualitrack.backend.support;

import java.time.OffsetDateTime;

import com.qualitrack.backend.modules.credential.domain.AppUser;
import com.qualitrack.backend.modules.credential.domain.AppUserStatus;
import com.qualitrack.backend.modules.credential.domain.LegacyPasswordDigest;
import com.qualitrack.backend.modules.credential.infrastructure.persistence.AppUserRepository;
import com.qualitrack.backend.modules.rbac.domain.Role;
import com.qualitrack.backend.modules.rbac.domain.UserRole;
import com.qualitrack.backend.modules.rbac.infrastructure.persistence.RoleRepository;
import com.qualitrack.backend.modules.rbac.infrastructure.persistence.UserRoleRepository;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes fixture accounts and grants straight through the repositories.
 */
@Component
@Transactional
public class TestUserFactory {

    private final AppUserRepository appUserRepository;
    private final RoleRepository roleRepository;
    private final UserRoleRepository userRoleRepository;
    private final PasswordEncoder passwordEncoder;

    public TestUserFactory(
            AppUserRepository appUserRepository,
            RoleRepository roleRepository,
            UserRoleRepository userRoleRepository,
            PasswordEncoder passwordEncoder
    ) {
        this.appUserRepository = appUserRepository;
        this.roleRepository = roleRepository;
        this.userRoleRepository = userRoleRepository;
        this.passwordEncoder = passwordEncoder;
    }

    /**
     * An account still on the unsalted legacy digest, as imported from the old store.
     */
    public AppUser legacyUser(String login, String rawPassword) {
        AppUser user = newUser(login);
        user.useLegacyDigest(LegacyPasswordDigest.digest(rawPassword));
        return appUserRepository.save(user);
    }

    public AppUser adaptiveUser(String login, String rawPassword) {
        AppUser user = newUser(login);
        user.useAdaptiveHash(passwordEncoder.encode(rawPassword));
        return appUserRepository.save(user);
    }

    /**
     * Inserts a grant row without going through the grant store, so expired grants can be planted.
     */
    public void grantRole(AppUser user, String roleName, OffsetDateTime assignedAt, OffsetDateTime expiresAt) {
        Role role = roleRepository.findByName(roleName)
                .orElseThrow(() -> new IllegalStateException("Role not found: " + roleName));
        userRoleRepository.save(new UserRole(appUserRepository.getReferenceById(user.getId()), role, null,
                assignedAt, expiresAt));
    }

    private AppUser newUser(String login) {
        AppUser user = new AppUser();
        user.setLogin(login);
        user.setFullName("Test " + login);
        user.setStatus(AppUserStatus.ACTIVE);
        return user;
    }
}
