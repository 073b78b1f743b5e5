package com.qualitrack.backend.modules.authorization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import com.qualitrack.backend.global.error.AuthorizationException;
import com.qualitrack.backend.modules.authorization.application.AccessGuard;
import com.qualitrack.backend.modules.authorization.application.AuthenticationService;
import com.qualitrack.backend.modules.authorization.application.PermissionCache;
import com.qualitrack.backend.modules.authorization.application.PermissionResolver;
import com.qualitrack.backend.modules.authorization.domain.Identity;
import com.qualitrack.backend.modules.credential.domain.AppUser;
import com.qualitrack.backend.modules.rbac.application.GrantStore;
import com.qualitrack.backend.modules.rbac.application.GrantView;
import com.qualitrack.backend.modules.rbac.application.RoleRegistry;
import com.qualitrack.backend.modules.rbac.application.RoleRegistry.CreateRoleCommand;
import com.qualitrack.backend.modules.rbac.domain.GrantStatus;
import com.qualitrack.backend.support.AbstractPostgresIntegrationTest;
import com.qualitrack.backend.support.TestUserFactory;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class PermissionResolutionIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private RoleRegistry roleRegistry;

    @Autowired
    private GrantStore grantStore;

    @Autowired
    private PermissionResolver permissionResolver;

    @Autowired
    private PermissionCache permissionCache;

    @Autowired
    private AccessGuard accessGuard;

    @Autowired
    private AuthenticationService authenticationService;

    @Autowired
    private TestUserFactory testUserFactory;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Test
    void roleWithTwoPermissionsResolvesToExactlyThose() {
        roleRegistry.createRole(new CreateRoleCommand("lab_assistant", "Lab assistant", null, false));
        roleRegistry.assignPermissionToRole("lab_assistant", "lab.view");
        roleRegistry.assignPermissionToRole("lab_assistant", "lab.create");
        AppUser user = testUserFactory.adaptiveUser("lab1", "pw");

        grantStore.assignRoleToUser(user.getId(), "lab_assistant", null, null);

        assertThat(permissionResolver.resolve(user.getId())).containsExactlyInAnyOrder("lab.view", "lab.create");
    }

    @Test
    void seededRolesOverlapWithoutDuplicates() {
        AppUser user = testUserFactory.adaptiveUser("multi", "pw");
        grantStore.assignRoleToUser(user.getId(), "lab_technician", null, null);
        grantStore.assignRoleToUser(user.getId(), "viewer", null, null);

        assertThat(permissionResolver.resolve(user.getId())).containsExactlyInAnyOrder(
                "materials.view", "lab.view", "lab.create", "lab.edit", "lab.approve", "quality.view",
                "documents.view", "documents.upload", "reports.view", "reports.create", "suppliers.view");
    }

    @Test
    void expiredGrantIsExcluded() {
        AppUser user = testUserFactory.adaptiveUser("temp1", "pw");
        OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
        testUserFactory.grantRole(user, "operator", now.minusDays(2), now.minusDays(1));

        assertThat(permissionResolver.resolve(user.getId())).isEmpty();
        assertThat(grantStore.listGrantHistory(user.getId()))
                .extracting(GrantView::status)
                .containsExactly(GrantStatus.EXPIRED);
    }

    @Test
    void revokeThenReassignReusesTheSameRow() {
        AppUser user = testUserFactory.adaptiveUser("op1", "pw");
        grantStore.assignRoleToUser(user.getId(), "operator", null, null);
        assertThat(permissionCache.getOrResolve(user.getId())).contains("materials.create");

        grantStore.revokeRoleFromUser(user.getId(), "operator");
        assertThat(permissionCache.getOrResolve(user.getId())).isEmpty();

        grantStore.assignRoleToUser(user.getId(), "operator", null, null);
        assertThat(permissionCache.getOrResolve(user.getId())).contains("materials.create");

        Integer rows = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM user_role WHERE user_id = ?", Integer.class, user.getId());
        assertThat(rows).isEqualTo(1);
    }

    @Test
    void rolePermissionChangeReachesCachedUsers() {
        roleRegistry.createRole(new CreateRoleCommand("auditor", null, null, false));
        AppUser user = testUserFactory.adaptiveUser("aud1", "pw");
        grantStore.assignRoleToUser(user.getId(), "auditor", null, null);
        assertThat(permissionCache.getOrResolve(user.getId())).isEmpty();

        roleRegistry.assignPermissionToRole("auditor", "admin.logs");

        assertThat(permissionCache.getOrResolve(user.getId())).containsExactly("admin.logs");
    }

    @Test
    void guardDeniesMissingPermissionAndAuditsIt() {
        AppUser user = testUserFactory.adaptiveUser("viewer1", "pw");
        grantStore.assignRoleToUser(user.getId(), "viewer", null, null);
        Identity identity = authenticationService.authenticate("viewer1", "pw");

        assertThatThrownBy(() -> accessGuard.requirePermission(identity, "admin.users"))
                .isInstanceOfSatisfying(AuthorizationException.class,
                        ex -> assertThat(ex.getRequired()).containsExactly("admin.users"));

        Integer denials = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM audit_log WHERE action = 'authz.check' AND outcome = 'DENIED' AND actor_user_id = ?",
                Integer.class, user.getId());
        assertThat(denials).isEqualTo(1);
    }
}
