package com.qualitrack.backend.modules.admin;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.qualitrack.backend.global.error.AuthenticationException;
import com.qualitrack.backend.global.error.ConflictException;
import com.qualitrack.backend.modules.admin.application.AccessAdministrationService;
import com.qualitrack.backend.modules.authorization.application.AuthenticationService;
import com.qualitrack.backend.modules.authorization.domain.Identity;
import com.qualitrack.backend.modules.credential.domain.AppUser;
import com.qualitrack.backend.modules.rbac.application.GrantStore;
import com.qualitrack.backend.modules.rbac.application.RoleRegistry.CreateRoleCommand;
import com.qualitrack.backend.support.AbstractPostgresIntegrationTest;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class AccessAdministrationIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private AccessAdministrationService administrationService;

    @Autowired
    private AuthenticationService authenticationService;

    @Autowired
    private GrantStore grantStore;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private Identity admin;

    @BeforeEach
    void logInAsAdmin() {
        admin = authenticationService.authenticate("admin", "admin");
    }

    @Test
    void provisionedUserCanLogInWithRolePermissions() {
        AppUser created = administrationService.provisionUser(admin, "operator1", "Operator One", "start-123", "operator");

        Identity operator = authenticationService.authenticate("operator1", "start-123");

        assertThat(operator.userId()).isEqualTo(created.getId());
        assertThat(operator.roles()).containsExactly("operator");
        assertThat(operator.permissions()).contains("materials.create").doesNotContain("admin.users");
        assertThat(auditCount("admin.user_create")).isEqualTo(1);
    }

    @Test
    void duplicateLoginIsRejectedWithoutSideEffects() {
        administrationService.provisionUser(admin, "operator1", null, "start-123", null);

        assertThatThrownBy(() -> administrationService.provisionUser(admin, "Operator1", null, "other", "viewer"))
                .isInstanceOf(ConflictException.class);
        assertThat(auditCount("admin.user_create")).isEqualTo(1);
    }

    @Test
    void deactivatedUserCanNoLongerLogIn() {
        AppUser created = administrationService.provisionUser(admin, "leaver", null, "bye-123", "viewer");

        administrationService.deactivateUser(admin, created.getId());

        assertThatThrownBy(() -> authenticationService.authenticate("leaver", "bye-123"))
                .isInstanceOf(AuthenticationException.class);
        assertThat(grantStore.listActiveGrants(created.getId())).isEmpty();
        assertThat(auditCount("admin.user_deactivate")).isEqualTo(1);
    }

    @Test
    void deletingCustomRoleRemovesItsGrants() {
        administrationService.createRole(admin, new CreateRoleCommand("inspector", "Inspector", null, false));
        administrationService.assignPermissionToRole(admin, "inspector", "quality.view");
        AppUser created = administrationService.provisionUser(admin, "insp1", null, "pw-123", "inspector");

        administrationService.deleteRole(admin, "inspector");

        assertThat(authenticationService.authenticate("insp1", "pw-123").permissions()).isEmpty();
        Integer rows = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM user_role WHERE user_id = ?", Integer.class, created.getId());
        assertThat(rows).isZero();
    }

    private Integer auditCount(String action) {
        return jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM audit_log WHERE action = ? AND outcome = 'SUCCESS'", Integer.class, action);
    }
}
