package com.qualitrack.backend.modules.authorization.application;

import static com.qualitrack.backend.support.EntityIds.withId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import com.qualitrack.backend.global.error.StorageException;
import com.qualitrack.backend.modules.authorization.domain.ResolvedAccess;
import com.qualitrack.backend.modules.credential.domain.AppUser;
import com.qualitrack.backend.modules.rbac.domain.Role;
import com.qualitrack.backend.modules.rbac.domain.UserRole;
import com.qualitrack.backend.modules.rbac.infrastructure.persistence.RolePermissionRepository;
import com.qualitrack.backend.modules.rbac.infrastructure.persistence.UserRoleRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class PermissionResolverTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-03-01T08:00:00Z");

    @Mock
    private UserRoleRepository userRoleRepository;

    @Mock
    private RolePermissionRepository rolePermissionRepository;

    private PermissionResolver permissionResolver;
    private AppUser user;
    private Role labTechnician;
    private Role operator;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(), ZoneOffset.UTC);
        permissionResolver = new PermissionResolver(userRoleRepository, rolePermissionRepository, clock);
        user = withId(new AppUser(), 20L);
        labTechnician = withId(new Role("lab_technician", "Lab technician", null, true), 3L);
        operator = withId(new Role("operator", "Operator", null, true), 4L);
    }

    @Test
    void userWithoutGrantsHasNoPermissions() {
        when(userRoleRepository.findActiveGrants(20L)).thenReturn(List.of());

        assertThat(permissionResolver.resolve(20L)).isEmpty();
        verify(rolePermissionRepository, never()).findPermissionNamesByRoleIds(anyCollection());
    }

    @Test
    void expiredGrantsContributeNothing() {
        UserRole expired = new UserRole(user, labTechnician, null, NOW.minusDays(2), NOW.minusSeconds(1));
        when(userRoleRepository.findActiveGrants(20L)).thenReturn(List.of(expired));

        assertThat(permissionResolver.resolve(20L)).isEmpty();
    }

    @Test
    void grantExpiringExactlyNowIsExcluded() {
        UserRole boundary = new UserRole(user, labTechnician, null, NOW.minusDays(2), NOW);
        when(userRoleRepository.findActiveGrants(20L)).thenReturn(List.of(boundary));

        assertThat(permissionResolver.resolve(20L)).isEmpty();
    }

    @Test
    void permissionsOfAllEffectiveRolesAreUnioned() {
        UserRole lab = new UserRole(user, labTechnician, null, NOW.minusDays(2), null);
        UserRole ops = new UserRole(user, operator, null, NOW.minusDays(1), NOW.plusHours(4));
        when(userRoleRepository.findActiveGrants(20L)).thenReturn(List.of(lab, ops));
        when(rolePermissionRepository.findPermissionNamesByRoleIds(Set.of(3L, 4L)))
                .thenReturn(List.of("lab.view", "lab.create", "materials.view"));

        ResolvedAccess access = permissionResolver.resolveAccess(20L);

        assertThat(access.permissions()).containsExactly("lab.create", "lab.view", "materials.view");
        assertThat(access.roles()).containsExactly("lab_technician", "operator");
        assertThat(access.resolvedAt()).isEqualTo(NOW);
        assertThat(access.nextExpiry()).isEqualTo(NOW.plusHours(4));
    }

    @Test
    void storageFailureSurfacesAsStorageException() {
        when(userRoleRepository.findActiveGrants(20L)).thenThrow(new DataAccessResourceFailureException("down"));

        assertThatThrownBy(() -> permissionResolver.resolve(20L))
                .isInstanceOf(StorageException.class)
                .hasMessageContaining("storage.failure");
    }
}
