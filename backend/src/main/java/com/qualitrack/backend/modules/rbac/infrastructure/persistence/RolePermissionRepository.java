package com.qualitrack.backend.modules.rbac.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

import com.qualitrack.backend.modules.rbac.domain.Permission;
import com.qualitrack.backend.modules.rbac.domain.RolePermission;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RolePermissionRepository extends JpaRepository<RolePermission, Long> {

    @Query("""
            select distinct p.name
              from RolePermission rp
              join rp.permission p
             where rp.role.id in :roleIds
            """)
    List<String> findPermissionNamesByRoleIds(@Param("roleIds") Collection<Long> roleIds);

    @Query("""
            select p
              from RolePermission rp
              join rp.permission p
             where rp.role.id = :roleId
             order by p.name asc
            """)
    List<Permission> findPermissionsByRoleId(@Param("roleId") Long roleId);

    @Query("select rp from RolePermission rp where rp.role.id = :roleId and rp.permission.id = :permissionId")
    Optional<RolePermission> findByRoleIdAndPermissionId(@Param("roleId") Long roleId,
                                                         @Param("permissionId") Long permissionId);

    @Modifying(flushAutomatically = true)
    @Query("delete from RolePermission rp where rp.role.id = :roleId")
    int deleteByRoleId(@Param("roleId") Long roleId);

    @Modifying(flushAutomatically = true)
    @Query("delete from RolePermission rp where rp.permission.id = :permissionId")
    int deleteByPermissionId(@Param("permissionId") Long permissionId);
}
