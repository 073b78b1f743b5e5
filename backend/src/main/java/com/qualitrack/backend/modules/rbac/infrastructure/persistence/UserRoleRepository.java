package com.qualitrack.backend.modules.rbac.infrastructure.persistence;

import java.util.List;
import java.util.Optional;

import com.qualitrack.backend.modules.rbac.domain.UserRole;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserRoleRepository extends JpaRepository<UserRole, Long> {

    /**
     * Grants flagged active. Expiry is not filtered here; callers apply one clock reading themselves.
     */
    @Query("select ur from UserRole ur join fetch ur.role where ur.user.id = :userId and ur.active = true")
    List<UserRole> findActiveGrants(@Param("userId") Long userId);

    @Query("""
            select ur
              from UserRole ur
              join fetch ur.role
              left join fetch ur.assignedBy
             where ur.user.id = :userId
             order by ur.assignedAt desc
            """)
    List<UserRole> findGrantHistory(@Param("userId") Long userId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select ur from UserRole ur where ur.user.id = :userId and ur.role.id = :roleId")
    Optional<UserRole> findForUpdate(@Param("userId") Long userId, @Param("roleId") Long roleId);

    @Modifying(flushAutomatically = true)
    @Query("delete from UserRole ur where ur.role.id = :roleId")
    int deleteByRoleId(@Param("roleId") Long roleId);
}
