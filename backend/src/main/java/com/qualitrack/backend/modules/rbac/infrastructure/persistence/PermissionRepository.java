package com.qualitrack.backend.modules.rbac.infrastructure.persistence;

import java.util.List;
import java.util.Optional;

import com.qualitrack.backend.modules.rbac.domain.Permission;

import org.springframework.data.jpa.repository.JpaRepository;

public interface PermissionRepository extends JpaRepository<Permission, Long> {

    Optional<Permission> findByName(String name);

    boolean existsByName(String name);

    List<Permission> findAllByOrderByNameAsc();

    List<Permission> findByCategoryOrderByNameAsc(String category);
}
