package com.qualitrack.backend.modules.rbac.infrastructure.persistence;

import java.util.List;
import java.util.Optional;

import com.qualitrack.backend.modules.rbac.domain.Role;

import org.springframework.data.jpa.repository.JpaRepository;

public interface RoleRepository extends JpaRepository<Role, Long> {

    Optional<Role> findByName(String name);

    boolean existsByName(String name);

    List<Role> findAllByOrderByNameAsc();
}
