package com.qualitrack.backend.modules.audit.infrastructure;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.qualitrack.backend.modules.audit.domain.AuditLog;

public interface AuditLogRepository extends JpaRepository<AuditLog, Long> {

    @Query("""
            select a from AuditLog a
            where a.action = :action
            order by a.createdAt desc, a.id desc
            """)
    List<AuditLog> findByActionNewestFirst(@Param("action") String action);

    List<AuditLog> findByActorLoginIgnoreCaseOrderByIdDesc(String actorLogin);
}
