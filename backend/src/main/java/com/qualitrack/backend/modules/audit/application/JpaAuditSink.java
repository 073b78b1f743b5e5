package com.qualitrack.backend.modules.audit.application;

import java.util.HashMap;

import com.qualitrack.backend.modules.audit.domain.AuditLog;
import com.qualitrack.backend.modules.audit.infrastructure.AuditLogRepository;
import com.qualitrack.backend.modules.credential.domain.AppUser;

import jakarta.persistence.EntityManager;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Writes audit events to {@code audit_log} in their own transaction, so a denial is kept even
 * when the caller's transaction rolls back.
 */
@Service
public class JpaAuditSink implements AuditSink {

    private static final Logger log = LoggerFactory.getLogger(JpaAuditSink.class);

    private static final int LOGIN_MAX_LENGTH = 50;
    private static final int TARGET_MAX_LENGTH = 128;

    private final AuditLogRepository auditLogRepository;
    private final EntityManager entityManager;
    private final TransactionTemplate transactionTemplate;

    public JpaAuditSink(
            AuditLogRepository auditLogRepository,
            EntityManager entityManager,
            PlatformTransactionManager transactionManager
    ) {
        this.auditLogRepository = auditLogRepository;
        this.entityManager = entityManager;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Override
    public void record(AuditEvent event) {
        try {
            transactionTemplate.executeWithoutResult(status -> auditLogRepository.save(toEntity(event)));
        } catch (RuntimeException ex) {
            log.warn("Failed to record audit event {} ({}) for {}: {}",
                    event.action(), event.outcome(), event.actorLogin(), ex.getMessage());
        }
    }

    private AuditLog toEntity(AuditEvent event) {
        AuditLog auditLog = new AuditLog();
        auditLog.setAction(event.action());
        auditLog.setTarget(truncate(event.target(), TARGET_MAX_LENGTH));
        auditLog.setOutcome(event.outcome());
        auditLog.setActorLogin(truncate(event.actorLogin(), LOGIN_MAX_LENGTH));
        if (event.actorUserId() != null) {
            auditLog.setActor(entityManager.getReference(AppUser.class, event.actorUserId()));
        }
        if (!event.detail().isEmpty()) {
            auditLog.setDetail(new HashMap<>(event.detail()));
        }
        auditLog.setCreatedAt(event.occurredAt());
        return auditLog;
    }

    private static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }
}
