package com.qualitrack.backend.modules.audit.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.OffsetDateTime;
import java.util.Map;

import com.qualitrack.backend.modules.audit.domain.AuditLog;
import com.qualitrack.backend.modules.audit.domain.AuditOutcome;
import com.qualitrack.backend.modules.audit.infrastructure.AuditLogRepository;
import com.qualitrack.backend.modules.credential.domain.AppUser;

import jakarta.persistence.EntityManager;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;

@ExtendWith(MockitoExtension.class)
class JpaAuditSinkTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-03-01T08:00:00Z");

    @Mock
    private AuditLogRepository auditLogRepository;

    @Mock
    private EntityManager entityManager;

    @Mock
    private PlatformTransactionManager transactionManager;

    private JpaAuditSink auditSink;

    @BeforeEach
    void setUp() {
        auditSink = new JpaAuditSink(auditLogRepository, entityManager, transactionManager);
    }

    @Test
    void storesEventWithActorReference() {
        AppUser actor = new AppUser();
        when(entityManager.getReference(AppUser.class, 7L)).thenReturn(actor);

        auditSink.record(new AuditEvent(7L, "otk1", "auth.login", "otk1", AuditOutcome.SUCCESS,
                Map.of("format", "LEGACY"), NOW));

        ArgumentCaptor<AuditLog> saved = ArgumentCaptor.forClass(AuditLog.class);
        verify(auditLogRepository).save(saved.capture());
        AuditLog entry = saved.getValue();
        assertThat(entry.getActor()).isSameAs(actor);
        assertThat(entry.getActorLogin()).isEqualTo("otk1");
        assertThat(entry.getOutcome()).isEqualTo(AuditOutcome.SUCCESS);
        assertThat(entry.getDetail()).containsEntry("format", "LEGACY");
        assertThat(entry.getCreatedAt()).isEqualTo(NOW);
    }

    @Test
    void unknownActorIsStoredByLoginOnly() {
        String longLogin = "x".repeat(80);

        auditSink.record(new AuditEvent(null, longLogin, "auth.login", longLogin, AuditOutcome.FAILURE, null, NOW));

        ArgumentCaptor<AuditLog> saved = ArgumentCaptor.forClass(AuditLog.class);
        verify(auditLogRepository).save(saved.capture());
        assertThat(saved.getValue().getActor()).isNull();
        assertThat(saved.getValue().getActorLogin()).hasSize(50);
        assertThat(saved.getValue().getDetail()).isNull();
    }

    @Test
    void writeFailureDoesNotReachTheCaller() {
        when(auditLogRepository.save(any(AuditLog.class))).thenThrow(new DataIntegrityViolationException("fk"));

        assertThatCode(() -> auditSink.record(new AuditEvent(99L, "ghost", "authz.check", "admin.users",
                AuditOutcome.DENIED, Map.of(), NOW))).doesNotThrowAnyException();
    }
}
