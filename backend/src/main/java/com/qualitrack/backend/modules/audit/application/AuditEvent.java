package com.qualitrack.backend.modules.audit.application;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Objects;

import com.qualitrack.backend.modules.audit.domain.AuditOutcome;

/**
 * One security-relevant event. {@code actorUserId} is null when the actor could not be
 * identified, e.g. a login attempt for an unknown account.
 */
public record AuditEvent(
        Long actorUserId,
        String actorLogin,
        String action,
        String target,
        AuditOutcome outcome,
        Map<String, Object> detail,
        OffsetDateTime occurredAt
) {

    public AuditEvent {
        Objects.requireNonNull(action, "action is required");
        Objects.requireNonNull(outcome, "outcome is required");
        Objects.requireNonNull(occurredAt, "occurredAt is required");
        detail = detail == null ? Map.of() : Map.copyOf(detail);
    }
}
