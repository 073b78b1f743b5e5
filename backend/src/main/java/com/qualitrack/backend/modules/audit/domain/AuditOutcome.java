package com.qualitrack.backend.modules.audit.domain;

public enum AuditOutcome {
    SUCCESS,
    FAILURE,
    ALLOWED,
    DENIED
}
