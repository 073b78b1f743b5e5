package com.qualitrack.backend.modules.audit.application;

/**
 * Receives audit events. Implementations must not throw: a lost audit record never fails the
 * operation being audited.
 */
public interface AuditSink {

    void record(AuditEvent event);
}
