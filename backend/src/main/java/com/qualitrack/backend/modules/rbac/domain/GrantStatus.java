package com.qualitrack.backend.modules.rbac.domain;

/**
 * Read-time classification of a grant. Only REVOKED is stored; EXPIRED is derived from the clock.
 */
public enum GrantStatus {
    ACTIVE,
    REVOKED,
    EXPIRED
}
