package com.qualitrack.backend.modules.rbac.application;

/**
 * Invalidation hook called by every mutation that can change somebody's effective permissions.
 */
public interface AccessChangeListener {

    void grantsChanged(Long userId);

    /**
     * A role's permission set changed, or a role or permission disappeared.
     */
    void rolesChanged();
}
