package com.qualitrack.backend.modules.authorization.domain;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Effective roles and permissions of a user at {@code resolvedAt}.
 * {@code nextExpiry} is the earliest expiry among the contributing grants, null when none expires.
 */
public record ResolvedAccess(
        Set<String> roles,
        Set<String> permissions,
        OffsetDateTime resolvedAt,
        OffsetDateTime nextExpiry
) {

    public ResolvedAccess {
        roles = Collections.unmodifiableSet(new TreeSet<>(roles));
        permissions = Collections.unmodifiableSet(new TreeSet<>(permissions));
    }

    public static ResolvedAccess none(OffsetDateTime resolvedAt) {
        return new ResolvedAccess(Set.of(), Set.of(), resolvedAt, null);
    }
}
