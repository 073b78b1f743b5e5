package com.qualitrack.backend.modules.authorization.domain;

import java.time.OffsetDateTime;

/**
 * Result of a session login: the identity plus the bearer token the caller presents later.
 */
public record AuthenticatedSession(
        Identity identity,
        Long sessionId,
        String token,
        boolean rememberMe,
        OffsetDateTime expiresAt
) {
}
