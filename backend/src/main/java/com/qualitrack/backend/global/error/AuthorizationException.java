package com.qualitrack.backend.global.error;

import java.util.Collection;
import java.util.List;

/**
 * Raised by a guard when the identity lacks what the operation requires.
 */
public class AuthorizationException extends AccessProblemException {

    public static final String DENIED = "authz.denied";

    private final List<String> required;

    public AuthorizationException(Collection<String> required) {
        super(DENIED, "Missing required permission(s): " + String.join(", ", required));
        this.required = List.copyOf(required);
    }

    public static AuthorizationException missingRole(String roleName) {
        return new AuthorizationException(List.of("role:" + roleName));
    }

    public List<String> getRequired() {
        return required;
    }
}
