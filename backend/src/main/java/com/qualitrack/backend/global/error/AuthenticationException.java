package com.qualitrack.backend.global.error;

/**
 * Bad credentials, unknown login or inactive account. The detail never says which.
 */
public class AuthenticationException extends AccessProblemException {

    public static final String INVALID_CREDENTIALS = "auth.invalid_credentials";
    public static final String INVALID_SESSION = "auth.invalid_session";

    private static final String GENERIC_DETAIL = "Invalid login or password";

    public AuthenticationException() {
        super(INVALID_CREDENTIALS, GENERIC_DETAIL);
    }

    private AuthenticationException(String code, String detail) {
        super(code, detail);
    }

    /**
     * Unknown, closed or expired session token.
     */
    public static AuthenticationException invalidSession() {
        return new AuthenticationException(INVALID_SESSION, "Session is not valid");
    }
}
