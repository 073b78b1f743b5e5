package com.qualitrack.backend.global.error;

/**
 * Base type of every error raised by the access core.
 * Carries a stable dotted code, an operator-facing detail and a problem type URN.
 */
public class AccessProblemException extends RuntimeException {

    private static final String DEFAULT_TYPE_PREFIX = "urn:problem:qualitrack:";

    private final String code;
    private final String detail;
    private final String type;

    public AccessProblemException(String code) {
        this(code, null, null);
    }

    public AccessProblemException(String code, String detail) {
        this(code, detail, null);
    }

    public AccessProblemException(String code, String detail, Throwable cause) {
        super(code, cause);
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("AccessProblemException code must not be blank");
        }
        this.code = code;
        this.detail = (detail != null && !detail.isBlank()) ? detail : code;
        String normalized = code.toLowerCase().replaceAll("[^a-z0-9\\-_.:]+", "-");
        this.type = DEFAULT_TYPE_PREFIX + normalized;
    }

    public String getCode() {
        return code;
    }

    public String getDetailMessage() {
        return detail;
    }

    public String getProblemType() {
        return type;
    }

    @Override
    public String getMessage() {
        return code + ": " + detail;
    }
}
