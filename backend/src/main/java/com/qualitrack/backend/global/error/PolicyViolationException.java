package com.qualitrack.backend.global.error;

public class PolicyViolationException extends AccessProblemException {

    public PolicyViolationException(String code, String detail) {
        super(code, detail);
    }
}
