package com.qualitrack.backend.global.error;

public class ConflictException extends AccessProblemException {

    public ConflictException(String code, String detail) {
        super(code, detail);
    }
}
