package com.qualitrack.backend.global.error;

public class ResourceNotFoundException extends AccessProblemException {

    public ResourceNotFoundException(String code, String detail) {
        super(code, detail);
    }
}
