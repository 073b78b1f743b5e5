package com.qualitrack.backend.modules.credential.domain;

public enum AppUserStatus {
    ACTIVE,
    INACTIVE
}
