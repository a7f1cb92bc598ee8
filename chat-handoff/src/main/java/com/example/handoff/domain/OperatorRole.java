package com.example.handoff.domain;

public enum OperatorRole {
    SUPERADMIN,
    ADMIN,
    NONE;

    public boolean isPrivileged() {
        return this == SUPERADMIN || this == ADMIN;
    }
}
