package com.gantry.core.security;

public class UnknownRoleException extends RuntimeException {

    private final String role;

    public UnknownRoleException(String role) {
        super("Unknown role: " + role);
        this.role = role;
    }

    public String getRole() {
        return role;
    }
}
