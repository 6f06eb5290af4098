package com.mcpbuilder.core.model;

/**
 * Access level granted to a user a project is shared with. Higher levels imply lower ones.
 */
public enum Permission {
    READ,
    WRITE,
    ADMIN;

    public boolean covers(Permission required) {
        return this.ordinal() >= required.ordinal();
    }
}
