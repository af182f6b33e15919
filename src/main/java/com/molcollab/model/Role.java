package com.molcollab.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Participant role within a room. Creators become {@link #OWNER}, everyone else
 * joins as {@link #VIEWER}; elevation is decided outside the collaboration core.
 */
public enum Role {
    OWNER("owner"),
    EDITOR("editor"),
    VIEWER("viewer"),
    AUDITOR("auditor");

    private final String wireName;

    Role(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public static Role fromWireName(String name) {
        for (Role role : values()) {
            if (role.wireName.equals(name)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown role: " + name);
    }
}
