package com.pressroom.core.exception;

/**
 * Entity types that can be reported as missing.
 */
public enum EntityKind {
    ACCOUNT("Account"),
    PROFILE("Profile"),
    CONTENT("Content"),
    TAG("Tag");

    private final String displayName;

    EntityKind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
