package com.pressroom.core.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import com.pressroom.core.exception.ValidationException;

import java.util.Locale;

/**
 * Lifecycle status of a {@link Content} row. Persisted and serialized as the
 * lower-case value.
 */
public enum ContentStatus {
    ACTIVE("active"),
    DRAFT("draft"),
    ARCHIVED("archived");

    private final String value;

    ContentStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Parses a persisted or wire value.
     *
     * @throws ValidationException if the value is not one of the three statuses
     */
    public static ContentStatus fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (ContentStatus status : values()) {
                if (status.value.equals(normalized)) {
                    return status;
                }
            }
        }
        throw new ValidationException("status", "must be one of active, draft, archived");
    }
}
