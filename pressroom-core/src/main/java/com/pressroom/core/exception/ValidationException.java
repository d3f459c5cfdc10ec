package com.pressroom.core.exception;

/**
 * Thrown when an attribute fails its schema constraints.
 * Always raised before anything is persisted.
 */
public class ValidationException extends PressroomException {

    private final String field;
    private final String reason;

    public ValidationException(String field, String reason) {
        super(field + ": " + reason);
        this.field = field;
        this.reason = reason;
    }

    public String getField() { return field; }
    public String getReason() { return reason; }
}
