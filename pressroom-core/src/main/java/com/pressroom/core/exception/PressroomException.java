package com.pressroom.core.exception;

/**
 * Base type for every error the core reports to its callers.
 */
public abstract class PressroomException extends RuntimeException {

    protected PressroomException(String message) {
        super(message);
    }

    protected PressroomException(String message, Throwable cause) {
        super(message, cause);
    }
}
