package com.pressroom.core.exception;

/**
 * Thrown when a filtered read names a scope that does not exist.
 */
public class InvalidScopeException extends PressroomException {

    private final String scopeName;

    public InvalidScopeException(String scopeName) {
        super("Unknown scope: " + scopeName);
        this.scopeName = scopeName;
    }

    public String getScopeName() {
        return scopeName;
    }
}
