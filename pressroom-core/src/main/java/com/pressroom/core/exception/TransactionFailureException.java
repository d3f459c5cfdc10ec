package com.pressroom.core.exception;

/**
 * Storage-level failure inside a composite write. The unit of work has already
 * been rolled back when this is thrown; the cause is the original error.
 */
public class TransactionFailureException extends PressroomException {

    public TransactionFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
