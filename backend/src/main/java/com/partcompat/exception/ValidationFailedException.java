package com.partcompat.exception;

/**
 * Input rejected by validation. Never retried.
 */
public class ValidationFailedException extends RuntimeException {

    private final ValidationError error;

    public ValidationFailedException(ValidationError error) {
        this(error, error.getDefaultMessage());
    }

    public ValidationFailedException(ValidationError error, String message) {
        super(message);
        this.error = error;
    }

    public ValidationError getError() {
        return error;
    }
}
