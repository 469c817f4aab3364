package com.partcompat.exception;

/**
 * Backend storage failure. Any open transaction has been rolled back.
 */
public class TransientStoreException extends RuntimeException {

    public TransientStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
