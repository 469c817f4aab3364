package com.partcompat.exception;

/**
 * The target exists in another organization, or does not exist at all.
 * Both cases are reported the same way.
 */
public class TenantAccessDeniedException extends RuntimeException {

    public TenantAccessDeniedException(String message) {
        super(message);
    }
}
