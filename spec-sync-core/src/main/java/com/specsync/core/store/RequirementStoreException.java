package com.specsync.core.store;

/**
 * Thrown when a requirement cannot be read from or written to a store.
 */
public class RequirementStoreException extends RuntimeException {

    public RequirementStoreException(String message) {
        super(message);
    }

    public RequirementStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
