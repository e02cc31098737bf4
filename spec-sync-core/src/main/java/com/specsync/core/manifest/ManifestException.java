package com.specsync.core.manifest;

/**
 * Thrown when an architecture manifest cannot be read or is inconsistent.
 */
public class ManifestException extends Exception {

    public ManifestException(String message) {
        super(message);
    }

    public ManifestException(String message, Throwable cause) {
        super(message, cause);
    }
}
