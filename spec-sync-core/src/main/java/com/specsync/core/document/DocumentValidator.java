package com.specsync.core.document;

/**
 * Validates document content against a named document type.
 */
public interface DocumentValidator {

    /**
     * Validates content.
     *
     * @param content document text
     * @param documentType document type name
     * @return validation outcome; an unknown document type is reported as invalid
     */
    ValidationOutcome validate(String content, String documentType);
}
