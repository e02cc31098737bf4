package com.specsync.core.registry;

/**
 * Thrown when a requirement definition or catalogue is invalid.
 *
 * <p>Raised at construction time so that a broken catalogue never reaches a sync pass.
 */
public class RequirementDefinitionException extends RuntimeException {

    public RequirementDefinitionException(String message) {
        super(message);
    }

    public RequirementDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
