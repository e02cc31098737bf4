package com.specsync.core.document;

import java.util.List;

/**
 * Result of validating a document.
 *
 * @param valid whether the document satisfies its type
 * @param errors validation errors, empty when valid
 */
public record ValidationOutcome(boolean valid, List<String> errors) {

    public ValidationOutcome {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static ValidationOutcome ok() {
        return new ValidationOutcome(true, List.of());
    }

    public static ValidationOutcome invalid(List<String> errors) {
        return new ValidationOutcome(false, errors);
    }

    public String errorMessage() {
        return String.join("; ", errors);
    }
}
