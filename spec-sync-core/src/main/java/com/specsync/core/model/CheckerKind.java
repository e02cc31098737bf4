package com.specsync.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of checker references a requirement definition may name.
 *
 * <p>Relational kinds read other components' requirement results and therefore run
 * in the second pass of a sync, after every local requirement is in place.
 */
public enum CheckerKind {
    FILE_EXISTENCE("file_existence", "FileExistenceChecker", false),
    DOCUMENT_VALIDITY("document_validity", "DocumentValidityChecker", false),
    TEST_STATUS("test_status", "TestStatusChecker", false),
    DEPENDENCY("dependency", "DependencyChecker", true),
    HIERARCHICAL("hierarchical", "HierarchicalChecker", true);

    private final String reference;
    private final String className;
    private final boolean relational;

    CheckerKind(String reference, String className, boolean relational) {
        this.reference = reference;
        this.className = className;
        this.relational = relational;
    }

    public String reference() {
        return reference;
    }

    public boolean isRelational() {
        return relational;
    }

    /**
     * Resolves a checker reference.
     *
     * <p>Accepts the snake-case reference ({@code "file_existence"}), the enum constant
     * name, or the checker class name, optionally namespace-qualified
     * ({@code "Requirements.FileExistenceChecker"}).
     *
     * @param reference checker reference
     * @return the checker kind, or empty when the reference does not resolve
     */
    public static Optional<CheckerKind> fromReference(String reference) {
        if (reference == null || reference.isBlank()) {
            return Optional.empty();
        }
        String trimmed = reference.trim();
        int lastDot = trimmed.lastIndexOf('.');
        String simple = lastDot >= 0 ? trimmed.substring(lastDot + 1) : trimmed;
        for (CheckerKind kind : values()) {
            if (kind.reference.equalsIgnoreCase(simple)
                || kind.name().equals(simple.toUpperCase(Locale.ROOT))
                || kind.className.equals(simple)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
