package com.specsync.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Category of artifact a requirement is about.
 */
public enum ArtifactType {
    SPECIFICATION,
    REVIEW,
    CODE,
    TESTS,
    DEPENDENCIES,
    HIERARCHY;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a category tag such as {@code "tests"}.
     *
     * @param tag category tag
     * @return the category, or empty when the tag is not one of the six categories
     */
    public static Optional<ArtifactType> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        String normalized = tag.trim().toUpperCase(Locale.ROOT);
        for (ArtifactType type : values()) {
            if (type.name().equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
