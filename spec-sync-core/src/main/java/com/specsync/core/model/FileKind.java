package com.specsync.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Kinds of files the layout resolver can compute for a component.
 */
public enum FileKind {
    SPEC,
    CODE,
    TEST,
    REVIEW,
    DESIGN;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<FileKind> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(tag.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
