package com.specsync.core.model;

import java.util.Locale;

/**
 * Closed vocabulary of component types.
 *
 * <p>The type selects which requirement catalogue applies to a component and which
 * document type its specification is validated against. Tags outside the vocabulary
 * map to {@link #UNKNOWN}, which uses the default catalogue.
 */
public enum ComponentType {
    CONTEXT("context"),
    COORDINATION_CONTEXT("coordination_context"),
    SCHEMA("schema"),
    MODULE("module"),
    CONTROLLER("controller"),
    LIVEVIEW("liveview"),
    CLI("cli"),
    WORKER("worker"),
    COORDINATOR("coordinator"),
    REPOSITORY("repository"),
    GENSERVER("genserver"),
    TASK("task"),
    REGISTRY("registry"),
    BEHAVIOUR("behaviour"),
    OTHER("other"),
    UNKNOWN("unknown");

    private final String tag;

    ComponentType(String tag) {
        this.tag = tag;
    }

    /**
     * Returns the lowercase tag used in manifests and configuration.
     *
     * @return type tag
     */
    public String tag() {
        return tag;
    }

    /**
     * Returns true for the context-like types that own child components.
     *
     * @return true for {@link #CONTEXT} and {@link #COORDINATION_CONTEXT}
     */
    public boolean isContext() {
        return this == CONTEXT || this == COORDINATION_CONTEXT;
    }

    /**
     * Resolves a type tag, case-insensitively.
     *
     * @param tag type tag, may be null
     * @return matching type, or {@link #UNKNOWN}
     */
    public static ComponentType fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            return UNKNOWN;
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        for (ComponentType type : values()) {
            if (type.tag.equals(normalized)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
