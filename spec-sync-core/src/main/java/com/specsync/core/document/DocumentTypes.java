package com.specsync.core.document;

import com.specsync.core.model.ComponentType;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Built-in document types.
 */
public final class DocumentTypes {

    public static final String SPEC = "spec";
    public static final String SCHEMA = "schema";
    public static final String CONTEXT_SPEC = "context_spec";
    public static final String DESIGN_REVIEW = "design_review";
    public static final String DYNAMIC = "dynamic_document";

    private static final Map<String, DocumentType> BUILT_IN = new LinkedHashMap<>();

    static {
        register(new DocumentType(SPEC,
            List.of(List.of("delegates", "functions"), List.of("dependencies")),
            List.of("fields"), false));
        register(new DocumentType(SCHEMA,
            List.of(List.of("fields")),
            List.of("functions", "dependencies"), false));
        register(new DocumentType(CONTEXT_SPEC,
            List.of(List.of("delegates", "functions"), List.of("dependencies"), List.of("components")),
            List.of("fields"), false));
        register(new DocumentType(DESIGN_REVIEW,
            List.of(List.of("overview"), List.of("architecture"), List.of("integration"), List.of("conclusion")),
            List.of("stories", "issues"), false));
        register(new DocumentType(DYNAMIC, List.of(), List.of(), true));
    }

    private DocumentTypes() {
        // Utility class
    }

    public static Optional<DocumentType> find(String name) {
        return Optional.ofNullable(BUILT_IN.get(name));
    }

    public static List<DocumentType> all() {
        return List.copyOf(BUILT_IN.values());
    }

    /**
     * Returns the document type a component's specification is validated against by default.
     *
     * @param type component type
     * @return document type name
     */
    public static String forComponentType(ComponentType type) {
        if (type.isContext()) {
            return CONTEXT_SPEC;
        }
        return type == ComponentType.SCHEMA ? SCHEMA : SPEC;
    }

    private static void register(DocumentType type) {
        BUILT_IN.put(type.name(), type);
    }
}
