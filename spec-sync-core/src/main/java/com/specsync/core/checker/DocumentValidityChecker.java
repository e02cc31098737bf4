package com.specsync.core.checker;

import com.specsync.core.document.DocumentTypes;
import com.specsync.core.document.ValidationOutcome;
import com.specsync.core.model.CheckerKind;
import com.specsync.core.model.Component;
import com.specsync.core.model.FileKind;
import com.specsync.core.registry.RequirementDefinition;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;

/**
 * Checks that a component's specification file is structurally valid for its document type.
 *
 * <p>The document type comes from the {@code document_type} config entry, falling back to
 * the default type for the component's type.
 */
public class DocumentValidityChecker implements RequirementChecker {

    @Override
    public CheckerKind kind() {
        return CheckerKind.DOCUMENT_VALIDITY;
    }

    @Override
    public CheckResult check(CheckContext context, RequirementDefinition definition, Component component,
                             Map<String, Object> options) {
        String documentType = definition.configString(RequirementDefinition.DOCUMENT_TYPE)
            .orElseGet(() -> DocumentTypes.forComponentType(component.type()));

        Optional<String> specPath = context.layout().pathFor(component, context.project(), FileKind.SPEC);
        if (specPath.isEmpty()) {
            return CheckResult.failed("No spec file expected for " + component.type().tag() + " components");
        }

        String content;
        try {
            content = context.environment().readFile(specPath.get());
        } catch (IOException e) {
            return CheckResult.failed(Map.of(
                "reason", "Failed to read spec file: " + e.getMessage(),
                "path", specPath.get()));
        }

        ValidationOutcome outcome = context.documentValidator().validate(content, documentType);
        if (outcome.valid()) {
            return CheckResult.ok(Map.of("status", "Document is valid", "document_type", documentType));
        }
        return CheckResult.failed(Map.of(
            "reason", "Document validation failed",
            "error", outcome.errorMessage(),
            "document_type", documentType));
    }
}
