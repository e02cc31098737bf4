package com.specsync.core.checker;

import com.specsync.core.model.ArtifactType;
import com.specsync.core.model.CheckerKind;
import com.specsync.core.model.Component;
import com.specsync.core.model.FileKind;
import com.specsync.core.registry.RequirementDefinition;

import java.util.Map;
import java.util.Optional;

/**
 * Checks that a component's expected artifact file exists.
 *
 * <p>The file kind follows the definition's artifact type unless the {@code file_kind}
 * config entry names another kind.
 */
public class FileExistenceChecker implements RequirementChecker {

    @Override
    public CheckerKind kind() {
        return CheckerKind.FILE_EXISTENCE;
    }

    @Override
    public CheckResult check(CheckContext context, RequirementDefinition definition, Component component,
                             Map<String, Object> options) {
        Optional<FileKind> fileKind = fileKindFor(definition);
        if (fileKind.isEmpty()) {
            return CheckResult.failed("No file kind for artifact type " + definition.artifactType().tag());
        }

        Optional<String> path = context.layout().pathFor(component, context.project(), fileKind.get());
        if (path.isEmpty()) {
            return CheckResult.failed("No " + fileKind.get().tag() + " file expected for "
                + component.type().tag() + " components");
        }

        if (context.environment().fileExists(path.get())) {
            return CheckResult.ok(Map.of("status", "File exists", "path", path.get()));
        }
        return CheckResult.failed(Map.of("reason", "File missing", "path", path.get()));
    }

    static Optional<FileKind> fileKindFor(RequirementDefinition definition) {
        Optional<String> configured = definition.configString(RequirementDefinition.FILE_KIND);
        if (configured.isPresent()) {
            return FileKind.fromTag(configured.get());
        }
        return fileKindFor(definition.artifactType());
    }

    static Optional<FileKind> fileKindFor(ArtifactType artifactType) {
        return switch (artifactType) {
            case SPECIFICATION -> Optional.of(FileKind.SPEC);
            case CODE -> Optional.of(FileKind.CODE);
            case TESTS -> Optional.of(FileKind.TEST);
            case REVIEW -> Optional.of(FileKind.REVIEW);
            case DEPENDENCIES, HIERARCHY -> Optional.empty();
        };
    }
}
