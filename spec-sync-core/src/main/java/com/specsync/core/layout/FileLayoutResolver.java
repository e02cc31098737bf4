package com.specsync.core.layout;

import com.specsync.core.model.Component;
import com.specsync.core.model.FileKind;
import com.specsync.core.model.ProjectInfo;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Computes where a component's artifacts are expected to live.
 */
public interface FileLayoutResolver {

    /**
     * Returns the expected path of one artifact.
     *
     * @param component component
     * @param project owning project
     * @param kind artifact kind
     * @return relative path, or empty when the component has no artifact of that kind
     */
    Optional<String> pathFor(Component component, ProjectInfo project, FileKind kind);

    /**
     * Returns the expected path of every artifact kind the component has.
     *
     * @param component component
     * @param project owning project
     * @return path per file kind
     */
    default Map<FileKind, String> expectedFiles(Component component, ProjectInfo project) {
        Map<FileKind, String> files = new EnumMap<>(FileKind.class);
        for (FileKind kind : FileKind.values()) {
            pathFor(component, project, kind).ifPresent(path -> files.put(kind, path));
        }
        return files;
    }
}
