package com.specsync.core.checker;

import com.specsync.core.document.DocumentValidator;
import com.specsync.core.environment.Environment;
import com.specsync.core.graph.ComponentGraph;
import com.specsync.core.layout.FileLayoutResolver;
import com.specsync.core.model.ProjectInfo;
import com.specsync.core.model.Scope;

import java.util.Objects;

/**
 * Collaborators a checker may consult.
 *
 * <p>The graph is the snapshot relational checkers read; local checkers ignore it.
 *
 * @param scope tenant and project
 * @param project project identity
 * @param layout expected file paths
 * @param environment project files
 * @param documentValidator document structure validation
 * @param graph component graph snapshot
 */
public record CheckContext(
    Scope scope,
    ProjectInfo project,
    FileLayoutResolver layout,
    Environment environment,
    DocumentValidator documentValidator,
    ComponentGraph graph
) {

    public CheckContext {
        Objects.requireNonNull(scope, "scope must not be null");
        Objects.requireNonNull(project, "project must not be null");
        Objects.requireNonNull(layout, "layout must not be null");
        Objects.requireNonNull(environment, "environment must not be null");
        Objects.requireNonNull(documentValidator, "documentValidator must not be null");
        Objects.requireNonNull(graph, "graph must not be null");
    }

    public CheckContext withGraph(ComponentGraph newGraph) {
        return new CheckContext(scope, project, layout, environment, documentValidator, newGraph);
    }
}
