package com.specsync.core.sync;

import com.specsync.core.model.Component;
import com.specsync.core.model.Dependency;
import com.specsync.core.model.ProjectInfo;
import com.specsync.core.model.Scope;
import com.specsync.core.model.TestRun;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Input to {@link RequirementSyncEngine#sync(SyncRequest)}.
 *
 * @param scope tenant and project
 * @param project project identity
 * @param components every component of the project, with previously synced requirements if known
 * @param dependencies dependency edges between the components
 * @param changedIds ids of components whose inputs changed since the last sync
 * @param files flat listing of the project's files, or null to ask the environment
 * @param testRun latest test run
 * @param options pass options
 */
public record SyncRequest(
    Scope scope,
    ProjectInfo project,
    List<Component> components,
    List<Dependency> dependencies,
    Set<String> changedIds,
    Set<String> files,
    TestRun testRun,
    SyncOptions options
) {

    public SyncRequest {
        Objects.requireNonNull(scope, "scope must not be null");
        Objects.requireNonNull(project, "project must not be null");
        components = components == null ? List.of() : List.copyOf(components);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        changedIds = changedIds == null ? Set.of() : Set.copyOf(changedIds);
        files = files == null ? null : Set.copyOf(files);
        testRun = testRun == null ? TestRun.none() : testRun;
        options = options == null ? SyncOptions.defaults() : options;
    }
}
