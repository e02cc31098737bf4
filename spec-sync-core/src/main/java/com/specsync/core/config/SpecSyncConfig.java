package com.specsync.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.specsync.core.layout.LayoutPatterns;
import com.specsync.core.model.ProjectInfo;
import com.specsync.core.model.Scope;
import com.specsync.core.sync.PropagationMode;
import com.specsync.core.sync.SyncOptions;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Root configuration for SpecSync projects.
 *
 * <p>Loaded from {@code specsync.yaml} in the project root. Every section is optional;
 * missing sections take the values of {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * project:
 *   name: "Shop"
 *   moduleName: "Shop"
 *   tenant: "acme"
 *
 * layout:
 *   spec: "docs/spec/{path}.spec.md"
 *   code: "lib/{path}.ex"
 *
 * sync:
 *   persist: true
 *   propagation: transitive
 *
 * paths:
 *   manifest: "architecture.yaml"
 *   store: ".specsync/requirements.json"
 *   testResults: ".specsync/test-results.json"
 *
 * requirements:
 *   definitions:
 *     - name: design_doc
 *       checker: file_existence
 *       artifactType: specification
 *       description: "Design document exists"
 *       config:
 *         file_kind: design
 *   types:
 *     schema: [spec_file, design_doc, implementation_file]
 * }</pre>
 *
 * @param project project metadata
 * @param layout artifact path templates
 * @param sync sync defaults
 * @param paths input and output file locations
 * @param requirements catalogue extensions
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SpecSyncConfig(
    @JsonProperty("project") ProjectSettings project,
    @JsonProperty("layout") LayoutPatterns layout,
    @JsonProperty("sync") SyncSettings sync,
    @JsonProperty("paths") PathSettings paths,
    @JsonProperty("requirements") CatalogueSettings requirements
) {

    public SpecSyncConfig {
        project = project == null ? ProjectSettings.defaults() : project;
        layout = layout == null ? LayoutPatterns.defaults() : layout;
        sync = sync == null ? SyncSettings.defaults() : sync;
        paths = paths == null ? PathSettings.defaults() : paths;
        requirements = requirements == null ? CatalogueSettings.empty() : requirements;
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static SpecSyncConfig defaults() {
        return new SpecSyncConfig(null, null, null, null, null);
    }

    /**
     * Project metadata.
     *
     * @param name project name
     * @param moduleName root module namespace, defaults to the name
     * @param tenant tenant id used to scope stored requirements
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProjectSettings(
        @JsonProperty("name") String name,
        @JsonProperty("moduleName") String moduleName,
        @JsonProperty("tenant") String tenant
    ) {
        public ProjectSettings {
            name = name == null || name.isBlank() ? "project" : name;
            tenant = tenant == null || tenant.isBlank() ? "local" : tenant;
        }

        public static ProjectSettings defaults() {
            return new ProjectSettings(null, null, null);
        }

        public ProjectInfo toProjectInfo() {
            return new ProjectInfo(name, moduleName);
        }

        public Scope toScope() {
            return new Scope(tenant, name);
        }
    }

    /**
     * Defaults for sync passes.
     *
     * @param force recompute everything on every run
     * @param persist write results to the store
     * @param propagation affected-set propagation, {@code transitive} or {@code single_pass}
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SyncSettings(
        @JsonProperty("force") Boolean force,
        @JsonProperty("persist") Boolean persist,
        @JsonProperty("propagation") String propagation
    ) {
        public SyncSettings {
            force = force == null ? Boolean.FALSE : force;
            persist = persist == null ? Boolean.TRUE : persist;
            propagation = propagation == null ? "transitive" : propagation;
        }

        public static SyncSettings defaults() {
            return new SyncSettings(null, null, null);
        }

        /**
         * Resolves the propagation mode, case-insensitively.
         *
         * @return mode
         * @throws IllegalArgumentException for an unknown mode
         */
        public PropagationMode propagationMode() {
            return PropagationMode.valueOf(propagation.trim().toUpperCase(Locale.ROOT));
        }

        public SyncOptions toOptions() {
            return new SyncOptions(force, persist, propagationMode());
        }
    }

    /**
     * Input and output locations, relative to the project root.
     *
     * @param manifest architecture manifest
     * @param store requirement store file
     * @param testResults test results file
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PathSettings(
        @JsonProperty("manifest") String manifest,
        @JsonProperty("store") String store,
        @JsonProperty("testResults") String testResults
    ) {
        public PathSettings {
            manifest = manifest == null ? "architecture.yaml" : manifest;
            store = store == null ? ".specsync/requirements.json" : store;
            testResults = testResults == null ? ".specsync/test-results.json" : testResults;
        }

        public static PathSettings defaults() {
            return new PathSettings(null, null, null);
        }
    }

    /**
     * Requirement catalogue extensions.
     *
     * @param definitions custom requirement definitions
     * @param types per type catalogues, listing requirement names in order
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CatalogueSettings(
        @JsonProperty("definitions") List<DefinitionSettings> definitions,
        @JsonProperty("types") Map<String, List<String>> types
    ) {
        public CatalogueSettings {
            definitions = definitions == null ? List.of() : definitions;
            types = types == null ? Map.of() : types;
        }

        public static CatalogueSettings empty() {
            return new CatalogueSettings(null, null);
        }
    }

    /**
     * A custom requirement definition as written in YAML.
     *
     * @param name requirement name
     * @param checker checker reference
     * @param artifactType artifact category tag
     * @param description description
     * @param threshold satisfaction threshold, null for 1.0
     * @param config checker configuration
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DefinitionSettings(
        @JsonProperty("name") String name,
        @JsonProperty("checker") String checker,
        @JsonProperty("artifactType") String artifactType,
        @JsonProperty("description") String description,
        @JsonProperty("threshold") Double threshold,
        @JsonProperty("config") Map<String, Object> config
    ) {}
}
