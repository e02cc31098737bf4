package com.specsync.cli;

import com.specsync.core.checker.CheckerDispatcher;
import com.specsync.core.config.CatalogueConfigurer;
import com.specsync.core.config.ConfigLoader;
import com.specsync.core.config.SpecSyncConfig;
import com.specsync.core.document.MarkdownSectionValidator;
import com.specsync.core.environment.LocalEnvironment;
import com.specsync.core.layout.ConventionalFileLayout;
import com.specsync.core.layout.FileLayoutResolver;
import com.specsync.core.manifest.Architecture;
import com.specsync.core.manifest.ComponentDiscovery;
import com.specsync.core.manifest.ComponentManifestLoader;
import com.specsync.core.manifest.ManifestException;
import com.specsync.core.model.Component;
import com.specsync.core.model.ProjectInfo;
import com.specsync.core.model.Scope;
import com.specsync.core.registry.RequirementRegistry;
import com.specsync.core.store.JsonFileRequirementStore;
import com.specsync.core.store.RequirementStore;
import com.specsync.core.sync.RequirementSyncEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

/**
 * Everything a command needs about one project directory: configuration, components,
 * catalogue, store and engine.
 */
final class ProjectWorkspace {

    private static final Logger log = LoggerFactory.getLogger(ProjectWorkspace.class);

    private final Path root;
    private final SpecSyncConfig config;
    private final Architecture architecture;
    private final RequirementRegistry registry;
    private final FileLayoutResolver layout;
    private final LocalEnvironment environment;

    private ProjectWorkspace(Path root, SpecSyncConfig config, Architecture architecture,
                             RequirementRegistry registry) {
        this.root = root;
        this.config = config;
        this.architecture = architecture;
        this.registry = registry;
        this.layout = new ConventionalFileLayout(config.layout());
        this.environment = new LocalEnvironment(root);
    }

    /**
     * Opens a project directory.
     *
     * @param root project root
     * @param configFile configuration file, null for {@code specsync.yaml} in the root
     * @param manifestFile manifest file, null for the configured location
     * @return workspace
     * @throws ManifestException if the manifest exists but is invalid
     * @throws IOException if component discovery fails
     */
    static ProjectWorkspace open(Path root, Path configFile, Path manifestFile) throws ManifestException, IOException {
        Path projectRoot = root.toAbsolutePath().normalize();
        SpecSyncConfig config = ConfigLoader.load(configFile != null
            ? configFile
            : projectRoot.resolve(ConfigLoader.DEFAULT_FILE_NAME));
        RequirementRegistry registry = CatalogueConfigurer.apply(RequirementRegistry.builtIn(), config.requirements());

        Path manifest = manifestFile != null ? manifestFile : projectRoot.resolve(config.paths().manifest());
        Architecture architecture;
        if (Files.exists(manifest)) {
            architecture = ComponentManifestLoader.load(manifest);
        } else {
            log.info("No architecture manifest at {}, discovering components from project files", manifest);
            architecture = new ComponentDiscovery(config.layout()).discover(new LocalEnvironment(projectRoot));
        }
        return new ProjectWorkspace(projectRoot, config, architecture, registry);
    }

    Path root() {
        return root;
    }

    SpecSyncConfig config() {
        return config;
    }

    Architecture architecture() {
        return architecture;
    }

    List<Component> components() {
        return architecture.components();
    }

    RequirementRegistry registry() {
        return registry;
    }

    FileLayoutResolver layout() {
        return layout;
    }

    LocalEnvironment environment() {
        return environment;
    }

    /**
     * Project identity; the manifest wins over the configuration.
     *
     * @return project info
     */
    ProjectInfo project() {
        return architecture.project() != null ? architecture.project() : config.project().toProjectInfo();
    }

    Scope scope() {
        return new Scope(config.project().tenant(), project().name());
    }

    Path resolve(String relativePath) {
        return root.resolve(relativePath);
    }

    RequirementStore openStore() {
        return new JsonFileRequirementStore(resolve(config.paths().store()));
    }

    RequirementSyncEngine engine(RequirementStore store) {
        return new RequirementSyncEngine(registry, CheckerDispatcher.withDefaultCheckers(), layout,
            environment, new MarkdownSectionValidator(), store, Clock.systemUTC());
    }
}
