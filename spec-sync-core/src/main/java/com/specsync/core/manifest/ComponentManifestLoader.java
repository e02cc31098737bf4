package com.specsync.core.manifest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.specsync.core.model.Component;
import com.specsync.core.model.ComponentType;
import com.specsync.core.model.Dependency;
import com.specsync.core.model.ProjectInfo;
import com.specsync.core.util.IdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads an {@link ArchitectureManifest} from YAML and turns it into an {@link Architecture}.
 *
 * <p>Ids missing from the manifest are derived from the module name, so they stay stable
 * across runs. Types default by namespace depth and parents default to the nearest
 * namespace ancestor present in the manifest.
 */
public final class ComponentManifestLoader {

    private static final Logger log = LoggerFactory.getLogger(ComponentManifestLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ComponentManifestLoader() {
        // Utility class
    }

    /**
     * Reads a manifest file.
     *
     * @param manifestPath path to the YAML manifest
     * @return architecture
     * @throws ManifestException if the file is missing, unparseable or inconsistent
     */
    public static Architecture load(Path manifestPath) throws ManifestException {
        if (!Files.isRegularFile(manifestPath)) {
            throw new ManifestException("Architecture manifest not found: " + manifestPath);
        }
        ArchitectureManifest manifest;
        try {
            manifest = YAML_MAPPER.readValue(manifestPath.toFile(), ArchitectureManifest.class);
        } catch (IOException e) {
            throw new ManifestException("Failed to parse architecture manifest " + manifestPath + ": " + e.getMessage(), e);
        }
        if (manifest == null) {
            throw new ManifestException("Architecture manifest is empty: " + manifestPath);
        }
        Architecture architecture = fromManifest(manifest);
        log.info("Loaded {} components and {} dependencies from {}",
            architecture.components().size(), architecture.dependencies().size(), manifestPath);
        return architecture;
    }

    /**
     * Converts a parsed manifest.
     *
     * @param manifest parsed manifest
     * @return architecture
     * @throws ManifestException on duplicate module names or unknown references
     */
    public static Architecture fromManifest(ArchitectureManifest manifest) throws ManifestException {
        Map<String, ArchitectureManifest.ComponentEntry> entries = new LinkedHashMap<>();
        for (ArchitectureManifest.ComponentEntry entry : manifest.components()) {
            if (entry.moduleName() == null || entry.moduleName().isBlank()) {
                throw new ManifestException("Component entry without moduleName");
            }
            if (entries.put(entry.moduleName(), entry) != null) {
                throw new ManifestException("Duplicate component: " + entry.moduleName());
            }
        }

        Map<String, String> idsByModule = new LinkedHashMap<>();
        entries.values().forEach(entry -> idsByModule.put(entry.moduleName(),
            entry.id() == null || entry.id().isBlank() ? IdGenerator.generate(entry.moduleName()) : entry.id()));
        if (new LinkedHashSet<>(idsByModule.values()).size() != idsByModule.size()) {
            throw new ManifestException("Component ids must be unique");
        }

        List<Component> components = new ArrayList<>();
        for (ArchitectureManifest.ComponentEntry entry : entries.values()) {
            String parentId = null;
            if (entry.parent() != null) {
                parentId = idsByModule.get(entry.parent());
                if (parentId == null) {
                    throw new ManifestException("Unknown parent " + entry.parent() + " for " + entry.moduleName());
                }
            }
            ComponentType type = entry.type() == null
                ? NamespaceHierarchy.typeFromNamespace(entry.moduleName())
                : ComponentType.fromTag(entry.type());
            if (type == ComponentType.UNKNOWN) {
                log.warn("Unknown component type '{}' for {}, using default requirements", entry.type(), entry.moduleName());
            }
            components.add(new Component(idsByModule.get(entry.moduleName()), entry.name(), entry.moduleName(),
                type, parentId, entry.description(), null, List.of()));
        }

        Set<Dependency> dependencies = new LinkedHashSet<>();
        for (ArchitectureManifest.ComponentEntry entry : entries.values()) {
            for (String target : entry.dependsOn()) {
                String targetId = idsByModule.get(target);
                if (targetId == null) {
                    throw new ManifestException("Unknown dependency " + target + " of " + entry.moduleName());
                }
                if (target.equals(entry.moduleName())) {
                    throw new ManifestException("Component depends on itself: " + target);
                }
                dependencies.add(new Dependency(idsByModule.get(entry.moduleName()), targetId));
            }
        }

        ProjectInfo project = manifest.project() == null || manifest.project().name() == null
            ? null
            : new ProjectInfo(manifest.project().name(), manifest.project().moduleName());
        return new Architecture(project, NamespaceHierarchy.deriveParents(components), new ArrayList<>(dependencies));
    }
}
