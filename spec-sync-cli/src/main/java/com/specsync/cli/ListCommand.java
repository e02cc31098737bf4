package com.specsync.cli;

import com.specsync.core.config.CatalogueConfigurer;
import com.specsync.core.config.ConfigLoader;
import com.specsync.core.document.DocumentType;
import com.specsync.core.document.DocumentTypes;
import com.specsync.core.model.ComponentType;
import com.specsync.core.registry.RequirementDefinition;
import com.specsync.core.registry.RequirementRegistry;
import com.specsync.core.registry.TypeDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Lists component types, the requirements each one carries, or the known document types.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Component types with requirement counts
 * specsync list types
 *
 * # Requirements of one type, in evaluation order
 * specsync list requirements context
 *
 * # Document types and their sections
 * specsync list documents
 * }</pre>
 */
@Command(
    name = "list",
    description = "List component types, requirements or document types",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(index = "0", description = "What to list: types, requirements, documents")
    private String target;

    @Parameters(index = "1", arity = "0..1", description = "Component type for 'requirements'")
    private String componentType;

    @Option(names = {"-d", "--project-dir"}, description = "Project directory whose catalogue to use", defaultValue = ".")
    private Path projectDir;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: specsync.yaml in project)")
    private Path configFile;

    @Override
    public Integer call() {
        log.debug("Listing {}", target);
        try {
            return switch (target.toLowerCase()) {
                case "types" -> listTypes(registry());
                case "requirements" -> listRequirements(registry());
                case "documents" -> listDocuments();
                default -> {
                    System.err.println("✗ Unknown list target: " + target
                        + ". Expected one of: types, requirements, documents");
                    yield 1;
                }
            };
        } catch (RuntimeException e) {
            log.error("List failed", e);
            System.err.println("✗ " + e.getMessage());
            return 1;
        }
    }

    private RequirementRegistry registry() {
        Path config = configFile != null
            ? configFile
            : projectDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        return CatalogueConfigurer.apply(RequirementRegistry.builtIn(),
            ConfigLoader.load(config).requirements());
    }

    private int listTypes(RequirementRegistry registry) {
        System.out.println("Component types:");
        for (Map.Entry<ComponentType, TypeDefinition> entry : registry.types().entrySet()) {
            TypeDefinition type = entry.getValue();
            System.out.printf("  %-14s %-24s %d requirements%n",
                entry.getKey().tag(), type.displayName(), type.requirements().size());
        }
        return 0;
    }

    private int listRequirements(RequirementRegistry registry) {
        if (componentType == null) {
            System.err.println("✗ Missing component type. Usage: specsync list requirements <type>");
            return 1;
        }
        ComponentType type = ComponentType.fromTag(componentType);
        List<RequirementDefinition> definitions = registry.definitionsFor(type);
        System.out.println("Requirements for " + registry.typeDefinition(type).displayName() + ":");
        for (RequirementDefinition definition : definitions) {
            System.out.printf("  %-26s %-20s %-16s %s%n",
                definition.name(),
                definition.checker().reference(),
                definition.artifactType().tag(),
                definition.isRelational() ? "(relational)" : "");
        }
        return 0;
    }

    private int listDocuments() {
        System.out.println("Document types:");
        for (DocumentType type : DocumentTypes.all()) {
            System.out.println("  " + type.name());
            for (List<String> alternatives : type.requiredSections()) {
                System.out.println("    required: " + String.join(" | ", alternatives));
            }
            if (!type.optionalSections().isEmpty()) {
                System.out.println("    optional: " + String.join(", ", type.optionalSections()));
            }
        }
        return 0;
    }
}
