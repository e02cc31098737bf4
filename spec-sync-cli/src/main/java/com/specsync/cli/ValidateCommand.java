package com.specsync.cli;

import com.specsync.core.graph.ComponentGraph;
import com.specsync.core.graph.CycleDetector;
import com.specsync.core.graph.DependencyCycle;
import com.specsync.core.graph.DependencyGraphBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Validates the configuration, requirement catalogue and architecture manifest, and reports
 * dependency cycles.
 *
 * <p>Exits with 1 when anything fails to load or a cycle exists.
 */
@Command(
    name = "validate",
    description = "Validate configuration, manifest and dependency graph",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Parameters(index = "0", description = "Project directory (default: current directory)", defaultValue = ".")
    private Path projectDir;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: specsync.yaml in project)")
    private Path configFile;

    @Option(names = {"-m", "--manifest"}, description = "Architecture manifest (default from configuration)")
    private Path manifestFile;

    @Override
    public Integer call() {
        log.info("Validating project: {}", projectDir);
        ProjectWorkspace workspace;
        try {
            workspace = ProjectWorkspace.open(projectDir, configFile, manifestFile);
        } catch (Exception e) {
            log.error("Validation failed", e);
            System.err.println("✗ " + e.getMessage());
            return 1;
        }
        System.out.println("✓ Configuration and catalogue loaded ("
            + workspace.registry().types().size() + " component types)");
        System.out.println("✓ " + workspace.components().size() + " components, "
            + workspace.architecture().dependencies().size() + " dependencies");

        ComponentGraph graph = DependencyGraphBuilder.attach(
            ComponentGraph.of(workspace.components()), workspace.architecture().dependencies());
        List<DependencyCycle> cycles = CycleDetector.detect(graph);
        if (cycles.isEmpty()) {
            System.out.println("✓ No dependency cycles");
            return 0;
        }

        System.out.println("✗ " + cycles.size() + " dependency cycle(s):");
        for (DependencyCycle cycle : cycles) {
            System.out.println("  " + cycle.description());
        }
        return 1;
    }
}
