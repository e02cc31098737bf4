package com.specsync.cli;

import com.specsync.core.model.Component;
import com.specsync.core.model.Requirement;
import com.specsync.core.model.TestRun;
import com.specsync.core.report.ConsoleStatusPrinter;
import com.specsync.core.report.MarkdownStatusReport;
import com.specsync.core.store.RequirementStore;
import com.specsync.core.sync.ComponentStatusAnalyzer;
import com.specsync.core.testing.TestResultsReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Shows stored requirements next to a freshly computed file status. Never runs checkers
 * and never writes to the store.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * specsync status
 * specsync status --markdown docs/status.md
 * }</pre>
 */
@Command(
    name = "status",
    description = "Show stored requirement status",
    mixinStandardHelpOptions = true
)
public class StatusCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(StatusCommand.class);

    @Parameters(index = "0", description = "Project directory (default: current directory)", defaultValue = ".")
    private Path projectDir;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: specsync.yaml in project)")
    private Path configFile;

    @Option(names = {"-m", "--manifest"}, description = "Architecture manifest (default from configuration)")
    private Path manifestFile;

    @Option(names = {"--markdown"}, description = "Write a Markdown status report to this file")
    private Path markdownOutput;

    @Option(names = {"--all"}, description = "List satisfied requirements too")
    private boolean showAll;

    @Override
    public Integer call() {
        try {
            ProjectWorkspace workspace = ProjectWorkspace.open(projectDir, configFile, manifestFile);
            RequirementStore store = workspace.openStore();
            Map<String, List<Requirement>> stored = store.listAll(workspace.scope());
            if (stored.isEmpty()) {
                System.out.println("No stored requirements for " + workspace.scope().key()
                    + ". Run 'specsync sync' first.");
            }

            TestRun testRun = TestResultsReader.read(workspace.resolve(workspace.config().paths().testResults()));
            ComponentStatusAnalyzer analyzer = new ComponentStatusAnalyzer(workspace.layout(), Clock.systemUTC());
            List<Component> components = workspace.components().stream()
                .map(component -> component
                    .withStatus(analyzer.analyze(component, workspace.project(),
                        workspace.environment()::fileExists, testRun))
                    .withRequirements(stored.getOrDefault(component.id(), List.of())))
                .toList();

            new ConsoleStatusPrinter(System.out, false).print(components, showAll);

            if (markdownOutput != null) {
                if (markdownOutput.toAbsolutePath().getParent() != null) {
                    Files.createDirectories(markdownOutput.toAbsolutePath().getParent());
                }
                Files.writeString(markdownOutput,
                    new MarkdownStatusReport().generate(workspace.project().name(), components));
                System.out.println("✓ Wrote status report to " + markdownOutput);
            }
            return 0;
        } catch (Exception e) {
            log.error("Status failed", e);
            System.err.println("✗ Status failed: " + e.getMessage());
            return 1;
        }
    }
}
