package com.specsync.cli;

import com.specsync.core.manifest.ChangedComponentResolver;
import com.specsync.core.model.Component;
import com.specsync.core.model.TestRun;
import com.specsync.core.report.ConsoleStatusPrinter;
import com.specsync.core.report.MarkdownStatusReport;
import com.specsync.core.store.RequirementStore;
import com.specsync.core.sync.SyncOptions;
import com.specsync.core.sync.SyncRequest;
import com.specsync.core.sync.SyncResult;
import com.specsync.core.testing.TestResultsReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Runs a requirement sync over a project directory.
 *
 * <p>Without {@code --changed}, every component is recomputed. With it, only components
 * affected by the changed files (or named modules) are re-evaluated locally; relational
 * requirements are always recomputed.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Full sync of the current directory
 * specsync sync --force
 *
 * # Incremental sync after editing one file
 * specsync sync --changed lib/shop/accounts.ex
 *
 * # Use a test results file and write a report
 * specsync sync --test-results build/test-results.json --markdown docs/status.md
 * }</pre>
 */
@Command(
    name = "sync",
    description = "Recompute component requirements",
    mixinStandardHelpOptions = true
)
public class SyncCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SyncCommand.class);

    @Parameters(index = "0", description = "Project directory (default: current directory)", defaultValue = ".")
    private Path projectDir;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: specsync.yaml in project)")
    private Path configFile;

    @Option(names = {"-m", "--manifest"}, description = "Architecture manifest (default from configuration)")
    private Path manifestFile;

    @Option(names = {"--changed"}, split = ",", description = "Changed file paths, relative to the project")
    private List<String> changedFiles = new ArrayList<>();

    @Option(names = {"--changed-module"}, split = ",", description = "Changed component module names")
    private List<String> changedModules = new ArrayList<>();

    @Option(names = {"--test-results"}, description = "JSON test results file (default from configuration)")
    private Path testResults;

    @Option(names = {"--force"}, description = "Clear and recompute every requirement")
    private boolean force;

    @Option(names = {"--no-persist"}, description = "Do not write results to the requirement store")
    private boolean noPersist;

    @Option(names = {"--markdown"}, description = "Write a Markdown status report to this file")
    private Path markdownOutput;

    @Option(names = {"--all"}, description = "List satisfied requirements too")
    private boolean showAll;

    @Override
    public Integer call() {
        try {
            ProjectWorkspace workspace = ProjectWorkspace.open(projectDir, configFile, manifestFile);
            System.out.println("Syncing " + workspace.components().size() + " components in " + workspace.root());

            TestRun testRun = TestResultsReader.read(testResults != null
                ? testResults
                : workspace.resolve(workspace.config().paths().testResults()));

            Set<String> changedIds = changedIds(workspace);
            boolean incremental = !changedFiles.isEmpty() || !changedModules.isEmpty();
            SyncOptions options = workspace.config().sync().toOptions();
            options = options.withForce(force || options.force() || !incremental);
            if (noPersist) {
                options = options.withPersist(false);
            }

            RequirementStore store = workspace.openStore();
            SyncRequest request = new SyncRequest(workspace.scope(), workspace.project(),
                workspace.components(), workspace.architecture().dependencies(), changedIds, null, testRun, options);
            SyncResult result = workspace.engine(store).sync(request);

            System.out.println("✓ Synced " + result.statistics().componentCount() + " components ("
                + result.statistics().affectedCount() + " affected, "
                + result.statistics().persistenceFailures() + " persistence failures)");
            System.out.println();
            new ConsoleStatusPrinter(System.out, false).print(result.components(), showAll);

            if (markdownOutput != null) {
                writeReport(workspace, result.components());
            }
            return 0;
        } catch (Exception e) {
            log.error("Sync failed", e);
            System.err.println("✗ Sync failed: " + e.getMessage());
            return 1;
        }
    }

    private Set<String> changedIds(ProjectWorkspace workspace) {
        Set<String> ids = new LinkedHashSet<>(new ChangedComponentResolver(
            workspace.components(), workspace.project(), workspace.layout()).resolve(changedFiles));
        for (String module : changedModules) {
            workspace.architecture().byModuleName(module)
                .map(Component::id)
                .ifPresentOrElse(ids::add, () -> log.warn("Unknown changed module: {}", module));
        }
        if (!changedFiles.isEmpty() && ids.isEmpty()) {
            log.warn("None of the changed files belong to a known component");
        }
        return ids;
    }

    private void writeReport(ProjectWorkspace workspace, List<Component> components) throws IOException {
        Path output = markdownOutput.isAbsolute() ? markdownOutput : Paths.get("").toAbsolutePath().resolve(markdownOutput);
        if (output.getParent() != null) {
            Files.createDirectories(output.getParent());
        }
        Files.writeString(output, new MarkdownStatusReport().generate(workspace.project().name(), components));
        System.out.println("✓ Wrote status report to " + output);
    }
}
