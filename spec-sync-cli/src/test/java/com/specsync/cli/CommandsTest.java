package com.specsync.cli;

import com.specsync.SpecSyncCLI;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Runs the subcommands end to end against a small project on disk.
 */
class CommandsTest {

    private static final String MANIFEST = """
        project:
          name: Shop
          moduleName: Shop

        components:
          - moduleName: Shop.Accounts
            type: context
          - moduleName: Shop.Accounts.User
            type: schema
          - moduleName: Shop.Orders
            type: context
            dependsOn: [Shop.Accounts]
        """;

    @TempDir
    Path projectDir;

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private final ByteArrayOutputStream stderr = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private PrintStream originalErr;

    @BeforeEach
    void captureOutput() {
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(stdout, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(stderr, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreOutput() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    @Test
    void sync_withManifest_persistsRequirementsAndPrintsStatus() throws IOException {
        // Given
        writeProject(MANIFEST);

        // When
        int exitCode = run("sync", projectDir.toString());

        // Then
        assertThat(exitCode).isZero();
        assertThat(projectDir.resolve(".specsync/requirements.json")).exists();
        assertThat(out())
            .contains("Syncing 3 components")
            .contains("✓ Synced 3 components")
            .contains("Shop.Orders (context)")
            .contains("implementation_file");
    }

    @Test
    void sync_withNoPersist_leavesStoreUnwritten() throws IOException {
        writeProject(MANIFEST);

        int exitCode = run("sync", projectDir.toString(), "--no-persist");

        assertThat(exitCode).isZero();
        assertThat(projectDir.resolve(".specsync/requirements.json")).doesNotExist();
    }

    @Test
    void sync_withChangedFileAfterFullSync_succeeds() throws IOException {
        writeProject(MANIFEST);
        assertThat(run("sync", projectDir.toString())).isZero();

        int exitCode = run("sync", projectDir.toString(), "--changed", "lib/shop/orders.ex");

        assertThat(exitCode).isZero();
        assertThat(out()).contains("✓ Synced 3 components");
    }

    @Test
    void sync_withMarkdownOption_writesReport() throws IOException {
        writeProject(MANIFEST);
        Path report = projectDir.resolve("docs/status.md");

        int exitCode = run("sync", projectDir.toString(), "--markdown", report.toString());

        assertThat(exitCode).isZero();
        assertThat(Files.readString(report)).startsWith("# Shop Requirement Status");
    }

    @Test
    void sync_withInvalidManifest_returnsError() throws IOException {
        writeProject("""
            components:
              - moduleName: Shop.Orders
                dependsOn: [Shop.Payments]
            """);

        int exitCode = run("sync", projectDir.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err()).contains("✗ Sync failed: Unknown dependency Shop.Payments of Shop.Orders");
    }

    @Test
    void status_afterSync_printsStoredRequirements() throws IOException {
        writeProject(MANIFEST);
        run("sync", projectDir.toString());
        stdout.reset();

        int exitCode = run("status", projectDir.toString());

        assertThat(exitCode).isZero();
        assertThat(out())
            .doesNotContain("No stored requirements")
            .contains("Shop.Accounts (context)")
            .contains("components complete");
    }

    @Test
    void status_beforeSync_printsHint() throws IOException {
        writeProject(MANIFEST);

        int exitCode = run("status", projectDir.toString());

        assertThat(exitCode).isZero();
        assertThat(out()).contains("No stored requirements for local/Shop");
    }

    @Test
    void validate_withAcyclicManifest_succeeds() throws IOException {
        writeProject(MANIFEST);

        int exitCode = run("validate", projectDir.toString());

        assertThat(exitCode).isZero();
        assertThat(out())
            .contains("✓ 3 components, 1 dependencies")
            .contains("✓ No dependency cycles");
    }

    @Test
    void validate_withDependencyCycle_fails() throws IOException {
        writeProject("""
            components:
              - moduleName: Shop.Orders
                dependsOn: [Shop.Payments]
              - moduleName: Shop.Payments
                dependsOn: [Shop.Orders]
            """);

        int exitCode = run("validate", projectDir.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(out()).contains("✗ 1 dependency cycle(s):");
    }

    @Test
    void list_types_printsEveryComponentType() {
        int exitCode = run("list", "types", "-d", projectDir.toString());

        assertThat(exitCode).isZero();
        assertThat(out()).contains("Component types:").contains("context").contains("schema");
    }

    @Test
    void list_requirementsForContext_printsCatalogueInOrder() {
        int exitCode = run("list", "requirements", "context", "-d", projectDir.toString());

        assertThat(exitCode).isZero();
        String output = out();
        assertThat(output).contains("spec_file").contains("children_tests").contains("tests_passing");
        assertThat(output.indexOf("spec_file")).isLessThan(output.indexOf("tests_passing"));
    }

    @Test
    void list_requirementsWithoutType_fails() {
        int exitCode = run("list", "requirements", "-d", projectDir.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err()).contains("Missing component type");
    }

    @Test
    void list_unknownTarget_fails() {
        int exitCode = run("list", "widgets", "-d", projectDir.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err()).contains("Unknown list target: widgets");
    }

    private int run(String... args) {
        String[] withQuiet = new String[args.length + 1];
        withQuiet[0] = "-q";
        System.arraycopy(args, 0, withQuiet, 1, args.length);
        return SpecSyncCLI.commandLine().execute(withQuiet);
    }

    private void writeProject(String manifest) throws IOException {
        Files.writeString(projectDir.resolve("architecture.yaml"), manifest);
        Files.createDirectories(projectDir.resolve("docs/spec/shop/accounts"));
        Files.writeString(projectDir.resolve("docs/spec/shop/accounts.spec.md"),
            "# Shop.Accounts\n\n## Delegates\n\n- get_user/1\n\n## Dependencies\n\n- None\n\n## Components\n\n- Shop.Accounts.User\n");
        Files.writeString(projectDir.resolve("docs/spec/shop/accounts/user.spec.md"),
            "# Shop.Accounts.User\n\n## Fields\n\n| Field | Type |\n|-------|------|\n| email | string |\n");
        Files.createDirectories(projectDir.resolve("lib/shop/accounts"));
        Files.writeString(projectDir.resolve("lib/shop/accounts.ex"), "defmodule Shop.Accounts do\nend\n");
        Files.writeString(projectDir.resolve("lib/shop/accounts/user.ex"), "defmodule Shop.Accounts.User do\nend\n");
    }

    private String out() {
        return stdout.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return stderr.toString(StandardCharsets.UTF_8);
    }
}
