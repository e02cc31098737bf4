package com.specsync.core.config;

import com.specsync.core.sync.PropagationMode;
import com.specsync.core.sync.SyncOptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_withValidConfig_returnsParsedConfig() throws IOException {
        // Given
        Path configFile = tempDir.resolve("specsync.yaml");
        Files.writeString(configFile, """
            project:
              name: "Shop"
              moduleName: "Shop"
              tenant: "acme"

            layout:
              code: "src/{path}.ex"

            sync:
              persist: false
              propagation: single_pass

            paths:
              store: "build/requirements.json"
            """);

        // When
        SpecSyncConfig config = ConfigLoader.load(configFile);

        // Then
        assertThat(config.project().name()).isEqualTo("Shop");
        assertThat(config.project().toScope().key()).isEqualTo("acme/Shop");
        assertThat(config.layout().code()).isEqualTo("src/{path}.ex");
        assertThat(config.layout().spec()).isEqualTo("docs/spec/{path}.spec.md");
        assertThat(config.sync().toOptions().persist()).isFalse();
        assertThat(config.sync().propagationMode()).isEqualTo(PropagationMode.SINGLE_PASS);
        assertThat(config.paths().store()).isEqualTo("build/requirements.json");
        assertThat(config.paths().manifest()).isEqualTo("architecture.yaml");
    }

    @Test
    void load_withMissingFile_returnsDefaults() {
        SpecSyncConfig config = ConfigLoader.load(tempDir.resolve("missing.yaml"));

        assertThat(config).isEqualTo(SpecSyncConfig.defaults());
        assertThat(config.project().tenant()).isEqualTo("local");
        assertThat(config.sync().toOptions()).isEqualTo(new SyncOptions(false, true, PropagationMode.TRANSITIVE));
    }

    @Test
    void load_withInvalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("specsync.yaml");
        Files.writeString(configFile, "project: [unclosed");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(SpecSyncConfig.defaults());
    }

    @Test
    void load_withEmptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("specsync.yaml");
        Files.writeString(configFile, "");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(SpecSyncConfig.defaults());
    }

    @Test
    void load_withUnknownProperties_ignoresThem() throws IOException {
        Path configFile = tempDir.resolve("specsync.yaml");
        Files.writeString(configFile, """
            project:
              name: "Shop"
              owner: "team-a"
            extra: true
            """);

        assertThat(ConfigLoader.load(configFile).project().name()).isEqualTo("Shop");
    }
}
