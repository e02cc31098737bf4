package com.specsync.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading SpecSync configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code specsync.yaml} into {@link SpecSyncConfig} records.
 * If the config file is missing or invalid, returns {@link SpecSyncConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SpecSyncConfig config = ConfigLoader.load(projectRoot.resolve("specsync.yaml"));
 * SyncOptions options = config.sync().toOptions();
 * }</pre>
 */
public final class ConfigLoader {

    public static final String DEFAULT_FILE_NAME = "specsync.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link SpecSyncConfig#defaults()}.
     *
     * @param configPath path to {@code specsync.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static SpecSyncConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return SpecSyncConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return SpecSyncConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            SpecSyncConfig config = YAML_MAPPER.readValue(configPath.toFile(), SpecSyncConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return SpecSyncConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return SpecSyncConfig.defaults();
        }
    }
}
