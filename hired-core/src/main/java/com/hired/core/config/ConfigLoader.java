package com.hired.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code hired.yaml} into {@link HiredConfig} records.
 * If the config file is missing or invalid, returns {@link HiredConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * HiredConfig config = ConfigLoader.load(Path.of("hired.yaml"));
 * RenderingConfig rendering = RenderingConfig.from(config);
 * }</pre>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Conventional configuration file name. */
    public static final String DEFAULT_FILE_NAME = "hired.yaml";

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link HiredConfig#defaults()}.
     *
     * @param configPath path to {@code hired.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static HiredConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.debug("Configuration file not found: {}. Using defaults.", configPath);
            return HiredConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return HiredConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            HiredConfig config = YAML_MAPPER.readValue(configPath.toFile(), HiredConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return HiredConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return HiredConfig.defaults();
        }
    }
}
