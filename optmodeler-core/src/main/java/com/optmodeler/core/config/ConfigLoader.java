package com.optmodeler.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading OptModeler configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code optmodeler.yaml} into {@link ModelerConfig} records.
 * If the config file is missing or invalid, returns {@link ModelerConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ModelerConfig config = ConfigLoader.load(Paths.get("optmodeler.yaml"));
 * GeneratedProgram program = generator.generate(model, config.toGeneratorConfig());
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Conventional configuration file name. */
    public static final String DEFAULT_FILE_NAME = "optmodeler.yaml";

    private ConfigLoader() {
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link ModelerConfig#defaults()}.
     *
     * @param configPath path to {@code optmodeler.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static ModelerConfig load(Path configPath) {
        if (configPath == null || !Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return ModelerConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return ModelerConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            ModelerConfig config = YAML_MAPPER.readValue(configPath.toFile(), ModelerConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return ModelerConfig.defaults();
            }
            validate(config);
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return ModelerConfig.defaults();
        }
    }

    /**
     * Checks settings that deserialize cleanly but cannot be rendered.
     *
     * @param config loaded configuration
     * @throws IllegalArgumentException if the render indent contains non-whitespace characters
     */
    static void validate(ModelerConfig config) {
        String indent = config.render().indent();
        if (!indent.isBlank()) {
            throw new IllegalArgumentException("render.indent must consist of whitespace only, got '"
                + indent + "'");
        }
    }
}
