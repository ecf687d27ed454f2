package com.optmodeler.core.definition;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.optmodeler.core.exception.DefinitionException;
import com.optmodeler.core.model.ModelDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Reads {@link ModelDefinition} documents. Files ending in {@code .json} are parsed as JSON,
 * everything else as YAML.
 *
 * <p>Unlike configuration, a definition is mandatory input: an unreadable or malformed file
 * raises {@link DefinitionException}.
 */
public class DefinitionLoader {

    private static final Logger log = LoggerFactory.getLogger(DefinitionLoader.class);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

    private DefinitionLoader() {
    }

    /**
     * Loads a model definition.
     *
     * @param path definition file
     * @return parsed definition
     * @throws DefinitionException if the file is missing or malformed
     */
    public static ModelDefinition load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new DefinitionException("Model definition not found: " + path);
        }
        ObjectMapper mapper = isJson(path) ? JSON_MAPPER : YAML_MAPPER;
        try {
            log.debug("Reading model definition from: {}", path);
            ModelDefinition definition = mapper.readValue(path.toFile(), ModelDefinition.class);
            if (definition == null) {
                throw new DefinitionException("Model definition is empty: " + path);
            }
            log.info("Read model definition '{}' from: {}", definition.name(), path);
            return definition;
        } catch (IOException e) {
            throw new DefinitionException("Failed to parse model definition " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parses a YAML (or JSON, which YAML accepts) document held in memory.
     *
     * @param content document text
     * @return parsed definition
     */
    public static ModelDefinition parse(String content) {
        try {
            return YAML_MAPPER.readValue(content, ModelDefinition.class);
        } catch (IOException e) {
            throw new DefinitionException("Failed to parse model definition: " + e.getMessage(), e);
        }
    }

    private static boolean isJson(Path path) {
        Path fileName = path.getFileName();
        return fileName != null && fileName.toString().toLowerCase(Locale.ROOT).endsWith(".json");
    }
}
