package com.raditha.typebench.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Reads the YAML configuration file into a plain map for {@link EvaluationSettings}.
 */
public class ConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);

    /** Looked up in the working directory when no file is given. */
    public static final String DEFAULT_FILE_NAME = "typebench.yml";

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
    }

    /**
     * Load a YAML document.
     *
     * @param file the configuration file
     * @return the top-level mapping, empty for an empty file
     * @throws IOException              if the file cannot be read or is not valid YAML
     * @throws IllegalArgumentException if the document is not a mapping
     */
    public static Map<String, Object> load(Path file) throws IOException {
        JsonNode document = YAML.readTree(file.toFile());
        if (document == null || document.isMissingNode() || document.isNull()) {
            return Map.of();
        }
        if (!document.isObject()) {
            throw new IllegalArgumentException("Configuration file must contain a mapping: " + file);
        }
        logger.debug("Loaded configuration from {}", file);
        return YAML.convertValue(document, new TypeReference<Map<String, Object>>() {
        });
    }

    /**
     * Load the given file, or {@value #DEFAULT_FILE_NAME} from the working directory if it
     * exists, or nothing.
     */
    public static Map<String, Object> loadOrDefault(@Nullable Path file) throws IOException {
        if (file != null) {
            if (!Files.isRegularFile(file)) {
                throw new IllegalArgumentException("Configuration file not found: " + file);
            }
            return load(file);
        }
        Path fallback = Path.of(DEFAULT_FILE_NAME);
        return Files.isRegularFile(fallback) ? load(fallback) : Map.of();
    }
}
