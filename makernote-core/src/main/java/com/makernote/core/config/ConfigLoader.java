package com.makernote.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading makernote configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code makernote.yaml} into {@link CatalogConfig} records.
 * If the config file is missing or invalid, returns {@link CatalogConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * CatalogConfig config = ConfigLoader.load(Paths.get("makernote.yaml"));
 *
 * if (config.vendors().isEnabled("kodak")) {
 *     // Vendor is exposed
 * }
 * }</pre>
 */
public final class ConfigLoader {

    /** Configuration file looked up in the working directory when none is given. */
    public static final String DEFAULT_FILE_NAME = "makernote.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link CatalogConfig#defaults()}.
     *
     * @param configPath path to {@code makernote.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static CatalogConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults (all vendors enabled).", configPath);
            return CatalogConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return CatalogConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            CatalogConfig config = YAML_MAPPER.readValue(configPath.toFile(), CatalogConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return CatalogConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return CatalogConfig.defaults();
        }
    }
}
