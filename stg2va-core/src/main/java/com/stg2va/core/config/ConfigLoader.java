package com.stg2va.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.stg2va.core.error.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading stg2va configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code stg2va.yaml} into {@link Stg2VaConfig} records.
 * A missing file yields {@link Stg2VaConfig#defaults()}; a file that exists but cannot be
 * parsed is a {@link ConfigurationException}, since silently compiling with default timing
 * would produce a model that looks valid.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Stg2VaConfig config = ConfigLoader.load(Paths.get("stg2va.yaml"));
 * GeneratorConfig generatorConfig = config.toGeneratorConfig().build();
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    public static final String DEFAULT_FILE_NAME = "stg2va.yaml";

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to {@code stg2va.yaml}
     * @return loaded configuration, or defaults if the file does not exist
     * @throws ConfigurationException if the file exists but cannot be read or parsed
     */
    public static Stg2VaConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return Stg2VaConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            throw new ConfigurationException("Configuration file is not readable: " + configPath, null);
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            Stg2VaConfig config = YAML_MAPPER.readValue(configPath.toFile(), Stg2VaConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return Stg2VaConfig.defaults();
            }
            // timing and initial values are validated when converted
            config.toGeneratorConfig().build();
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            throw new ConfigurationException(
                "Failed to parse configuration file " + configPath + ": " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(
                "Invalid value in configuration file " + configPath + ": " + e.getMessage(), e);
        }
    }
}
