package com.staticpress.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading StaticPress configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code staticpress.yaml} into a {@link SiteConfig} record and
 * fills unset keys from {@link SiteConfig#defaults()}. A missing or empty file yields the
 * defaults; a file that cannot be parsed raises {@link ConfigurationException}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SiteConfig config = ConfigLoader.load(Paths.get("staticpress.yaml"));
 * Path posts = config.inputDirectory(projectRoot).resolve("posts");
 * }</pre>
 */
public class ConfigLoader {

    public static final String DEFAULT_FILE_NAME = "staticpress.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist, logs a warning and returns {@link SiteConfig#defaults()}.
     *
     * @param configPath path to {@code staticpress.yaml}
     * @return loaded configuration with defaults applied
     * @throws ConfigurationException if the file exists but cannot be read or parsed
     */
    public static SiteConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return SiteConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            throw new ConfigurationException("Configuration file is not readable: " + configPath);
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            JsonNode tree = YAML_MAPPER.readTree(Files.readString(configPath, StandardCharsets.UTF_8));
            if (tree == null || tree.isMissingNode() || tree.isNull()) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return SiteConfig.defaults();
            }
            SiteConfig config = YAML_MAPPER.treeToValue(tree, SiteConfig.class);
            log.info("Loaded configuration from: {}", configPath);
            return config.withDefaults();
        } catch (IOException e) {
            throw new ConfigurationException("Failed to parse configuration file: " + configPath
                + ": " + e.getMessage(), e);
        }
    }
}
