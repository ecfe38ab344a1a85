package com.scenecraft.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@code scenecraft.yaml} into {@link SceneCraftConfig}.
 *
 * <p>Never throws: a missing, unreadable or invalid file yields
 * {@link SceneCraftConfig#defaults()} and a log message.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SceneCraftConfig config = ConfigLoader.load(Path.of("scenecraft.yaml"));
 * GeneratorConfig generatorConfig = config.generator().toGeneratorConfig();
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    public static final String DEFAULT_FILE_NAME = "scenecraft.yaml";

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to {@code scenecraft.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static SceneCraftConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.debug("Configuration file not found: {}. Using defaults.", configPath);
            return SceneCraftConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return SceneCraftConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            SceneCraftConfig config = YAML_MAPPER.readValue(configPath.toFile(), SceneCraftConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return SceneCraftConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return SceneCraftConfig.defaults();
        }
    }

    /**
     * Renders a configuration as YAML, for {@code scenecraft init}.
     *
     * @param config configuration to render
     * @return YAML text
     * @throws IOException if serialization fails
     */
    public static String toYaml(SceneCraftConfig config) throws IOException {
        return YAML_MAPPER.writeValueAsString(config);
    }
}
