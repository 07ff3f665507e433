package com.codescan.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading and saving CodeScan configuration as YAML.
 *
 * <p>Uses Jackson to deserialize {@code config.yaml} into {@link CodescanConfig} records.
 * If the config file is missing or invalid, returns {@link CodescanConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * CodescanConfig config = ConfigLoader.load(CodescanConfig.defaultConfigFile());
 * ModelProfile profile = config.model("openai").orElseThrow();
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(
        new YAMLFactory().disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER));

    private ConfigLoader() {
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link CodescanConfig#defaults()}.
     *
     * @param configPath path to {@code config.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static CodescanConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return CodescanConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return CodescanConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            CodescanConfig config = YAML_MAPPER.readValue(configPath.toFile(), CodescanConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return CodescanConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.warn("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return CodescanConfig.defaults();
        }
    }

    /**
     * Writes configuration to a YAML file, creating parent directories as needed.
     *
     * @param config configuration to write
     * @param configPath target file
     * @throws IOException if the file cannot be written
     */
    public static void save(CodescanConfig config, Path configPath) throws IOException {
        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        YAML_MAPPER.writeValue(configPath.toFile(), config);
        log.info("Saved configuration to: {}", configPath);
    }
}
