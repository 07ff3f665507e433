package com.codescan.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Root configuration of CodeScan.
 *
 * <p>Loaded from {@code ~/.codescan/config.yaml} by {@link ConfigLoader}. Missing sections
 * are filled from {@link #defaults()}, so every accessor returns a usable value.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * models:
 *   default:
 *     provider: openai
 *     model: gpt-4o-mini
 *     api_key: sk-...
 *
 * scan:
 *   excluded_dirs: [node_modules, .git, build]
 *   max_file_size_mb: 5
 *   max_workers: 8
 *
 * vulndb:
 *   auto_update: false
 * }</pre>
 *
 * @param models named provider profiles
 * @param scan scan settings
 * @param vulndb rule store settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CodescanConfig(
    @JsonProperty("models") Map<String, ModelProfile> models,
    @JsonProperty("scan") ScanSettings scan,
    @JsonProperty("vulndb") RuleDbSettings vulndb
) {
    public static final String DEFAULT_PROFILE = "default";

    public CodescanConfig {
        Map<String, ModelProfile> merged = new LinkedHashMap<>(defaultModels());
        if (models != null) {
            merged.putAll(models);
        }
        models = Collections.unmodifiableMap(merged);
        if (scan == null) {
            scan = ScanSettings.defaults();
        }
        if (vulndb == null) {
            vulndb = RuleDbSettings.defaults();
        }
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static CodescanConfig defaults() {
        return new CodescanConfig(null, null, null);
    }

    /**
     * Returns {@code ~/.codescan}.
     *
     * @return configuration home directory
     */
    public static Path homeDirectory() {
        return Path.of(System.getProperty("user.home"), ".codescan");
    }

    /**
     * Returns {@code ~/.codescan/config.yaml}.
     *
     * @return default configuration file
     */
    public static Path defaultConfigFile() {
        return homeDirectory().resolve("config.yaml");
    }

    /**
     * Looks up a provider profile by name. A profile without its own timeout gets
     * {@code scan.timeout_seconds}.
     *
     * @param name profile name, or null for {@value #DEFAULT_PROFILE}
     * @return profile if configured
     */
    public Optional<ModelProfile> model(String name) {
        return Optional.ofNullable(models.get(name == null ? DEFAULT_PROFILE : name))
            .map(profile -> profile.withDefaultTimeout(scan.timeoutSeconds()));
    }

    private static Map<String, ModelProfile> defaultModels() {
        Map<String, ModelProfile> defaults = new LinkedHashMap<>();
        defaults.put(DEFAULT_PROFILE, ModelProfile.of("deepseek", "deepseek-chat", "", "https://api.deepseek.com"));
        defaults.put("deepseek", ModelProfile.of("deepseek", "deepseek-chat", "", "https://api.deepseek.com"));
        defaults.put("openai", ModelProfile.of("openai", "gpt-3.5-turbo", "", null));
        defaults.put("anthropic", ModelProfile.of("anthropic", "claude-3-opus-20240229", "", null));
        return defaults;
    }
}
