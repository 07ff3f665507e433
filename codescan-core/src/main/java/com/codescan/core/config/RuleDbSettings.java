package com.codescan.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;

/**
 * Location and update policy of the rule store.
 *
 * @param directory directory holding {@code vulndb.json} and {@code last_update.json}
 * @param updateUrl URL of the remote rule feed
 * @param autoUpdate whether stale stores are refreshed when opened
 * @param updateIntervalDays age after which the store is considered stale
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RuleDbSettings(
    @JsonProperty("directory") String directory,
    @JsonProperty("update_url") String updateUrl,
    @JsonProperty("auto_update") Boolean autoUpdate,
    @JsonProperty("update_interval_days") Integer updateIntervalDays
) {
    public static final String DEFAULT_UPDATE_URL = "https://example.com/vulndb/latest.json";

    public RuleDbSettings {
        if (directory == null || directory.isBlank()) {
            directory = CodescanConfig.homeDirectory().resolve("vulndb").toString();
        }
        if (updateUrl == null || updateUrl.isBlank()) {
            updateUrl = DEFAULT_UPDATE_URL;
        }
        if (autoUpdate == null) {
            autoUpdate = Boolean.TRUE;
        }
        if (updateIntervalDays == null || updateIntervalDays <= 0) {
            updateIntervalDays = 7;
        }
    }

    public static RuleDbSettings defaults() {
        return new RuleDbSettings(null, null, null, null);
    }

    /**
     * Returns settings rooted at a specific directory, with auto update off.
     *
     * @param directory store directory
     * @return local-only settings
     */
    public static RuleDbSettings local(Path directory) {
        return new RuleDbSettings(directory.toString(), null, false, null);
    }

    public Path directoryPath() {
        String dir = directory;
        if (dir.startsWith("~")) {
            dir = System.getProperty("user.home") + dir.substring(1);
        }
        return Path.of(dir);
    }
}
