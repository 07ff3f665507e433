package com.codescan.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * File selection and execution limits of a scan.
 *
 * @param excludedDirs directory names never descended into
 * @param excludedFiles file name suffixes never scanned
 * @param maxFileSizeMb largest file size considered, in MiB
 * @param timeoutSeconds provider request timeout for model profiles that set none
 * @param maxWorkers default number of concurrent file analyses
 * @param summarizeProject whether directory scans ask the provider for a project summary
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ScanSettings(
    @JsonProperty("excluded_dirs") List<String> excludedDirs,
    @JsonProperty("excluded_files") List<String> excludedFiles,
    @JsonProperty("max_file_size_mb") Integer maxFileSizeMb,
    @JsonProperty("timeout_seconds") Integer timeoutSeconds,
    @JsonProperty("max_workers") Integer maxWorkers,
    @JsonProperty("summarize_project") Boolean summarizeProject
) {
    public static final List<String> DEFAULT_EXCLUDED_DIRS = List.of("node_modules", "venv", "__pycache__", ".git");
    public static final List<String> DEFAULT_EXCLUDED_FILES = List.of(".jpg", ".png", ".gif", ".mp4", ".zip", ".tar.gz");

    public ScanSettings {
        excludedDirs = excludedDirs == null ? DEFAULT_EXCLUDED_DIRS : List.copyOf(excludedDirs);
        excludedFiles = excludedFiles == null ? DEFAULT_EXCLUDED_FILES : List.copyOf(excludedFiles);
        if (maxFileSizeMb == null || maxFileSizeMb <= 0) {
            maxFileSizeMb = 10;
        }
        if (timeoutSeconds == null || timeoutSeconds <= 0) {
            timeoutSeconds = 60;
        }
        if (maxWorkers == null || maxWorkers <= 0) {
            maxWorkers = 5;
        }
        if (summarizeProject == null) {
            summarizeProject = Boolean.TRUE;
        }
    }

    /**
     * Returns the default scan settings.
     *
     * @return defaults
     */
    public static ScanSettings defaults() {
        return new ScanSettings(null, null, null, null, null, null);
    }

    /**
     * Returns the size limit in bytes.
     *
     * @return maximum file size in bytes
     */
    public long maxFileSizeBytes() {
        return maxFileSizeMb * 1024L * 1024L;
    }

    /**
     * Returns a copy with project summaries switched on or off.
     *
     * @param enabled whether to summarize
     * @return adjusted settings
     */
    public ScanSettings withSummarizeProject(boolean enabled) {
        return new ScanSettings(excludedDirs, excludedFiles, maxFileSizeMb, timeoutSeconds, maxWorkers, enabled);
    }
}
