package com.codescan.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregate statistics of a scan.
 *
 * <p>Language and extension maps are kept sorted by key so two scans over the same
 * files compare equal regardless of the order in which workers completed.
 *
 * @param totalFiles number of files selected for analysis
 * @param totalLinesOfCode sum of lines of the files analysed successfully
 * @param languages language to file count
 * @param fileExtensions lower-case extension (with dot) to file count
 * @param error reason the scan failed or produced nothing, or null
 * @param cancelled true if the scan was interrupted before all files were dispatched
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScanStats(
    @JsonProperty("total_files") int totalFiles,
    @JsonProperty("total_lines_of_code") long totalLinesOfCode,
    @JsonProperty("languages") Map<String, Integer> languages,
    @JsonProperty("file_extensions") Map<String, Integer> fileExtensions,
    @JsonProperty("error") String error,
    @JsonProperty("cancelled") boolean cancelled
) {
    /**
     * Compact constructor with defaults.
     */
    public ScanStats {
        if (totalFiles < 0) {
            totalFiles = 0;
        }
        if (totalLinesOfCode < 0) {
            totalLinesOfCode = 0;
        }
        languages = languages == null
            ? Map.of()
            : Collections.unmodifiableMap(new TreeMap<>(languages));
        fileExtensions = fileExtensions == null
            ? Map.of()
            : Collections.unmodifiableMap(new TreeMap<>(fileExtensions));
    }

    /**
     * Creates empty statistics.
     *
     * @return statistics with zero counts
     */
    public static ScanStats empty() {
        return new ScanStats(0, 0, Map.of(), Map.of(), null, false);
    }

    /**
     * Creates statistics that only carry an error.
     *
     * @param error error message
     * @return failed statistics
     */
    public static ScanStats failed(String error) {
        return new ScanStats(0, 0, Map.of(), Map.of(), error, false);
    }

    /**
     * Returns true if the scan recorded an error.
     *
     * @return true when {@code error} is set
     */
    public boolean hasError() {
        return error != null;
    }
}
