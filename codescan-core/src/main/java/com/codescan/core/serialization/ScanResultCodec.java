package com.codescan.core.serialization;

import com.codescan.core.model.ScanResult;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes {@link ScanResult}s as JSON.
 *
 * <p>Field names are snake_case and enum values lower case. Reading a written result
 * reproduces equal findings and statistics.
 */
public final class ScanResultCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private ScanResultCodec() {
    }

    public static String toJson(ScanResult result) throws IOException {
        return MAPPER.writeValueAsString(result);
    }

    public static ScanResult fromJson(String json) throws IOException {
        return MAPPER.readValue(json, ScanResult.class);
    }

    /**
     * Writes a result to a file, creating parent directories as needed.
     *
     * @param result result to write
     * @param target target file
     * @throws IOException if the file cannot be written
     */
    public static void write(ScanResult result, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        MAPPER.writeValue(target.toFile(), result);
    }

    public static ScanResult read(Path source) throws IOException {
        return MAPPER.readValue(source.toFile(), ScanResult.class);
    }
}
