package com.codescan.core.scanner;

import com.codescan.core.config.ScanSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URLConnection;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Decides whether a path is eligible for scanning.
 *
 * <p>A path is excluded when:
 * <ul>
 *   <li>any of its segments is an excluded directory name</li>
 *   <li>its file name ends with an excluded suffix (case-insensitive)</li>
 *   <li>it is a regular file larger than the size limit</li>
 *   <li>it is a regular file that looks binary</li>
 * </ul>
 *
 * <p>Binary detection first maps the file name to a MIME type and rejects image, audio,
 * video, archive and office types. Otherwise the first 1024 bytes are read: a NUL byte or
 * invalid UTF-8 means binary. A multi-byte sequence cut off by the 1024-byte boundary is
 * not invalid. A file that cannot be read is treated as binary.
 */
public class PathFilter {

    private static final Logger log = LoggerFactory.getLogger(PathFilter.class);

    static final int SNIFF_BYTES = 1024;

    private static final List<String> BINARY_MIME_PREFIXES = List.of(
        "image/", "audio/", "video/",
        "application/octet-stream", "application/zip", "application/x-rar",
        "application/pdf", "application/msword", "application/vnd.ms-"
    );

    private final Set<String> excludedDirs;
    private final List<String> excludedSuffixes;
    private final long maxFileSizeBytes;

    public PathFilter(ScanSettings settings) {
        this.excludedDirs = Set.copyOf(settings.excludedDirs());
        this.excludedSuffixes = settings.excludedFiles().stream()
            .map(suffix -> suffix.toLowerCase(Locale.ROOT))
            .toList();
        this.maxFileSizeBytes = settings.maxFileSizeBytes();
    }

    /**
     * Returns true if the path must not be scanned.
     *
     * @param path file or directory
     * @return true when excluded
     */
    public boolean shouldExclude(Path path) {
        for (Path segment : path) {
            if (excludedDirs.contains(segment.toString())) {
                return true;
            }
        }

        Path fileName = path.getFileName();
        if (fileName != null) {
            String name = fileName.toString().toLowerCase(Locale.ROOT);
            for (String suffix : excludedSuffixes) {
                if (name.endsWith(suffix)) {
                    return true;
                }
            }
        }

        if (Files.isRegularFile(path)) {
            try {
                long size = Files.size(path);
                if (size > maxFileSizeBytes) {
                    log.info("Skipping large file ({} bytes): {}", size, path);
                    return true;
                }
            } catch (IOException e) {
                log.info("Skipping file with unknown size: {} ({})", path, e.getMessage());
                return true;
            }
            if (isBinary(path)) {
                log.info("Skipping binary file: {}", path);
                return true;
            }
        }
        return false;
    }

    /**
     * Returns true if a directory with this name is never descended into.
     *
     * @param name directory name
     * @return true when excluded
     */
    public boolean isExcludedDirectoryName(String name) {
        return excludedDirs.contains(name);
    }

    /**
     * Sniffs whether a file is binary.
     *
     * @param file regular file
     * @return true if binary or unreadable
     */
    public boolean isBinary(Path file) {
        Path fileName = file.getFileName();
        String mimeType = fileName == null ? null : URLConnection.guessContentTypeFromName(fileName.toString());
        if (mimeType != null) {
            for (String prefix : BINARY_MIME_PREFIXES) {
                if (mimeType.startsWith(prefix)) {
                    return true;
                }
            }
        }

        byte[] head;
        try (InputStream input = Files.newInputStream(file)) {
            head = input.readNBytes(SNIFF_BYTES);
        } catch (IOException e) {
            log.debug("Cannot read {}: {}", file, e.getMessage());
            return true;
        }
        for (byte b : head) {
            if (b == 0) {
                return true;
            }
        }
        return !isValidUtf8Prefix(head);
    }

    private static boolean isValidUtf8Prefix(byte[] bytes) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        ByteBuffer input = ByteBuffer.wrap(bytes);
        CharBuffer output = CharBuffer.allocate(bytes.length);
        // endOfInput=false leaves a truncated trailing sequence in the buffer instead of failing
        CoderResult result = decoder.decode(input, output, false);
        return !result.isError();
    }
}
