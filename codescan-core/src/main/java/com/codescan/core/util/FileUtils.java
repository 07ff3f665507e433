package com.codescan.core.util;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Utility class for file operations.
 */
public final class FileUtils {

    private FileUtils() {
        // Utility class
    }

    /**
     * Reads a file as UTF-8, replacing malformed input instead of failing.
     *
     * @param path path to file
     * @return file content
     * @throws IOException if reading fails
     */
    public static String readLenient(Path path) throws IOException {
        byte[] bytes = Files.readAllBytes(path);
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPLACE)
            .onUnmappableCharacter(CodingErrorAction.REPLACE);
        try {
            return decoder.decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            // unreachable with REPLACE
            throw new IOException("Cannot decode " + path, e);
        }
    }

    /**
     * Counts lines the way a line-oriented reader does: a trailing line without a newline
     * still counts, an empty text has zero lines.
     *
     * @param content text
     * @return number of lines
     */
    public static int countLines(String content) {
        if (content.isEmpty()) {
            return 0;
        }
        int lines = 0;
        for (int i = 0; i < content.length(); i++) {
            if (content.charAt(i) == '\n') {
                lines++;
            }
        }
        if (content.charAt(content.length() - 1) != '\n') {
            lines++;
        }
        return lines;
    }

    /**
     * Deletes a file or directory tree. Missing paths are ignored.
     *
     * @param root file or directory to delete
     * @throws IOException if an entry cannot be deleted
     */
    public static void deleteRecursively(Path root) throws IOException {
        if (!Files.exists(root)) {
            return;
        }
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                file.toFile().setWritable(true);
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    /**
     * Lists the direct children of a directory, sorted by name.
     *
     * @param directory directory to list
     * @return sorted children
     * @throws IOException if the directory cannot be listed
     */
    public static List<Path> listSorted(Path directory) throws IOException {
        try (Stream<Path> children = Files.list(directory)) {
            return children
                .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                .toList();
        }
    }
}
