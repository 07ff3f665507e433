package com.codescan.core.scanner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;

/**
 * Walks a directory tree and returns the files eligible for scanning.
 *
 * <p>Excluded directories are pruned before they are entered, so none of their descendants
 * is returned even if it would pass the filter on its own. The result is sorted.
 */
public class FileCollector {

    private static final Logger log = LoggerFactory.getLogger(FileCollector.class);

    private final PathFilter filter;

    public FileCollector(PathFilter filter) {
        this.filter = filter;
    }

    /**
     * Collects eligible files below a root directory.
     *
     * @param root directory to walk
     * @return eligible regular files, sorted by path
     * @throws IOException if the root itself cannot be walked
     */
    public List<Path> collect(Path root) throws IOException {
        List<Path> files = new ArrayList<>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(root) && filter.isExcludedDirectoryName(dir.getFileName().toString())) {
                    log.debug("Pruning excluded directory {}", dir);
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && !filter.shouldExclude(file)) {
                    files.add(file);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
                if (file.equals(root)) {
                    throw exc;
                }
                log.warn("Skipping unreadable path {}: {}", file, exc.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });
        files.sort(null);
        return files;
    }
}
