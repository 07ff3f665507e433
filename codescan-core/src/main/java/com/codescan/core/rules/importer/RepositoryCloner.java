package com.codescan.core.rules.importer;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Clones a branch of a git repository into a local directory.
 */
@FunctionalInterface
public interface RepositoryCloner {

    /**
     * Performs one clone attempt.
     *
     * @param url repository URL
     * @param branch branch to clone
     * @param target empty directory to clone into
     * @throws IOException if the attempt fails or times out
     */
    void cloneRepository(String url, String branch, Path target) throws IOException;
}
