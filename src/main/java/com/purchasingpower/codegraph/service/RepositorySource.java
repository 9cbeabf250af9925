package com.purchasingpower.codegraph.service;

import java.nio.file.Path;
import java.util.List;

/**
 * Provides the source files of a repository to index.
 */
public interface RepositorySource {

    /**
     * Clone a remote repository into the workspace, or return the directory itself for a local path.
     *
     * @throws com.purchasingpower.codegraph.exception.RepositoryDownloadException if neither works
     */
    Path download(String url);

    /**
     * Source files under the root with a supported extension, outside excluded directories.
     * Paths are absolute and sorted.
     */
    List<Path> listSourceFiles(Path root);

    String read(Path file);

    /**
     * Delete a workspace created by {@link #download(String)}. Local directories are left alone.
     */
    void cleanup(Path root);
}
