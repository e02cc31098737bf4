package com.specsync.core.environment;

import java.io.IOException;
import java.util.List;

/**
 * Read-only view of a project's files.
 *
 * <p>Paths are relative to the project root and use {@code '/'} separators. Implementations
 * either read the local filesystem or serve a captured snapshot.
 */
public interface Environment {

    /**
     * Returns whether a file exists.
     *
     * @param relativePath path relative to the project root
     * @return true if the file exists
     */
    boolean fileExists(String relativePath);

    /**
     * Reads a file as UTF-8 text.
     *
     * @param relativePath path relative to the project root
     * @return file contents
     * @throws IOException if the file is missing or unreadable
     */
    String readFile(String relativePath) throws IOException;

    /**
     * Lists every regular file below the project root.
     *
     * @return relative file paths
     * @throws IOException if the listing fails
     */
    List<String> listFiles() throws IOException;
}
