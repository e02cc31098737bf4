package com.specsync.core.environment;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * {@link Environment} over a captured snapshot of file paths and contents.
 *
 * <p>A path added without content exists but reads as an empty string.
 */
public class InMemoryEnvironment implements Environment {

    private final Map<String, String> files = new TreeMap<>();

    public InMemoryEnvironment() {
    }

    /**
     * Creates a snapshot from a flat file listing.
     *
     * @param paths relative paths of existing files
     * @return snapshot environment
     */
    public static InMemoryEnvironment ofPaths(Collection<String> paths) {
        InMemoryEnvironment environment = new InMemoryEnvironment();
        paths.forEach(path -> environment.addFile(path, ""));
        return environment;
    }

    public InMemoryEnvironment addFile(String relativePath, String content) {
        files.put(relativePath, content == null ? "" : content);
        return this;
    }

    public InMemoryEnvironment removeFile(String relativePath) {
        files.remove(relativePath);
        return this;
    }

    @Override
    public boolean fileExists(String relativePath) {
        return files.containsKey(relativePath);
    }

    @Override
    public String readFile(String relativePath) throws IOException {
        String content = files.get(relativePath);
        if (content == null) {
            throw new FileNotFoundException(relativePath);
        }
        return content;
    }

    @Override
    public List<String> listFiles() {
        return new ArrayList<>(files.keySet());
    }
}
