package com.specsync.core.environment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * {@link Environment} backed by a directory on the local filesystem.
 */
public class LocalEnvironment implements Environment {

    private static final Logger log = LoggerFactory.getLogger(LocalEnvironment.class);

    private final Path root;

    public LocalEnvironment(Path root) {
        this.root = Objects.requireNonNull(root, "root must not be null").toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    @Override
    public boolean fileExists(String relativePath) {
        return Files.isRegularFile(resolve(relativePath));
    }

    @Override
    public String readFile(String relativePath) throws IOException {
        return Files.readString(resolve(relativePath), StandardCharsets.UTF_8);
    }

    @Override
    public List<String> listFiles() throws IOException {
        if (!Files.isDirectory(root)) {
            log.warn("Project root does not exist: {}", root);
            return List.of();
        }
        try (Stream<Path> paths = Files.walk(root)) {
            return paths
                .filter(Files::isRegularFile)
                .map(path -> root.relativize(path).toString().replace('\\', '/'))
                .sorted()
                .collect(Collectors.toList());
        }
    }

    private Path resolve(String relativePath) {
        Path resolved = root.resolve(relativePath).normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException("Path escapes project root: " + relativePath);
        }
        return resolved;
    }
}
