package com.specsync.core.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.specsync.core.model.Requirement;
import com.specsync.core.model.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * {@link RequirementStore} persisted as a JSON document on disk.
 *
 * <p>The file holds every scope, keyed by {@code tenant/project}, then by component id.
 * Each mutation rewrites the file through a temporary file and an atomic move.
 *
 * <p><b>Example file:</b>
 * <pre>{@code
 * {
 *   "acme/shop" : {
 *     "3f2a9c0d1e4b5a67" : [ { "name" : "spec_file", "satisfied" : true, ... } ]
 *   }
 * }
 * }</pre>
 */
public class JsonFileRequirementStore implements RequirementStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileRequirementStore.class);

    private static final TypeReference<Map<String, Map<String, List<Requirement>>>> FILE_TYPE =
        new TypeReference<>() {};

    private final Path file;
    private final ObjectMapper mapper;
    private final InMemoryRequirementStore delegate = new InMemoryRequirementStore();

    /**
     * Opens a store, reading the file when it exists.
     *
     * @param file JSON file path
     * @throws RequirementStoreException if the existing file cannot be read
     */
    public JsonFileRequirementStore(Path file) {
        this.file = Objects.requireNonNull(file, "file must not be null");
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);
        read();
    }

    public Path file() {
        return file;
    }

    @Override
    public synchronized Requirement create(Scope scope, Requirement requirement) {
        mutate(scope, () -> delegate.create(scope, requirement));
        return requirement;
    }

    @Override
    public synchronized void clearAll(Scope scope, String componentId) {
        mutate(scope, () -> delegate.clearAll(scope, componentId));
    }

    @Override
    public synchronized void clearByNames(Scope scope, Collection<String> componentIds, Set<String> names) {
        mutate(scope, () -> delegate.clearByNames(scope, componentIds, names));
    }

    @Override
    public synchronized void clearProject(Scope scope) {
        mutate(scope, () -> delegate.clearProject(scope));
    }

    @Override
    public synchronized List<Requirement> listForComponent(Scope scope, String componentId) {
        return delegate.listForComponent(scope, componentId);
    }

    @Override
    public synchronized Map<String, List<Requirement>> listAll(Scope scope) {
        return delegate.listAll(scope);
    }

    @Override
    public synchronized void replaceAll(Scope scope, String componentId, List<Requirement> requirements) {
        mutate(scope, () -> delegate.replaceAll(scope, componentId, requirements));
    }

    /**
     * Applies a mutation to the in-memory copy and writes the file. When the write fails the
     * scope is restored, so memory never holds rows the file does not.
     */
    private void mutate(Scope scope, Runnable mutation) {
        boolean existed = delegate.scopeKeys().contains(scope.key());
        Map<String, List<Requirement>> before = delegate.snapshot(scope.key());
        mutation.run();
        try {
            write();
        } catch (RequirementStoreException e) {
            if (existed) {
                delegate.load(scope, before);
            } else {
                delegate.clearProject(scope);
            }
            log.warn("Rolled back {} after failed write to {}", scope.key(), file);
            throw e;
        }
    }

    private void read() {
        if (!Files.exists(file)) {
            log.debug("Requirement store {} does not exist yet", file);
            return;
        }
        try {
            Map<String, Map<String, List<Requirement>>> content = mapper.readValue(file.toFile(), FILE_TYPE);
            content.forEach((scopeKey, requirements) -> delegate.load(parseScope(scopeKey), requirements));
            log.debug("Loaded requirement store {} with {} scopes", file, content.size());
        } catch (IOException e) {
            throw new RequirementStoreException("Failed to read requirement store " + file, e);
        }
    }

    private void write() {
        Map<String, Map<String, List<Requirement>>> content = new LinkedHashMap<>();
        delegate.scopeKeys().stream().sorted().forEach(key -> content.put(key, delegate.snapshot(key)));
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = file.resolveSibling(file.getFileName() + ".tmp");
            mapper.writeValue(temp.toFile(), content);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new RequirementStoreException("Failed to write requirement store " + file, e);
        }
    }

    private static Scope parseScope(String key) {
        int slash = key.indexOf('/');
        if (slash < 0) {
            throw new RequirementStoreException("Invalid scope key in requirement store: " + key);
        }
        return new Scope(key.substring(0, slash), key.substring(slash + 1));
    }
}
