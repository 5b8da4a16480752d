package com.netcracker.core.orchestrator.service.state;

import com.netcracker.core.orchestrator.model.ResourceId;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Keeps the whole state in one JSON file.
 * <p>
 * Every write rewrites the file through a temporary sibling followed by an atomic rename, so readers
 * see either the previous or the new document, never a partial one.
 */
@Slf4j
public class FileStateStore implements StateStore {
    private final Path file;
    private final StateSerializer serializer;
    private final Object lock = new Object();
    private Map<ResourceId, ResourceState> cache;

    public FileStateStore(Path file, StateSerializer serializer) {
        this.file = Objects.requireNonNull(file, "file");
        this.serializer = Objects.requireNonNull(serializer, "serializer");
    }

    @Override
    public StateSnapshot load() {
        synchronized (lock) {
            cache = readFile();
            return new StateSnapshot(cache.values());
        }
    }

    @Override
    public void commit(ResourceId id, ResourceState state) {
        Objects.requireNonNull(state, "state");
        synchronized (lock) {
            Map<ResourceId, ResourceState> updated = new LinkedHashMap<>(current());
            updated.put(id, state);
            writeFile(updated);
            cache = updated;
        }
        log.debug("Committed state of '{}' to {}", id, file);
    }

    @Override
    public void remove(ResourceId id) {
        synchronized (lock) {
            Map<ResourceId, ResourceState> updated = new LinkedHashMap<>(current());
            if (updated.remove(id) == null) {
                log.debug("No state entry for '{}' in {}, nothing to remove", id, file);
                return;
            }
            writeFile(updated);
            cache = updated;
        }
        log.debug("Removed state of '{}' from {}", id, file);
    }

    private Map<ResourceId, ResourceState> current() {
        if (cache == null) {
            cache = readFile();
        }
        return cache;
    }

    private Map<ResourceId, ResourceState> readFile() {
        Map<ResourceId, ResourceState> states = new LinkedHashMap<>();
        if (!Files.exists(file)) {
            log.debug("State file {} does not exist yet, starting from empty state", file);
            return states;
        }
        try {
            String json = Files.readString(file, StandardCharsets.UTF_8);
            if (json.isBlank()) {
                return states;
            }
            for (ResourceState state : serializer.deserializeDocument(json, file.toString())) {
                if (states.putIfAbsent(state.id(), state) != null) {
                    throw new StateCorruptionException("State file " + file + " contains '" + state.id() + "' twice");
                }
            }
            return states;
        } catch (IOException e) {
            throw new StateStoreException("Failed to read state file " + file, e);
        }
    }

    private void writeFile(Map<ResourceId, ResourceState> states) {
        String json = serializer.serializeDocument(states.values());
        Path directory = file.toAbsolutePath().getParent();
        try {
            if (directory != null) {
                Files.createDirectories(directory);
            }
            Path temp = Files.createTempFile(directory, file.getFileName().toString(), ".tmp");
            try {
                Files.writeString(temp, json, StandardCharsets.UTF_8);
                move(temp);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new StateStoreException("Failed to write state file " + file, e);
        }
    }

    private void move(Path temp) throws IOException {
        try {
            Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic rename is not supported for {}, falling back to a plain replace", file);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
