package com.netcracker.core.orchestrator.service.state;

import com.netcracker.core.orchestrator.model.ResourceId;

import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable view of the State Store at one point in time.
 */
public final class StateSnapshot {
    private static final StateSnapshot EMPTY = new StateSnapshot(List.of());

    private final Map<ResourceId, ResourceState> resources;

    public StateSnapshot(Collection<ResourceState> states) {
        Map<ResourceId, ResourceState> ordered = new LinkedHashMap<>();
        states.stream()
                .sorted(Comparator.comparing(state -> state.id().toString()))
                .forEach(state -> ordered.put(state.id(), state));
        this.resources = Collections.unmodifiableMap(ordered);
    }

    public static StateSnapshot empty() {
        return EMPTY;
    }

    public Optional<ResourceState> find(ResourceId id) {
        return Optional.ofNullable(resources.get(id));
    }

    public boolean contains(ResourceId id) {
        return resources.containsKey(id);
    }

    /**
     * Resource ids sorted by their textual form.
     */
    public List<ResourceId> ids() {
        return List.copyOf(resources.keySet());
    }

    public Collection<ResourceState> states() {
        return resources.values();
    }

    public Map<ResourceId, Set<ResourceId>> dependencies() {
        Map<ResourceId, Set<ResourceId>> dependencies = new LinkedHashMap<>();
        resources.forEach((id, state) -> dependencies.put(id, state.dependencies()));
        return dependencies;
    }

    public boolean isEmpty() {
        return resources.isEmpty();
    }

    public int size() {
        return resources.size();
    }
}
