package com.netcracker.core.orchestrator.service.graph;

import com.netcracker.core.orchestrator.model.Resource;
import com.netcracker.core.orchestrator.model.ResourceId;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Validated desired state: resources in declaration order and the dependency edges between them.
 * Every dependency points at a resource of the same graph.
 */
public final class ResourceGraph {
    private final Map<ResourceId, Resource> resources;
    private final Map<ResourceId, Set<ResourceId>> dependencies;
    private final Map<String, Object> outputs;

    ResourceGraph(Map<ResourceId, Resource> resources,
                  Map<ResourceId, Set<ResourceId>> dependencies,
                  Map<String, Object> outputs) {
        this.resources = Collections.unmodifiableMap(new LinkedHashMap<>(resources));
        this.dependencies = Collections.unmodifiableMap(new LinkedHashMap<>(dependencies));
        this.outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
    }

    public List<ResourceId> ids() {
        return List.copyOf(resources.keySet());
    }

    public List<Resource> resources() {
        return List.copyOf(resources.values());
    }

    public Optional<Resource> find(ResourceId id) {
        return Optional.ofNullable(resources.get(id));
    }

    public Resource resource(ResourceId id) {
        Resource resource = resources.get(id);
        if (resource == null) {
            throw new IllegalArgumentException("Resource '" + id + "' is not part of the graph");
        }
        return resource;
    }

    public boolean contains(ResourceId id) {
        return resources.containsKey(id);
    }

    public Set<ResourceId> dependenciesOf(ResourceId id) {
        return dependencies.getOrDefault(id, Set.of());
    }

    public Map<ResourceId, Set<ResourceId>> dependencies() {
        return dependencies;
    }

    /**
     * Named values declared under {@code outputs}, still unresolved.
     */
    public Map<String, Object> outputs() {
        return outputs;
    }

    public int size() {
        return resources.size();
    }
}
