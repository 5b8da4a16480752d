package com.netcracker.core.orchestrator.model;

import java.util.Map;
import java.util.Set;

/**
 * A declared resource.
 *
 * @param id         identity within the graph
 * @param attributes attribute values, possibly containing references
 * @param dependsOn  explicit ordering dependencies in addition to the ones implied by references
 * @param index      position in the declaration document, used only to break ordering ties
 */
public record Resource(ResourceId id, Map<String, Object> attributes, Set<ResourceId> dependsOn, int index) {

    public Resource {
        attributes = References.immutableCopy(attributes);
        dependsOn = Set.copyOf(dependsOn);
    }

    public ResourceKind kind() {
        return id.kind();
    }
}
