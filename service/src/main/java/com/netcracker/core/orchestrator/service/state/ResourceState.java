package com.netcracker.core.orchestrator.service.state;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.netcracker.core.orchestrator.model.References;
import com.netcracker.core.orchestrator.model.ResourceId;
import com.netcracker.core.orchestrator.model.ResourceKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Last applied state of one resource.
 *
 * @param id           resource identity
 * @param providerId   identifier the provider assigned to the live instance
 * @param attributes   attribute values sent to the provider, with references already substituted
 * @param outputs      values the provider reported back
 * @param dependencies resources this one depended on when it was applied
 * @param deposed      provider ids of replaced instances that still have to be destroyed
 */
public record ResourceState(@JsonProperty("id") ResourceId id,
                            @JsonProperty("providerId") String providerId,
                            @JsonProperty("attributes") Map<String, Object> attributes,
                            @JsonProperty("outputs") Map<String, Object> outputs,
                            @JsonProperty("dependencies") Set<ResourceId> dependencies,
                            @JsonProperty("deposed") List<String> deposed) {

    public ResourceState {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(providerId, "providerId");
        attributes = References.immutableCopy(attributes);
        outputs = References.immutableCopy(outputs);
        dependencies = dependencies == null ? Set.of() : Set.copyOf(dependencies);
        deposed = deposed == null ? List.of() : List.copyOf(deposed);
    }

    public ResourceKind kind() {
        return id.kind();
    }

    /**
     * Looks up a value other resources may reference: outputs first, then applied attributes.
     */
    public Optional<Object> lookup(String name) {
        if (outputs.containsKey(name)) {
            return Optional.ofNullable(outputs.get(name));
        }
        if (attributes.containsKey(name)) {
            return Optional.ofNullable(attributes.get(name));
        }
        return Optional.empty();
    }

    public boolean has(String name) {
        return outputs.containsKey(name) || attributes.containsKey(name);
    }

    public ResourceState withDeposed(String instanceId) {
        List<String> updated = new ArrayList<>(deposed);
        updated.add(instanceId);
        return new ResourceState(id, providerId, attributes, outputs, dependencies, updated);
    }

    public ResourceState withoutDeposed(String instanceId) {
        List<String> updated = new ArrayList<>(deposed);
        updated.remove(instanceId);
        return new ResourceState(id, providerId, attributes, outputs, dependencies, updated);
    }
}
