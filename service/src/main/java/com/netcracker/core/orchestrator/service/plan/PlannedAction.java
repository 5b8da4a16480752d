package com.netcracker.core.orchestrator.service.plan;

import com.netcracker.core.orchestrator.model.References;
import com.netcracker.core.orchestrator.model.ResourceId;
import com.netcracker.core.orchestrator.model.ResourceKind;
import com.netcracker.core.orchestrator.service.state.ResourceState;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One step of a {@link Plan}.
 *
 * @param stage             actions of the same stage are independent of each other
 * @param type              what to do
 * @param resourceId        target resource
 * @param attributes        desired attributes, references not yet substituted; empty for destroys
 * @param plannedAttributes desired attributes as far as they are known at plan time
 * @param dependencies      resources the target depends on in the desired graph
 * @param prior             stored state of the target, {@code null} for a plain create
 * @param instanceId        provider id of the instance acted upon; {@code null} for creates
 * @param replacement       for creates, the new instance replaces {@code prior}; for destroys,
 *                          the destroyed instance is a replaced (deposed) one
 * @param changedAttributes attribute names whose value differs from {@code prior}
 */
public record PlannedAction(int stage,
                            ActionType type,
                            ResourceId resourceId,
                            Map<String, Object> attributes,
                            Map<String, Object> plannedAttributes,
                            Set<ResourceId> dependencies,
                            ResourceState prior,
                            String instanceId,
                            boolean replacement,
                            List<String> changedAttributes) {

    public PlannedAction {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(resourceId, "resourceId");
        attributes = References.immutableCopy(attributes);
        plannedAttributes = References.immutableCopy(plannedAttributes);
        dependencies = dependencies == null ? Set.of() : Set.copyOf(dependencies);
        changedAttributes = changedAttributes == null ? List.of() : List.copyOf(changedAttributes);
    }

    public ResourceKind kind() {
        return resourceId.kind();
    }

    public String describe() {
        String suffix = "";
        if (replacement) {
            suffix = type == ActionType.CREATE ? " (replacement)" : " (replaced instance " + instanceId + ")";
        }
        return type + " " + resourceId + suffix;
    }

    @Override
    public String toString() {
        return describe();
    }
}
