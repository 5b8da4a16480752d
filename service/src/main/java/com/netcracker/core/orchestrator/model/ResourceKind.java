package com.netcracker.core.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Kinds of resources the orchestrator provisions, together with the way each kind reacts to changes.
 * Attributes that name an instance or pick its namespace always force a replacement.
 */
public enum ResourceKind {
    NETWORK("network", UpdatePolicy.replaceExcept("tags")),
    SECURITY_POLICY("security-policy", UpdatePolicy.inPlaceExcept("name", "namespace", "network_id")),
    IDENTITY_ROLE("identity-role", UpdatePolicy.replaceExcept("tags")),
    REGISTRY("registry", UpdatePolicy.inPlaceExcept("name", "namespace", "network_id")),
    COMPUTE_SERVICE("compute-service", UpdatePolicy.inPlaceExcept("name", "namespace", "network_id"));

    private final String typeName;
    private final UpdatePolicy updatePolicy;

    ResourceKind(String typeName, UpdatePolicy updatePolicy) {
        this.typeName = typeName;
        this.updatePolicy = updatePolicy;
    }

    @JsonValue
    public String typeName() {
        return typeName;
    }

    public UpdatePolicy updatePolicy() {
        return updatePolicy;
    }

    public static Optional<ResourceKind> fromTypeName(String typeName) {
        return Arrays.stream(values())
                .filter(kind -> kind.typeName.equals(typeName))
                .findFirst();
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    static ResourceKind of(String typeName) {
        return fromTypeName(typeName)
                .orElseThrow(() -> new IllegalArgumentException("Unknown resource type: " + typeName));
    }

    @Override
    public String toString() {
        return typeName;
    }
}
