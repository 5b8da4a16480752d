package com.netcracker.core.orchestrator.service.graph;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * A resource as written in the declaration document, before validation.
 */
public record ResourceDeclaration(@JsonProperty("type") String type,
                                  @JsonProperty("name") String name,
                                  @JsonProperty("attributes") Map<String, Object> attributes,
                                  @JsonProperty("depends_on") List<String> dependsOn) {

    public ResourceDeclaration {
        attributes = attributes == null ? Map.of() : attributes;
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
    }
}
