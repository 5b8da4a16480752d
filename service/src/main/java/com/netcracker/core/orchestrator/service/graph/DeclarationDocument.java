package com.netcracker.core.orchestrator.service.graph;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Top level of a declaration file: the resources and the named values reported after apply.
 */
public record DeclarationDocument(@JsonProperty("resources") List<ResourceDeclaration> resources,
                                  @JsonProperty("outputs") Map<String, Object> outputs) {

    public DeclarationDocument {
        resources = resources == null ? List.of() : resources;
        outputs = outputs == null ? Map.of() : outputs;
    }
}
