package com.netcracker.core.orchestrator.service.state;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * On-disk layout of the file backend.
 */
public record StateDocument(@JsonProperty("version") int version,
                     @JsonProperty("resources") List<ResourceState> resources) {
    static final int CURRENT_VERSION = 1;

    public StateDocument {
        resources = resources == null ? List.of() : resources;
    }
}
