package com.netcracker.core.orchestrator.service.graph;

import com.netcracker.core.orchestrator.model.ResourceId;
import lombok.Getter;

@Getter
public class DuplicateResourceException extends GraphValidationException {
    private final ResourceId resourceId;

    public DuplicateResourceException(ResourceId resourceId) {
        super("Resource '" + resourceId + "' is declared more than once");
        this.resourceId = resourceId;
    }
}
