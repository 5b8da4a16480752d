package com.netcracker.core.orchestrator.service.graph;

import com.netcracker.core.orchestrator.model.ResourceId;
import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

@Getter
public class CyclicDependencyException extends GraphValidationException {
    private final List<ResourceId> cycle;

    public CyclicDependencyException(List<ResourceId> cycle) {
        super("Dependency cycle detected: " + describe(cycle));
        this.cycle = List.copyOf(cycle);
    }

    private static String describe(List<ResourceId> cycle) {
        String path = cycle.stream().map(ResourceId::toString).collect(Collectors.joining(" -> "));
        return cycle.isEmpty() ? path : path + " -> " + cycle.get(0);
    }
}
