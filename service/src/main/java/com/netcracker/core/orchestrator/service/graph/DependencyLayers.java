package com.netcracker.core.orchestrator.service.graph;

import com.netcracker.core.orchestrator.model.ResourceId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of dependency resolution: independent groups of resources, dependencies first.
 */
public record DependencyLayers(List<List<ResourceId>> layers) {

    public DependencyLayers {
        layers = layers.stream().map(List::copyOf).toList();
    }

    public List<ResourceId> order() {
        return layers.stream().flatMap(List::stream).toList();
    }

    public Map<ResourceId, Integer> layerIndex() {
        Map<ResourceId, Integer> index = new HashMap<>();
        for (int i = 0; i < layers.size(); i++) {
            for (ResourceId id : layers.get(i)) {
                index.put(id, i);
            }
        }
        return index;
    }

    public List<List<ResourceId>> reversed() {
        List<List<ResourceId>> reversed = new ArrayList<>(layers);
        Collections.reverse(reversed);
        return List.copyOf(reversed);
    }
}
