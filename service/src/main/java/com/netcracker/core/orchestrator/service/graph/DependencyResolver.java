package com.netcracker.core.orchestrator.service.graph;

import com.netcracker.core.orchestrator.model.ResourceId;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Orders resources so that every resource comes after everything it depends on.
 * <p>
 * Uses Kahn's algorithm, peeling the graph into layers: a layer holds every resource whose
 * dependencies all sit in earlier layers, so members of one layer are independent of each other.
 * Inside a layer the input order is kept, which makes the result deterministic.
 */
@ApplicationScoped
@Slf4j
public class DependencyResolver {

    public DependencyLayers resolve(ResourceGraph graph) {
        return resolve(graph.ids(), graph.dependencies());
    }

    /**
     * Layers the given nodes. Dependencies on ids outside {@code nodes} are ignored.
     *
     * @throws CyclicDependencyException if the nodes cannot be ordered
     */
    public DependencyLayers resolve(Collection<ResourceId> nodes, Map<ResourceId, Set<ResourceId>> dependencies) {
        Set<ResourceId> remaining = new LinkedHashSet<>(nodes);
        Map<ResourceId, Integer> inDegree = new HashMap<>();
        Map<ResourceId, List<ResourceId>> dependents = new HashMap<>();
        for (ResourceId node : remaining) {
            int degree = 0;
            for (ResourceId dependency : dependencies.getOrDefault(node, Set.of())) {
                if (remaining.contains(dependency)) {
                    degree++;
                    dependents.computeIfAbsent(dependency, k -> new ArrayList<>()).add(node);
                }
            }
            inDegree.put(node, degree);
        }

        List<List<ResourceId>> layers = new ArrayList<>();
        while (!remaining.isEmpty()) {
            List<ResourceId> layer = remaining.stream()
                    .filter(node -> inDegree.get(node) == 0)
                    .toList();
            if (layer.isEmpty()) {
                throw new CyclicDependencyException(findCycle(remaining, dependencies));
            }
            for (ResourceId node : layer) {
                remaining.remove(node);
                for (ResourceId dependent : dependents.getOrDefault(node, List.of())) {
                    inDegree.merge(dependent, -1, Integer::sum);
                }
            }
            layers.add(layer);
        }

        log.debug("Resolved {} resources into {} layers", nodes.size(), layers.size());
        return new DependencyLayers(layers);
    }

    // every remaining node has a remaining dependency, so walking them must revisit a node
    private static List<ResourceId> findCycle(Set<ResourceId> remaining, Map<ResourceId, Set<ResourceId>> dependencies) {
        Map<ResourceId, Integer> visitedAt = new LinkedHashMap<>();
        List<ResourceId> path = new ArrayList<>();
        ResourceId current = remaining.iterator().next();
        while (!visitedAt.containsKey(current)) {
            visitedAt.put(current, path.size());
            path.add(current);
            current = dependencies.getOrDefault(current, Set.of()).stream()
                    .filter(remaining::contains)
                    .findFirst()
                    .orElseThrow(() -> new IllegalStateException("Kahn's algorithm stalled without a cycle"));
        }
        return path.subList(visitedAt.get(current), path.size());
    }
}
