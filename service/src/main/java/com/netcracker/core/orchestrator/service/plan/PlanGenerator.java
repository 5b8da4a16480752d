package com.netcracker.core.orchestrator.service.plan;

import com.netcracker.core.orchestrator.model.Reference;
import com.netcracker.core.orchestrator.model.References;
import com.netcracker.core.orchestrator.model.Resource;
import com.netcracker.core.orchestrator.model.ResourceId;
import com.netcracker.core.orchestrator.service.graph.DependencyLayers;
import com.netcracker.core.orchestrator.service.graph.DependencyResolver;
import com.netcracker.core.orchestrator.service.graph.ResourceGraph;
import com.netcracker.core.orchestrator.service.state.ResourceState;
import com.netcracker.core.orchestrator.service.state.StateSnapshot;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Diffs the desired graph against stored state.
 * <p>
 * Creates and updates are staged by dependency layer. A resource referring to one that is updated in
 * place is updated too, with the reference resolved from the committed state at apply time.
 * Destroys, including the old halves of replacements, follow in the reverse layering of the stored
 * dependency graph, so an instance is only destroyed once nothing live refers to it any more.
 */
@ApplicationScoped
@Slf4j
public class PlanGenerator {
    private final DependencyResolver dependencyResolver;

    @Inject
    public PlanGenerator(DependencyResolver dependencyResolver) {
        this.dependencyResolver = dependencyResolver;
    }

    public Plan plan(ResourceGraph desired, StateSnapshot state) {
        DependencyLayers layers = dependencyResolver.resolve(desired);
        List<PlannedAction> actions = new ArrayList<>();
        List<DestroyTarget> destroyTargets = new ArrayList<>();
        Set<ResourceId> pending = new HashSet<>();
        Set<ResourceId> updated = new HashSet<>();

        for (int stage = 0; stage < layers.layers().size(); stage++) {
            for (ResourceId id : layers.layers().get(stage)) {
                Resource resource = desired.resource(id);
                Map<String, Object> planned = References.substitute(resource.attributes(),
                        reference -> plannedValue(reference, state, pending, updated));
                Set<ResourceId> dependencies = desired.dependenciesOf(id);
                Optional<ResourceState> prior = state.find(id);

                if (prior.isEmpty()) {
                    actions.add(new PlannedAction(stage, ActionType.CREATE, id, resource.attributes(), planned,
                            dependencies, null, null, false, List.copyOf(planned.keySet())));
                    pending.add(id);
                    continue;
                }

                ResourceState current = prior.get();
                List<String> changed = changedAttributes(planned, current.attributes());
                if (changed.isEmpty()) {
                    continue;
                }
                if (id.kind().updatePolicy().requiresReplacement(replacingChanges(resource, state, pending, current))) {
                    actions.add(new PlannedAction(stage, ActionType.CREATE, id, resource.attributes(), planned,
                            dependencies, current, null, true, changed));
                    destroyTargets.add(new DestroyTarget(id, current.providerId(), true, current));
                    pending.add(id);
                } else {
                    actions.add(new PlannedAction(stage, ActionType.UPDATE, id, resource.attributes(), planned,
                            dependencies, current, current.providerId(), false, changed));
                    updated.add(id);
                }
            }
        }

        for (ResourceState current : state.states()) {
            if (!desired.contains(current.id())) {
                destroyTargets.add(new DestroyTarget(current.id(), current.providerId(), false, current));
            }
        }
        addDeposed(state, destroyTargets);
        actions.addAll(orderDestroys(state, destroyTargets, layers.layers().size()));

        Plan plan = new Plan(actions);
        log.info("Planned {} to create, {} to update, {} to destroy",
                plan.count(ActionType.CREATE), plan.count(ActionType.UPDATE), plan.count(ActionType.DESTROY));
        return plan;
    }

    /**
     * Plans the removal of everything recorded in state.
     */
    public Plan planDestroy(StateSnapshot state) {
        List<DestroyTarget> destroyTargets = new ArrayList<>();
        for (ResourceState current : state.states()) {
            destroyTargets.add(new DestroyTarget(current.id(), current.providerId(), false, current));
        }
        addDeposed(state, destroyTargets);
        Plan plan = new Plan(orderDestroys(state, destroyTargets, 0));
        log.info("Planned {} to destroy", plan.count(ActionType.DESTROY));
        return plan;
    }

    private static void addDeposed(StateSnapshot state, List<DestroyTarget> destroyTargets) {
        for (ResourceState current : state.states()) {
            for (String deposedId : current.deposed()) {
                destroyTargets.add(new DestroyTarget(current.id(), deposedId, true, current));
            }
        }
    }

    private List<PlannedAction> orderDestroys(StateSnapshot state, List<DestroyTarget> targets, int firstStage) {
        if (targets.isEmpty()) {
            return List.of();
        }
        Set<ResourceId> affected = new LinkedHashSet<>();
        targets.forEach(target -> affected.add(target.resourceId()));
        List<ResourceId> nodes = state.ids().stream().filter(affected::contains).toList();
        List<List<ResourceId>> reversed = dependencyResolver.resolve(nodes, state.dependencies()).reversed();

        List<PlannedAction> destroys = new ArrayList<>();
        for (int i = 0; i < reversed.size(); i++) {
            int stage = firstStage + i;
            for (ResourceId id : reversed.get(i)) {
                for (DestroyTarget target : targets) {
                    if (target.resourceId().equals(id)) {
                        destroys.add(new PlannedAction(stage, ActionType.DESTROY, id, Map.of(), Map.of(),
                                target.prior().dependencies(), target.prior(), target.instanceId(),
                                target.replacement(), List.of()));
                    }
                }
            }
        }
        return destroys;
    }

    /**
     * Outputs of resources created, replaced or updated earlier in the same plan are unknown until apply.
     */
    private static Object plannedValue(Reference reference,
                                       StateSnapshot state,
                                       Set<ResourceId> pending,
                                       Set<ResourceId> updated) {
        ResourceId target = ResourceId.parse(reference.targetKey());
        if (pending.contains(target) || updated.contains(target)) {
            return UnknownValue.INSTANCE;
        }
        Optional<ResourceState> producer = state.find(target);
        if (producer.isEmpty() || !producer.get().has(reference.attribute())) {
            return UnknownValue.INSTANCE;
        }
        return producer.get().lookup(reference.attribute()).orElse(null);
    }

    /**
     * Changes that decide between update and replacement. A producer updated in place keeps its identity,
     * so its stored outputs stand in for the values it will report after apply.
     */
    private static List<String> replacingChanges(Resource resource,
                                                 StateSnapshot state,
                                                 Set<ResourceId> pending,
                                                 ResourceState current) {
        Map<String, Object> stable = References.substitute(resource.attributes(),
                reference -> plannedValue(reference, state, pending, Set.of()));
        return changedAttributes(stable, current.attributes());
    }

    private static List<String> changedAttributes(Map<String, Object> planned, Map<String, Object> applied) {
        Set<String> names = new LinkedHashSet<>(planned.keySet());
        names.addAll(applied.keySet());
        return names.stream()
                .filter(name -> !planned.containsKey(name)
                                || !applied.containsKey(name)
                                || !Objects.equals(planned.get(name), applied.get(name)))
                .toList();
    }

    private record DestroyTarget(ResourceId resourceId, String instanceId, boolean replacement, ResourceState prior) {
    }
}
