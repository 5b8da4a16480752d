package com.netcracker.core.orchestrator.service;

import com.netcracker.core.orchestrator.model.ResourceId;
import com.netcracker.core.orchestrator.model.References;
import com.netcracker.core.orchestrator.service.apply.ApplyReport;
import com.netcracker.core.orchestrator.service.apply.PlanExecutor;
import com.netcracker.core.orchestrator.service.graph.DeclarationReader;
import com.netcracker.core.orchestrator.service.graph.ResourceGraph;
import com.netcracker.core.orchestrator.service.graph.ResourceGraphBuilder;
import com.netcracker.core.orchestrator.service.plan.Plan;
import com.netcracker.core.orchestrator.service.plan.PlanGenerator;
import com.netcracker.core.orchestrator.service.plan.UnknownValue;
import com.netcracker.core.orchestrator.service.state.ResourceState;
import com.netcracker.core.orchestrator.service.state.StateSnapshot;
import com.netcracker.core.orchestrator.service.state.StateStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Runs the whole chain: read declarations, build and validate the graph, plan against the stored state
 * and, for {@code apply} and {@code destroy}, execute the plan.
 * Declaration problems surface as {@link com.netcracker.core.orchestrator.service.graph.GraphValidationException}
 * before any remote call.
 */
@ApplicationScoped
@Slf4j
public class Orchestrator {
    private final DeclarationReader declarationReader;
    private final ResourceGraphBuilder graphBuilder;
    private final PlanGenerator planGenerator;
    private final PlanExecutor planExecutor;
    private final StateStore stateStore;

    @Inject
    public Orchestrator(DeclarationReader declarationReader,
                        ResourceGraphBuilder graphBuilder,
                        PlanGenerator planGenerator,
                        PlanExecutor planExecutor,
                        StateStore stateStore) {
        this.declarationReader = declarationReader;
        this.graphBuilder = graphBuilder;
        this.planGenerator = planGenerator;
        this.planExecutor = planExecutor;
        this.stateStore = stateStore;
    }

    public PlanResult plan(Path declarations) {
        ResourceGraph graph = graphBuilder.build(declarationReader.read(declarations));
        StateSnapshot state = stateStore.load();
        return new PlanResult(graph, state, planGenerator.plan(graph, state));
    }

    public ApplyResult apply(Path declarations) {
        PlanResult planned = plan(declarations);
        if (planned.plan().isEmpty()) {
            log.info("No changes. Infrastructure matches the declarations.");
        }
        ApplyReport report = planExecutor.execute(planned.plan(), planned.state());
        return new ApplyResult(planned.plan(), report, resolveOutputs(planned.graph(), report.state()));
    }

    public ApplyResult destroy() {
        StateSnapshot state = stateStore.load();
        Plan plan = planGenerator.planDestroy(state);
        ApplyReport report = planExecutor.execute(plan, state);
        return new ApplyResult(plan, report, Map.of());
    }

    /**
     * Resolves declared outputs against committed state; values whose producer is missing stay unknown.
     */
    Map<String, Object> resolveOutputs(ResourceGraph graph, StateSnapshot state) {
        return References.substitute(graph.outputs(), reference -> {
            Optional<ResourceState> producer = state.find(ResourceId.parse(reference.targetKey()));
            if (producer.isEmpty() || !producer.get().has(reference.attribute())) {
                return UnknownValue.INSTANCE;
            }
            return producer.get().lookup(reference.attribute()).orElse(null);
        });
    }

    public record PlanResult(ResourceGraph graph, StateSnapshot state, Plan plan) {
    }

    public record ApplyResult(Plan plan, ApplyReport report, Map<String, Object> outputs) {
    }
}
