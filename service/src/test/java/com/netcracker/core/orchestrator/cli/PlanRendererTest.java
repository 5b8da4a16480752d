package com.netcracker.core.orchestrator.cli;

import com.netcracker.core.orchestrator.model.ResourceId;
import com.netcracker.core.orchestrator.service.apply.ActionOutcome;
import com.netcracker.core.orchestrator.service.apply.ActionStatus;
import com.netcracker.core.orchestrator.service.apply.ApplyReport;
import com.netcracker.core.orchestrator.service.plan.ActionType;
import com.netcracker.core.orchestrator.service.plan.Plan;
import com.netcracker.core.orchestrator.service.plan.PlannedAction;
import com.netcracker.core.orchestrator.service.plan.UnknownValue;
import com.netcracker.core.orchestrator.service.provider.ProviderActionException;
import com.netcracker.core.orchestrator.service.state.ResourceState;
import com.netcracker.core.orchestrator.service.state.StateSnapshot;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class PlanRendererTest {

    static final ResourceId NETWORK = ResourceId.parse("network.main");
    static final ResourceId SERVICE = ResourceId.parse("compute-service.web");
    static final ResourceId REGISTRY = ResourceId.parse("registry.old");

    private final PlanRenderer renderer = new PlanRenderer();

    @Test
    void renderPlanShouldListActionsAndSummary() {
        String text = renderer.renderPlan(samplePlan());

        assertThat(text).contains(
                "  +/- create network.main (replacement)",
                "      cidr_block = \"10.1.0.0/16\"",
                "  ~ update compute-service.web",
                "      image: \"app:1\" -> \"app:2\"",
                "      network_id: \"net-1\" -> (known after apply)",
                "  - destroy registry.old",
                "Plan: 1 to create (1 replacements), 1 to update, 1 to destroy.");
    }

    @Test
    void renderPlanShouldReportNoChanges() {
        assertThat(renderer.renderPlan(Plan.empty())).startsWith("No changes.");
    }

    @Test
    void renderReportShouldShowStatusAndErrors() {
        List<PlannedAction> actions = samplePlan().actions();
        ApplyReport report = new ApplyReport(List.of(
                new ActionOutcome(actions.get(0), ActionStatus.SUCCEEDED, null),
                new ActionOutcome(actions.get(1), ActionStatus.FAILED, new ProviderActionException("quota exceeded")),
                new ActionOutcome(actions.get(2), ActionStatus.NOT_ATTEMPTED, null)),
                StateSnapshot.empty(), false);

        String text = renderer.renderReport(report);

        assertThat(text).contains(
                "SUCCEEDED     create network.main (replacement)",
                "FAILED        update compute-service.web: quota exceeded",
                "NOT_ATTEMPTED destroy registry.old",
                "Apply incomplete: 1 succeeded, 1 failed, 1 not attempted.");
    }

    @Test
    void renderOutputsShouldQuoteStrings() {
        Map<String, Object> outputs = new LinkedHashMap<>();
        outputs.put("url", "http://web:3000");
        outputs.put("replicas", 2);

        assertThat(renderer.renderOutputs(outputs)).isEqualTo("Outputs:\n  url = \"http://web:3000\"\n  replicas = 2\n");
        assertThat(renderer.renderOutputs(Map.of())).isEmpty();
    }

    static Plan samplePlan() {
        ResourceState network = new ResourceState(NETWORK, "net-1", Map.of("cidr_block", "10.0.0.0/16"),
                Map.of("id", "net-1"), Set.of(), List.of());
        ResourceState service = new ResourceState(SERVICE, "net-1/web", Map.of("image", "app:1", "network_id", "net-1"),
                Map.of("id", "net-1/web"), Set.of(NETWORK), List.of());
        ResourceState registry = new ResourceState(REGISTRY, "ops/old", Map.of(), Map.of("id", "ops/old"),
                Set.of(), List.of());

        Map<String, Object> planned = new LinkedHashMap<>();
        planned.put("image", "app:2");
        planned.put("network_id", UnknownValue.INSTANCE);

        return new Plan(List.of(
                new PlannedAction(0, ActionType.CREATE, NETWORK, Map.of("cidr_block", "10.1.0.0/16"),
                        Map.of("cidr_block", "10.1.0.0/16"), Set.of(), network, null, true, List.of("cidr_block")),
                new PlannedAction(1, ActionType.UPDATE, SERVICE,
                        Map.of("image", "app:2", "network_id", "${network.main.id}"), planned, Set.of(NETWORK),
                        service, "net-1/web", false, List.of("image", "network_id")),
                new PlannedAction(2, ActionType.DESTROY, REGISTRY, Map.of(), Map.of(), Set.of(), registry,
                        "ops/old", false, List.of())));
    }
}
