package com.netcracker.core.orchestrator.service.plan;

import com.netcracker.core.orchestrator.model.ResourceId;
import com.netcracker.core.orchestrator.service.graph.CyclicDependencyException;
import com.netcracker.core.orchestrator.service.graph.Declarations;
import com.netcracker.core.orchestrator.service.graph.DependencyResolver;
import com.netcracker.core.orchestrator.service.graph.ResourceGraph;
import com.netcracker.core.orchestrator.service.state.ResourceState;
import com.netcracker.core.orchestrator.service.state.StateSnapshot;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.netcracker.core.orchestrator.service.graph.Declarations.NETWORK;
import static com.netcracker.core.orchestrator.service.graph.Declarations.POLICY;
import static com.netcracker.core.orchestrator.service.graph.Declarations.REGISTRY;
import static com.netcracker.core.orchestrator.service.graph.Declarations.ROLE;
import static com.netcracker.core.orchestrator.service.graph.Declarations.SERVICE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PlanGeneratorTest {

    private final PlanGenerator generator = new PlanGenerator(new DependencyResolver());

    @Test
    void planShouldCreateEverythingInDependencyOrderOnEmptyState() {
        Plan plan = generator.plan(Declarations.webStack().graph(), StateSnapshot.empty());

        assertThat(plan.actions()).extracting(PlannedAction::resourceId)
                .containsExactly(NETWORK, ROLE, REGISTRY, POLICY, SERVICE);
        assertThat(plan.actions()).extracting(PlannedAction::type).containsOnly(ActionType.CREATE);
        assertThat(plan.actions()).extracting(PlannedAction::stage).containsExactly(0, 0, 0, 1, 2);
        assertThat(plan.stages()).hasSize(3);
        assertThat(plan.actions().get(3).plannedAttributes()).containsEntry("network_id", UnknownValue.INSTANCE);
        assertThat(plan.actions().get(3).attributes()).containsEntry("network_id", "${network.main.id}");
    }

    @Test
    void planShouldBeEmptyWhenStateMatchesDeclarations() {
        ResourceGraph graph = networkAndPolicy("10.0.0.0/16");
        StateSnapshot state = new StateSnapshot(List.of(
                state(NETWORK, "net-1", Map.of("cidr_block", "10.0.0.0/16"), Map.of("id", "net-1")),
                state(POLICY, "net-1/web", Map.of("network_id", "net-1", "ingress_ports", List.of(3000)),
                        Map.of("id", "net-1/web"), NETWORK)));

        Plan plan = generator.plan(graph, state);

        assertThat(plan.isEmpty()).isTrue();
    }

    @Test
    void planShouldUpdateInPlaceWhenPolicyAllows() {
        ResourceGraph graph = Declarations.builder()
                .add("compute-service", "web", Map.of("image", "app:2.0", "port", 3000))
                .graph();
        ResourceState prior = state(SERVICE, "ns/web-1", Map.of("image", "app:1.0", "port", 3000),
                Map.of("id", "ns/web-1"));

        Plan plan = generator.plan(graph, new StateSnapshot(List.of(prior)));

        assertThat(plan.actions()).singleElement().satisfies(action -> {
            assertThat(action.type()).isEqualTo(ActionType.UPDATE);
            assertThat(action.instanceId()).isEqualTo("ns/web-1");
            assertThat(action.changedAttributes()).containsExactly("image");
            assertThat(action.prior()).isEqualTo(prior);
            assertThat(action.replacement()).isFalse();
        });
    }

    @Test
    void planShouldTreatRemovedAttributeAsChange() {
        ResourceGraph graph = Declarations.builder()
                .add("compute-service", "web", Map.of("image", "app:1.0"))
                .graph();
        ResourceState prior = state(SERVICE, "ns/web-1", Map.of("image", "app:1.0", "replicas", 2),
                Map.of("id", "ns/web-1"));

        Plan plan = generator.plan(graph, new StateSnapshot(List.of(prior)));

        assertThat(plan.actions()).singleElement()
                .satisfies(action -> assertThat(action.changedAttributes()).containsExactly("replicas"));
    }

    @Test
    void planShouldUpdateNetworkTagsInPlace() {
        ResourceGraph graph = Declarations.builder()
                .add("network", "main", Map.of("cidr_block", "10.0.0.0/16", "tags", Map.of("env", "prod")))
                .graph();
        ResourceState prior = state(NETWORK, "net-1", Map.of("cidr_block", "10.0.0.0/16"), Map.of("id", "net-1"));

        Plan plan = generator.plan(graph, new StateSnapshot(List.of(prior)));

        assertThat(plan.actions()).singleElement()
                .satisfies(action -> assertThat(action.type()).isEqualTo(ActionType.UPDATE));
    }

    @Test
    void planShouldReplaceBeforeDestroyingAndCascadeUnknownValues() {
        ResourceGraph graph = networkAndPolicy("10.1.0.0/16");
        StateSnapshot state = new StateSnapshot(List.of(
                state(NETWORK, "net-1", Map.of("cidr_block", "10.0.0.0/16"), Map.of("id", "net-1")),
                state(POLICY, "net-1/web", Map.of("network_id", "net-1", "ingress_ports", List.of(3000)),
                        Map.of("id", "net-1/web"), NETWORK)));

        Plan plan = generator.plan(graph, state);

        assertThat(plan.actions()).extracting(PlannedAction::describe).containsExactly(
                "create network.main (replacement)",
                "create security-policy.web (replacement)",
                "destroy security-policy.web (replaced instance net-1/web)",
                "destroy network.main (replaced instance net-1)");
        assertThat(plan.actions()).extracting(PlannedAction::stage).containsExactly(0, 1, 2, 3);
        assertThat(plan.replacements()).isEqualTo(2);
        assertThat(plan.count(ActionType.DESTROY)).isEqualTo(2);
    }

    @Test
    void planShouldUpdateConsumersOfResourceUpdatedInPlace() {
        ResourceGraph graph = Declarations.builder()
                .add("registry", "app", Map.of("host", "registry.other"))
                .add("compute-service", "web", Map.of("image", "${registry.app.repository_url}:1.0.0"))
                .graph();
        StateSnapshot state = new StateSnapshot(List.of(
                state(REGISTRY, "ns/app-1", Map.of("host", "registry.local"),
                        Map.of("id", "ns/app-1", "repository_url", "registry.local/app")),
                state(SERVICE, "ns/web-1", Map.of("image", "registry.local/app:1.0.0"),
                        Map.of("id", "ns/web-1"), REGISTRY)));

        Plan plan = generator.plan(graph, state);

        assertThat(plan.actions()).extracting(PlannedAction::describe)
                .containsExactly("update registry.app", "update compute-service.web");
        assertThat(plan.actions()).extracting(PlannedAction::stage).containsExactly(0, 1);
        assertThat(plan.actions().get(1).plannedAttributes()).containsEntry("image", "(known after apply):1.0.0");
        assertThat(plan.actions().get(1).instanceId()).isEqualTo("ns/web-1");
    }

    @Test
    void planShouldKeepConsumerWhenProducerIsOnlyUpdatedInPlace() {
        ResourceGraph graph = Declarations.builder()
                .add("network", "main", Map.of("cidr_block", "10.0.0.0/16", "tags", Map.of("env", "prod")))
                .add("security-policy", "web", Map.of(
                        "network_id", "${network.main.id}",
                        "ingress_ports", List.of(3000)))
                .graph();
        StateSnapshot state = new StateSnapshot(List.of(
                state(NETWORK, "net-1", Map.of("cidr_block", "10.0.0.0/16"), Map.of("id", "net-1")),
                state(POLICY, "net-1/web", Map.of("network_id", "net-1", "ingress_ports", List.of(3000)),
                        Map.of("id", "net-1/web"), NETWORK)));

        Plan plan = generator.plan(graph, state);

        assertThat(plan.actions()).extracting(PlannedAction::describe)
                .containsExactly("update network.main", "update security-policy.web");
        assertThat(plan.replacements()).isZero();
        assertThat(plan.count(ActionType.DESTROY)).isZero();
    }

    @Test
    void planShouldReplaceNamespacedResourceWhenItsNamespaceChanges() {
        ResourceGraph graph = Declarations.builder()
                .add("registry", "app", Map.of("host", "registry.local", "namespace", "ops"))
                .graph();
        ResourceState prior = state(REGISTRY, "default/app-1", Map.of("host", "registry.local", "namespace", "default"),
                Map.of("id", "default/app-1"));

        Plan plan = generator.plan(graph, new StateSnapshot(List.of(prior)));

        assertThat(plan.actions()).extracting(PlannedAction::describe).containsExactly(
                "create registry.app (replacement)",
                "destroy registry.app (replaced instance default/app-1)");
    }

    @Test
    void planShouldReplaceNamespacedResourceWhenItsNameChanges() {
        ResourceGraph graph = Declarations.builder()
                .add("compute-service", "web", Map.of("name", "web-v2", "image", "app:1.0"))
                .graph();
        ResourceState prior = state(SERVICE, "ns/web-1", Map.of("name", "web", "image", "app:1.0"),
                Map.of("id", "ns/web-1"));

        Plan plan = generator.plan(graph, new StateSnapshot(List.of(prior)));

        assertThat(plan.actions()).extracting(PlannedAction::type)
                .containsExactly(ActionType.CREATE, ActionType.DESTROY);
        assertThat(plan.replacements()).isEqualTo(1);
    }

    @Test
    void planShouldDestroyRemovedChainInReverseOrder() {
        ResourceId a = ResourceId.parse("registry.a");
        ResourceId b = ResourceId.parse("registry.b");
        ResourceId c = ResourceId.parse("registry.c");
        StateSnapshot state = new StateSnapshot(List.of(
                state(c, "c-1", Map.of(), Map.of("id", "c-1"), b),
                state(a, "a-1", Map.of(), Map.of("id", "a-1")),
                state(b, "b-1", Map.of(), Map.of("id", "b-1"), a)));

        Plan plan = generator.plan(Declarations.builder().graph(), state);

        assertThat(plan.actions()).extracting(PlannedAction::resourceId).containsExactly(c, b, a);
        assertThat(plan.actions()).extracting(PlannedAction::instanceId).containsExactly("c-1", "b-1", "a-1");
        assertThat(plan.actions()).extracting(PlannedAction::stage).containsExactly(0, 1, 2);
        assertThat(plan.actions()).allSatisfy(action -> assertThat(action.replacement()).isFalse());
    }

    @Test
    void planShouldDestroyRemovedResourcesAfterCreates() {
        ResourceGraph graph = Declarations.builder()
                .add("network", "main", Map.of())
                .graph();
        StateSnapshot state = new StateSnapshot(List.of(
                state(REGISTRY, "ns/app-1", Map.of(), Map.of("id", "ns/app-1"))));

        Plan plan = generator.plan(graph, state);

        assertThat(plan.actions()).extracting(PlannedAction::describe)
                .containsExactly("create network.main", "destroy registry.app");
        assertThat(plan.actions().get(1).stage()).isGreaterThan(plan.actions().get(0).stage());
    }

    @Test
    void planShouldDestroyLeftoverDeposedInstances() {
        ResourceGraph graph = Declarations.builder()
                .add("network", "main", Map.of("cidr_block", "10.0.0.0/16"))
                .graph();
        ResourceState current = state(NETWORK, "net-2", Map.of("cidr_block", "10.0.0.0/16"), Map.of("id", "net-2"))
                .withDeposed("net-1");

        Plan plan = generator.plan(graph, new StateSnapshot(List.of(current)));

        assertThat(plan.actions()).singleElement().satisfies(action -> {
            assertThat(action.type()).isEqualTo(ActionType.DESTROY);
            assertThat(action.instanceId()).isEqualTo("net-1");
            assertThat(action.replacement()).isTrue();
        });
    }

    @Test
    void planShouldRejectCycleBeforeComparingState() {
        ResourceGraph graph = Declarations.builder()
                .add("registry", "a", Map.of("peer", "${registry.b.id}"))
                .add("registry", "b", Map.of("peer", "${registry.a.id}"))
                .graph();

        assertThatThrownBy(() -> generator.plan(graph, StateSnapshot.empty()))
                .isInstanceOf(CyclicDependencyException.class);
    }

    @Test
    void planDestroyShouldRemoveEverythingDependentsFirst() {
        StateSnapshot state = new StateSnapshot(List.of(
                state(NETWORK, "net-1", Map.of(), Map.of("id", "net-1")),
                state(POLICY, "net-1/web", Map.of(), Map.of("id", "net-1/web"), NETWORK),
                state(SERVICE, "net-1/web-svc", Map.of(), Map.of("id", "net-1/web-svc"), NETWORK, POLICY)
                        .withDeposed("net-1/old-svc")));

        Plan plan = generator.planDestroy(state);

        assertThat(plan.actions()).extracting(PlannedAction::instanceId)
                .containsExactly("net-1/web-svc", "net-1/old-svc", "net-1/web", "net-1");
        assertThat(plan.actions()).extracting(PlannedAction::stage).containsExactly(0, 0, 1, 2);
        assertThat(plan.stages()).hasSize(3);
    }

    @Test
    void planDestroyShouldBeEmptyForEmptyState() {
        assertThat(generator.planDestroy(StateSnapshot.empty()).isEmpty()).isTrue();
    }

    private static ResourceGraph networkAndPolicy(String cidr) {
        return Declarations.builder()
                .add("network", "main", Map.of("cidr_block", cidr))
                .add("security-policy", "web", Map.of(
                        "network_id", "${network.main.id}",
                        "ingress_ports", List.of(3000)))
                .graph();
    }

    static ResourceState state(ResourceId id, String providerId, Map<String, Object> attributes,
                               Map<String, Object> outputs, ResourceId... dependencies) {
        return new ResourceState(id, providerId, attributes, outputs, Set.of(dependencies), List.of());
    }
}
