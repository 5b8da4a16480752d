package com.netcracker.core.orchestrator.service.apply;

import com.netcracker.core.orchestrator.model.ResourceId;
import com.netcracker.core.orchestrator.service.plan.PlannedAction;
import com.netcracker.core.orchestrator.service.state.ResourceState;
import com.netcracker.core.orchestrator.service.state.StateSnapshot;
import com.netcracker.core.orchestrator.service.state.StateStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory copy of the state during one execution, written through to the {@link StateStore}
 * after every completed action. Read-modify-write cycles are serialized per resource only.
 */
final class StateLedger {
    private final StateStore store;
    private final Map<ResourceId, ResourceState> states = new ConcurrentHashMap<>();
    private final Map<ResourceId, Object> locks = new ConcurrentHashMap<>();

    StateLedger(StateStore store, StateSnapshot snapshot) {
        this.store = store;
        snapshot.states().forEach(state -> states.put(state.id(), state));
    }

    Optional<ResourceState> find(ResourceId id) {
        return Optional.ofNullable(states.get(id));
    }

    void commitCreated(PlannedAction action, Map<String, Object> attributes, Map<String, Object> outputs,
                       String providerId) {
        ResourceId id = action.resourceId();
        synchronized (lockFor(id)) {
            ResourceState existing = states.get(id);
            List<String> deposed = new ArrayList<>();
            if (existing != null) {
                deposed.addAll(existing.deposed());
                if (action.replacement()) {
                    deposed.add(existing.providerId());
                }
            }
            write(new ResourceState(id, providerId, attributes, outputs, action.dependencies(), deposed));
        }
    }

    void commitUpdated(PlannedAction action, Map<String, Object> attributes, Map<String, Object> outputs) {
        ResourceId id = action.resourceId();
        synchronized (lockFor(id)) {
            ResourceState existing = states.get(id);
            List<String> deposed = existing == null ? List.of() : existing.deposed();
            write(new ResourceState(id, action.instanceId(), attributes, outputs, action.dependencies(), deposed));
        }
    }

    void removeDeposed(ResourceId id, String instanceId) {
        synchronized (lockFor(id)) {
            ResourceState existing = states.get(id);
            if (existing != null && existing.deposed().contains(instanceId)) {
                write(existing.withoutDeposed(instanceId));
            }
        }
    }

    void remove(ResourceId id) {
        synchronized (lockFor(id)) {
            store.remove(id);
            states.remove(id);
        }
    }

    StateSnapshot snapshot() {
        return new StateSnapshot(states.values());
    }

    private void write(ResourceState state) {
        store.commit(state.id(), state);
        states.put(state.id(), state);
    }

    private Object lockFor(ResourceId id) {
        return locks.computeIfAbsent(id, key -> new Object());
    }
}
