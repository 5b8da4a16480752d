package com.netcracker.core.orchestrator.service.plan;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered actions reconciling desired and stored state. Never persisted.
 * <p>
 * Actions are sorted by stage. Every action's dependencies are handled in earlier stages, and all
 * destroys come after all creates and updates.
 */
public record Plan(List<PlannedAction> actions) {

    public Plan {
        actions = List.copyOf(actions);
    }

    public static Plan empty() {
        return new Plan(List.of());
    }

    public boolean isEmpty() {
        return actions.isEmpty();
    }

    public int size() {
        return actions.size();
    }

    public List<List<PlannedAction>> stages() {
        List<List<PlannedAction>> stages = new ArrayList<>();
        List<PlannedAction> current = new ArrayList<>();
        int currentStage = Integer.MIN_VALUE;
        for (PlannedAction action : actions) {
            if (action.stage() != currentStage && !current.isEmpty()) {
                stages.add(List.copyOf(current));
                current.clear();
            }
            currentStage = action.stage();
            current.add(action);
        }
        if (!current.isEmpty()) {
            stages.add(List.copyOf(current));
        }
        return stages;
    }

    public long count(ActionType type) {
        return actions.stream().filter(action -> action.type() == type).count();
    }

    public long replacements() {
        return actions.stream()
                .filter(action -> action.type() == ActionType.CREATE && action.replacement())
                .count();
    }
}
