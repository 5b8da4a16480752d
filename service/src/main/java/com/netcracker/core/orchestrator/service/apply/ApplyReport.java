package com.netcracker.core.orchestrator.service.apply;

import com.netcracker.core.orchestrator.service.state.StateSnapshot;

import java.util.List;

/**
 * Outcome of every action of a plan, in plan order, plus the state left behind.
 *
 * @param cancelled whether execution was stopped by {@link PlanExecutor#cancel()} or by shutdown
 */
public record ApplyReport(List<ActionOutcome> outcomes, StateSnapshot state, boolean cancelled) {

    public ApplyReport {
        outcomes = List.copyOf(outcomes);
    }

    public boolean isSuccessful() {
        return !cancelled && outcomes.stream().allMatch(outcome -> outcome.status() == ActionStatus.SUCCEEDED);
    }

    public List<ActionOutcome> withStatus(ActionStatus status) {
        return outcomes.stream().filter(outcome -> outcome.status() == status).toList();
    }
}
