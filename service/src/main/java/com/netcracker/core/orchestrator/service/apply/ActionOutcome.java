package com.netcracker.core.orchestrator.service.apply;

import com.netcracker.core.orchestrator.service.plan.PlannedAction;

/**
 * What happened to one planned action.
 *
 * @param error the failure, only set for {@link ActionStatus#FAILED}
 */
public record ActionOutcome(PlannedAction action, ActionStatus status, Throwable error) {

    static ActionOutcome succeeded(PlannedAction action) {
        return new ActionOutcome(action, ActionStatus.SUCCEEDED, null);
    }

    static ActionOutcome failed(PlannedAction action, Throwable error) {
        return new ActionOutcome(action, ActionStatus.FAILED, error);
    }

    static ActionOutcome notAttempted(PlannedAction action) {
        return new ActionOutcome(action, ActionStatus.NOT_ATTEMPTED, null);
    }
}
