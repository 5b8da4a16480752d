package com.netcracker.core.orchestrator.cli;

import com.netcracker.core.orchestrator.service.apply.ActionOutcome;
import com.netcracker.core.orchestrator.service.apply.ActionStatus;
import com.netcracker.core.orchestrator.service.apply.ApplyReport;
import com.netcracker.core.orchestrator.service.plan.ActionType;
import com.netcracker.core.orchestrator.service.plan.Plan;
import com.netcracker.core.orchestrator.service.plan.PlannedAction;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.Map;

/**
 * Human readable rendering of plans and apply results.
 */
@ApplicationScoped
public class PlanRenderer {

    public String renderPlan(Plan plan) {
        if (plan.isEmpty()) {
            return "No changes. Infrastructure matches the declarations.\n";
        }
        StringBuilder out = new StringBuilder();
        for (PlannedAction action : plan.actions()) {
            out.append("  ").append(symbol(action)).append(' ').append(action.describe()).append('\n');
            switch (action.type()) {
                case CREATE -> action.plannedAttributes().forEach((name, value) ->
                        out.append("      ").append(name).append(" = ").append(format(value)).append('\n'));
                case UPDATE -> action.changedAttributes().forEach(name ->
                        out.append("      ").append(name).append(": ")
                                .append(format(action.prior().attributes().get(name)))
                                .append(" -> ")
                                .append(format(action.plannedAttributes().get(name)))
                                .append('\n'));
                default -> {
                    // destroys have no attributes to show
                }
            }
        }
        out.append(String.format("Plan: %d to create (%d replacements), %d to update, %d to destroy.%n",
                plan.count(ActionType.CREATE), plan.replacements(),
                plan.count(ActionType.UPDATE), plan.count(ActionType.DESTROY)));
        return out.toString();
    }

    public String renderReport(ApplyReport report) {
        StringBuilder out = new StringBuilder();
        for (ActionOutcome outcome : report.outcomes()) {
            out.append(String.format("  %-13s %s", outcome.status(), outcome.action().describe()));
            if (outcome.error() != null) {
                out.append(": ").append(outcome.error().getMessage());
            }
            out.append('\n');
        }
        if (report.cancelled()) {
            out.append("Apply was cancelled; completed actions are recorded in state.\n");
        }
        out.append(String.format("Apply %s: %d succeeded, %d failed, %d not attempted.%n",
                report.isSuccessful() ? "complete" : "incomplete",
                report.withStatus(ActionStatus.SUCCEEDED).size(),
                report.withStatus(ActionStatus.FAILED).size(),
                report.withStatus(ActionStatus.NOT_ATTEMPTED).size()));
        return out.toString();
    }

    public String renderOutputs(Map<String, Object> outputs) {
        if (outputs.isEmpty()) {
            return "";
        }
        StringBuilder out = new StringBuilder("Outputs:\n");
        outputs.forEach((name, value) -> out.append("  ").append(name).append(" = ").append(format(value)).append('\n'));
        return out.toString();
    }

    private static String symbol(PlannedAction action) {
        if (action.replacement()) {
            return action.type() == ActionType.CREATE ? "+/-" : "-/+";
        }
        return action.type().symbol();
    }

    private static String format(Object value) {
        return value instanceof String ? "\"" + value + "\"" : String.valueOf(value);
    }
}
