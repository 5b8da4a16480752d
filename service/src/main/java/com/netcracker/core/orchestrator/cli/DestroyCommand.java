package com.netcracker.core.orchestrator.cli;

import com.netcracker.core.orchestrator.service.Orchestrator;
import com.netcracker.core.orchestrator.service.graph.GraphValidationException;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "destroy", description = "Destroy every resource recorded in state, dependents first.")
@Slf4j
public class DestroyCommand implements Callable<Integer> {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private final Orchestrator orchestrator;
    private final PlanRenderer renderer;

    @Inject
    public DestroyCommand(Orchestrator orchestrator, PlanRenderer renderer) {
        this.orchestrator = orchestrator;
        this.renderer = renderer;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try {
            Orchestrator.ApplyResult result = orchestrator.destroy();
            out.print(renderer.renderPlan(result.plan()));
            if (!result.plan().isEmpty()) {
                out.print(renderer.renderReport(result.report()));
            }
            out.flush();
            return result.report().isSuccessful() ? ExitCodes.OK : ExitCodes.APPLY_FAILED;
        } catch (GraphValidationException e) {
            log.debug("Stored dependencies cannot be ordered", e);
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return ExitCodes.GRAPH_ERROR;
        }
    }
}
