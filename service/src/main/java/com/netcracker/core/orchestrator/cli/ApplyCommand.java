package com.netcracker.core.orchestrator.cli;

import com.netcracker.core.orchestrator.service.Orchestrator;
import com.netcracker.core.orchestrator.service.graph.GraphValidationException;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "apply", description = "Plan and execute the actions needed to reach the declared state.")
@Slf4j
public class ApplyCommand implements Callable<Integer> {

    @CommandLine.Option(names = {"-f", "--file"}, required = true, description = "Declaration file (JSON or YAML).")
    Path file;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private final Orchestrator orchestrator;
    private final PlanRenderer renderer;

    @Inject
    public ApplyCommand(Orchestrator orchestrator, PlanRenderer renderer) {
        this.orchestrator = orchestrator;
        this.renderer = renderer;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try {
            Orchestrator.ApplyResult result = orchestrator.apply(file);
            out.print(renderer.renderPlan(result.plan()));
            if (!result.plan().isEmpty()) {
                out.print(renderer.renderReport(result.report()));
            }
            out.print(renderer.renderOutputs(result.outputs()));
            out.flush();
            return result.report().isSuccessful() ? ExitCodes.OK : ExitCodes.APPLY_FAILED;
        } catch (GraphValidationException e) {
            log.debug("Declarations in {} are invalid", file, e);
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return ExitCodes.GRAPH_ERROR;
        }
    }
}
