package com.netcracker.core.orchestrator.cli;

import com.netcracker.core.orchestrator.service.Orchestrator;
import com.netcracker.core.orchestrator.service.graph.GraphValidationException;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "plan", description = "Show the actions needed to reach the declared state.")
@Slf4j
public class PlanCommand implements Callable<Integer> {

    @CommandLine.Option(names = {"-f", "--file"}, required = true, description = "Declaration file (JSON or YAML).")
    Path file;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private final Orchestrator orchestrator;
    private final PlanRenderer renderer;

    @Inject
    public PlanCommand(Orchestrator orchestrator, PlanRenderer renderer) {
        this.orchestrator = orchestrator;
        this.renderer = renderer;
    }

    @Override
    public Integer call() {
        try {
            Orchestrator.PlanResult result = orchestrator.plan(file);
            spec.commandLine().getOut().print(renderer.renderPlan(result.plan()));
            spec.commandLine().getOut().flush();
            return ExitCodes.OK;
        } catch (GraphValidationException e) {
            log.debug("Declarations in {} are invalid", file, e);
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return ExitCodes.GRAPH_ERROR;
        }
    }
}
