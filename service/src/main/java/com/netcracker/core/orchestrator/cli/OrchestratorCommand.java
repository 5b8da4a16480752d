package com.netcracker.core.orchestrator.cli;

import io.quarkus.picocli.runtime.annotations.TopCommand;
import picocli.CommandLine;

@TopCommand
@CommandLine.Command(name = "orchestrator",
        mixinStandardHelpOptions = true,
        description = "Plans and applies declared resources in dependency order.",
        subcommands = {PlanCommand.class, ApplyCommand.class, DestroyCommand.class})
public class OrchestratorCommand {
}
