package com.deepresearch.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command.
 * Routes to subcommands: research, health, serve.
 */
@Command(
        name = "deep-research",
        mixinStandardHelpOptions = true,
        version = "deep-research 0.1.0",
        description = "Multi-agent deep research: clarify, plan, research and report",
        subcommands = {
                ResearchCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class DeepResearchCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
