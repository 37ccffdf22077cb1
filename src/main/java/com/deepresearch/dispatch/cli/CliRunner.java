package com.deepresearch.dispatch.cli;

import com.deepresearch.core.model.ResearchOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Runs the picocli command line once Spring has wired the research beans, and turns
 * the outcome of a research run into the process exit code.
 * <p>
 * Exit codes: 0 when a report was written, 1 when the session failed, 2 for invalid
 * input, 3 when the session stopped to wait for a clarification answer or a plan
 * approval, 4 when it was cancelled.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    static final int EXIT_FAILED = 1;
    static final int EXIT_NEEDS_INPUT = 3;
    static final int EXIT_CANCELLED = 4;

    private final DeepResearchCommand rootCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(DeepResearchCommand rootCommand, IFactory factory) {
        this.rootCommand = rootCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        if (isServeInvocation(args)) {
            // the embedded web server keeps the JVM alive
            log.debug("Serve mode, CLI commands skipped");
            return;
        }
        exitCode = commandLine(rootCommand, factory).execute(args);
        log.debug("CLI finished with exit code {}", exitCode);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * True when {@code serve} is the subcommand, not merely a word of a research query.
     */
    public static boolean isServeInvocation(String... args) {
        for (String arg : args) {
            if (!arg.startsWith("-")) {
                return "serve".equals(arg);
            }
        }
        return false;
    }

    static CommandLine commandLine(DeepResearchCommand rootCommand, IFactory factory) {
        return new CommandLine(rootCommand, factory)
                .setExecutionExceptionHandler((e, cmd, parseResult) -> {
                    log.debug("Command '{}' failed", cmd.getCommandName(), e);
                    ConsoleOutput.error(cmd.getCommandName() + " failed: " + e.getMessage());
                    return EXIT_FAILED;
                });
    }

    static int exitCodeFor(ResearchOutcome outcome) {
        return switch (outcome) {
            case DONE -> CommandLine.ExitCode.OK;
            case FAILED -> EXIT_FAILED;
            case NEEDS_CLARIFICATION, AWAITING_PLAN_APPROVAL -> EXIT_NEEDS_INPUT;
            case CANCELLED -> EXIT_CANCELLED;
        };
    }
}
