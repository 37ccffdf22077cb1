package com.deepresearch.dispatch.cli;

import com.deepresearch.core.engine.ResearchProperties;
import com.deepresearch.core.engine.ResearchSession;
import com.deepresearch.core.engine.ResearchSessionRegistry;
import com.deepresearch.core.model.ResearchConfig;
import com.deepresearch.core.model.ResearchConfigurationException;
import com.deepresearch.core.model.ResearchResult;
import com.deepresearch.core.model.Step;
import com.deepresearch.core.model.StepFailurePolicy;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: deep-research research "&lt;query&gt;"
 * <p>
 * Runs one research session, printing a line per progress event and then the
 * final report. Defaults come from {@code deepresearch.research.*}.
 */
@Command(name = "research", mixinStandardHelpOptions = true, description = "Research a question and print the report")
@Component
public class ResearchCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "The research question")
    private String query;

    @Option(names = "--max-steps", description = "Maximum steps per plan")
    private Integer maxSteps;

    @Option(names = "--max-iterations", description = "Maximum planning iterations")
    private Integer maxIterations;

    @Option(names = "--style", description = "Report style: academic, news, social, investment")
    private String style;

    @Option(names = "--locale", description = "Report locale, e.g. en-US")
    private String locale;

    @Option(names = "--no-clarification", description = "Skip the clarification stage")
    private boolean noClarification;

    @Option(names = "--no-background", description = "Skip the background investigation")
    private boolean noBackground;

    @Option(names = "--abort-on-step-failure", description = "Fail the session when a step fails")
    private boolean abortOnStepFailure;

    private final ResearchSessionRegistry registry;
    private final ResearchProperties properties;

    public ResearchCommand(ResearchSessionRegistry registry, ResearchProperties properties) {
        this.registry = registry;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        ResearchSession session;
        try {
            session = registry.start(query, buildConfig());
        } catch (ResearchConfigurationException e) {
            ConsoleOutput.error("Invalid request: " + e.getMessage());
            return CommandLine.ExitCode.USAGE;
        }
        ConsoleOutput.info("Research " + session.researchId() + ": " + query);

        ResearchResult result;
        try {
            session.events().forEach(ConsoleOutput::progress);
            result = session.awaitResult();
        } catch (Exception e) {
            ConsoleOutput.error("Research failed: " + rootCauseMessage(e));
            return CliRunner.EXIT_FAILED;
        }

        System.out.println(ConsoleOutput.RULE);
        switch (result.outcome()) {
            case DONE -> {
                System.out.println(result.finalReport());
                ConsoleOutput.success("Research complete (" + result.resources().size() + " sources).");
            }
            case NEEDS_CLARIFICATION -> {
                ConsoleOutput.warn("Clarification needed: " + result.question());
                ConsoleOutput.info("Re-run with a more specific question or --no-clarification.");
            }
            case AWAITING_PLAN_APPROVAL -> {
                ConsoleOutput.info("Plan awaiting approval: " + result.plan().title());
                int number = 1;
                for (Step step : result.plan().steps()) {
                    System.out.printf("  %d. [%-10s] %s%n", number++, step.stepType(), step.title());
                }
                ConsoleOutput.info("Approve it through POST /api/v1/research/sessions/"
                        + result.researchId() + "/approve");
            }
            case FAILED -> ConsoleOutput.error("Research failed: " + result.error());
            case CANCELLED -> ConsoleOutput.error("Research cancelled: " + result.error());
        }
        return CliRunner.exitCodeFor(result.outcome());
    }

    ResearchConfig buildConfig() {
        ResearchConfig config = properties.toConfig();
        if (maxSteps != null) config = config.withMaxStepNum(maxSteps);
        if (maxIterations != null) config = config.withMaxPlanIterations(maxIterations);
        if (style != null) config = config.withReportStyle(style);
        if (locale != null) config = config.withLocale(locale);
        if (noClarification) config = config.withClarification(false);
        if (noBackground) config = config.withBackgroundInvestigation(false);
        if (abortOnStepFailure) config = config.withStepFailurePolicy(StepFailurePolicy.ABORT);
        return config;
    }

    private static String rootCauseMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
