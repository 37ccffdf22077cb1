package com.deepresearch.dispatch.cli;

import com.deepresearch.core.engine.ResearchProperties;
import com.deepresearch.core.engine.ResearchSession;
import com.deepresearch.core.engine.ResearchSessionRegistry;
import com.deepresearch.core.events.ProgressEvent;
import com.deepresearch.core.health.HealthCheckService;
import com.deepresearch.core.health.HealthStatus;
import com.deepresearch.core.model.Plan;
import com.deepresearch.core.model.ResearchConfig;
import com.deepresearch.core.model.ResearchConfigurationException;
import com.deepresearch.core.model.ResearchOutcome;
import com.deepresearch.core.model.ResearchResult;
import com.deepresearch.core.model.ResearchStage;
import com.deepresearch.core.model.Step;
import com.deepresearch.core.model.StepFailurePolicy;
import com.deepresearch.core.model.StepType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests for the deep-research CLI command structure.
 * These tests exercise picocli directly without Spring context.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private static final Plan PLAN = new Plan("Solid-state batteries", "", List.of(
            Step.pending("Survey manufacturers", "Who ships cells today", StepType.RESEARCH, true),
            Step.pending("Estimate costs", "Cost per kWh", StepType.PROCESSING, false)), false, "en-US");

    private static ResearchProperties properties() {
        ResearchProperties props = mock(ResearchProperties.class);
        when(props.toConfig()).thenReturn(ResearchConfig.defaults());
        return props;
    }

    private static ResearchResult result(ResearchOutcome outcome) {
        return new ResearchResult("r-1", outcome, "Solid-state batteries", null, PLAN,
                outcome == ResearchOutcome.DONE ? "# Battery report" : null,
                outcome == ResearchOutcome.NEEDS_CLARIFICATION ? "Which market?" : null,
                outcome == ResearchOutcome.FAILED ? "planner unavailable" : null,
                List.of(), List.of(), "en-US", Map.of());
    }

    private static ResearchSessionRegistry registryReturning(ResearchOutcome outcome) {
        ResearchSession session = mock(ResearchSession.class);
        when(session.researchId()).thenReturn("r-1");
        when(session.events()).thenReturn(Stream.of(
                new ProgressEvent("r-1", 1, ResearchStage.PLANNING, "Planning research", null, null, null,
                        List.of(), Instant.now()),
                new ProgressEvent("r-1", 2, ResearchStage.EXECUTING_STEP, "Survey manufacturers", PLAN, 0, 2,
                        List.of(), Instant.now())));
        when(session.awaitResult()).thenReturn(result(outcome));
        ResearchSessionRegistry registry = mock(ResearchSessionRegistry.class);
        when(registry.start(any(), any())).thenReturn(session);
        return registry;
    }

    private CommandLine.IFactory createFactory(ResearchSessionRegistry registry, HealthCheckService health) {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == ResearchCommand.class) {
                    return (K) new ResearchCommand(registry, properties());
                }
                if (cls == HealthCommand.class) {
                    return (K) new HealthCommand(health);
                }
                if (cls == ServeCommand.class) {
                    return (K) new ServeCommand();
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        return execute(mock(ResearchSessionRegistry.class), null, args);
    }

    private CliResult execute(ResearchSessionRegistry registry, HealthCheckService health, String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = CliRunner.commandLine(new DeepResearchCommand(), createFactory(registry, health));
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    // =====================================================================
    //  Help output tests
    // =====================================================================

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help includes all subcommands")
        void helpIncludesAllSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            String output = result.output();
            assertTrue(output.contains("research"), "Help should list 'research' subcommand");
            assertTrue(output.contains("health"), "Help should list 'health' subcommand");
            assertTrue(output.contains("serve"), "Help should list 'serve' subcommand");
            assertTrue(output.contains("help"), "Help should list 'help' subcommand");
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("deep-research 0.1.0"));
        }

        @Test
        @DisplayName("research --help shows research options")
        void researchHelpOutput() {
            CliResult result = execute("research", "--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("--max-steps"));
            assertTrue(result.output().contains("--no-clarification"));
        }

        @Test
        @DisplayName("research without a query is a usage error")
        void researchWithoutQuery() {
            CliResult result = execute("research");
            assertEquals(2, result.exitCode());
        }
    }

    // =====================================================================
    //  research command
    // =====================================================================

    @Nested
    @DisplayName("research command")
    class ResearchTests {

        @Test
        @DisplayName("options override the configured defaults")
        void optionsOverrideDefaults() {
            var command = new ResearchCommand(mock(ResearchSessionRegistry.class), properties());
            new CommandLine(command).parseArgs("--max-steps", "2", "--style", "news", "--locale", "zh-CN",
                    "--no-background", "--abort-on-step-failure", "EV market");

            ResearchConfig config = command.buildConfig();

            assertEquals(2, config.maxStepNum());
            assertEquals("news", config.reportStyle());
            assertEquals("zh-CN", config.locale());
            assertFalse(config.enableBackgroundInvestigation());
            assertTrue(config.enableClarification());
            assertEquals(StepFailurePolicy.ABORT, config.stepFailurePolicy());
        }

        @Test
        @DisplayName("prints progress and the final report")
        void printsReport() {
            CliResult result = execute(registryReturning(ResearchOutcome.DONE), null,
                    "research", "--no-clarification", "Solid-state batteries");
            assertEquals(0, result.exitCode());
            String output = result.output();
            assertTrue(output.contains("Research r-1"));
            assertTrue(output.contains("[STEP 1/2]"));
            assertTrue(output.contains("# Battery report"));
            assertTrue(output.contains("Research complete"));
        }

        @Test
        @DisplayName("prints the pending question when clarification is needed")
        void printsQuestion() {
            CliResult result = execute(registryReturning(ResearchOutcome.NEEDS_CLARIFICATION), null,
                    "research", "batteries");
            assertTrue(result.output().contains("Which market?"));
            assertEquals(CliRunner.EXIT_NEEDS_INPUT, result.exitCode());
        }

        @Test
        @DisplayName("prints the plan and approve URL when approval is required")
        void printsPlanForApproval() {
            CliResult result = execute(registryReturning(ResearchOutcome.AWAITING_PLAN_APPROVAL), null,
                    "research", "batteries");
            String output = result.output();
            assertTrue(output.contains("Survey manufacturers"));
            assertTrue(output.contains("/api/v1/research/sessions/r-1/approve"));
            assertEquals(CliRunner.EXIT_NEEDS_INPUT, result.exitCode());
        }

        @Test
        @DisplayName("prints the error of a failed session")
        void printsFailure() {
            CliResult result = execute(registryReturning(ResearchOutcome.FAILED), null, "research", "batteries");
            assertTrue(result.output().contains("planner unavailable"));
            assertEquals(CliRunner.EXIT_FAILED, result.exitCode());
        }

        @Test
        @DisplayName("reports invalid input without starting a session")
        void invalidInput() {
            ResearchSessionRegistry registry = mock(ResearchSessionRegistry.class);
            when(registry.start(eq("batteries"), any()))
                    .thenThrow(new ResearchConfigurationException("max_step_num must be at least 1, got 0"));

            CliResult result = execute(registry, null, "research", "--max-steps", "0", "batteries");
            assertTrue(result.output().contains("Invalid request"));
            assertEquals(CommandLine.ExitCode.USAGE, result.exitCode());
        }

        @Test
        @DisplayName("an unexpected error is reported and exits with the failure code")
        void unexpectedError() {
            ResearchSessionRegistry registry = mock(ResearchSessionRegistry.class);
            when(registry.start(any(), any())).thenThrow(new IllegalStateException("worker pool shut down"));

            CliResult result = execute(registry, null, "research", "batteries");
            assertEquals(CliRunner.EXIT_FAILED, result.exitCode());
            assertTrue(result.output().contains("research failed: worker pool shut down"));
        }
    }

    // =====================================================================
    //  runner
    // =====================================================================

    @Nested
    @DisplayName("CLI runner")
    class RunnerTests {

        @Test
        @DisplayName("serve is detected only as the subcommand")
        void serveDetection() {
            assertTrue(CliRunner.isServeInvocation("serve"));
            assertTrue(CliRunner.isServeInvocation("serve", "--help"));
            assertFalse(CliRunner.isServeInvocation("research", "serve"));
            assertFalse(CliRunner.isServeInvocation("research", "How do restaurants serve customers?"));
            assertFalse(CliRunner.isServeInvocation());
        }

        @Test
        @DisplayName("runs the research command and keeps its exit code")
        void keepsExitCode() throws Exception {
            var runner = new CliRunner(new DeepResearchCommand(),
                    createFactory(registryReturning(ResearchOutcome.CANCELLED), null));
            PrintStream originalOut = System.out;
            System.setOut(new PrintStream(new ByteArrayOutputStream(), true));
            try {
                runner.run("research", "batteries");
            } finally {
                System.setOut(originalOut);
            }
            assertEquals(CliRunner.EXIT_CANCELLED, runner.getExitCode());
        }

        @Test
        @DisplayName("leaves serve mode to the web server")
        void skipsServe() throws Exception {
            var runner = new CliRunner(new DeepResearchCommand(), createFactory(mock(ResearchSessionRegistry.class), null));
            runner.run("serve");
            assertEquals(0, runner.getExitCode());
        }
    }

    // =====================================================================
    //  health command
    // =====================================================================

    @Nested
    @DisplayName("health command")
    class HealthTests {

        @Test
        @DisplayName("lists components and models")
        void listsComponentsAndModels() {
            HealthCheckService health = mock(HealthCheckService.class);
            when(health.checkAll()).thenReturn(List.of(
                    HealthStatus.up("llm", "Provider openai configured", Map.of()),
                    new HealthStatus("mcp", HealthStatus.Status.DEGRADED, "1 MCP connection(s) not responding", Map.of())));
            Map<String, String> models = new LinkedHashMap<>();
            models.put("planner", "gpt-4o");
            when(health.configuredModels()).thenReturn(models);

            CliResult result = execute(mock(ResearchSessionRegistry.class), health, "health");
            String output = result.output();
            assertEquals(0, result.exitCode());
            assertTrue(output.contains("llm: Provider openai configured"));
            assertTrue(output.contains("MODELS:"));
            assertTrue(output.contains("gpt-4o"));
            assertTrue(output.contains("one or more components degraded or down"));
        }

        @Test
        @DisplayName("reports a missing health service")
        void missingService() {
            CliResult result = execute(mock(ResearchSessionRegistry.class), null, "health");
            assertTrue(result.output().contains("Health check service not available"));
        }
    }
}
