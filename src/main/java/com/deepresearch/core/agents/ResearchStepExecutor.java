package com.deepresearch.core.agents;

import com.deepresearch.core.model.AgentFindings;
import com.deepresearch.core.model.Step;
import com.deepresearch.core.model.StepResult;
import com.deepresearch.core.model.StepType;
import com.deepresearch.core.state.StepContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link StepExecutor} that dispatches research steps to the {@link ResearcherAgent}
 * and processing steps to the {@link CoderAgent}.
 * <p>
 * Agent exceptions become failed results. Thread interrupts are the one exception:
 * the flag is restored so the caller can observe the cancellation.
 */
@Component
public class ResearchStepExecutor implements StepExecutor {

    private static final Logger log = LoggerFactory.getLogger(ResearchStepExecutor.class);

    private final ResearcherAgent researcher;
    private final CoderAgent coder;

    public ResearchStepExecutor(ResearcherAgent researcher, CoderAgent coder) {
        this.researcher = researcher;
        this.coder = coder;
    }

    @Override
    public StepResult execute(Step step, StepContext context) {
        try {
            AgentFindings findings = step.stepType() == StepType.PROCESSING
                    ? coder.process(step, context)
                    : researcher.research(step, context);
            if (findings == null || findings.summary() == null || findings.summary().isBlank()) {
                return StepResult.failed("Agent returned no findings for step '" + step.title() + "'");
            }
            return StepResult.completed(findings.summary().trim(), AgentFindings.toResources(findings.sources()));
        } catch (Exception e) {
            if (Thread.currentThread().isInterrupted() || e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            log.warn("Step {} '{}' failed: {}", context.stepIndex(), step.title(), e.getMessage());
            return StepResult.failed(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }
}
