package com.deepresearch.core.engine;

import com.deepresearch.core.events.EventBus;
import com.deepresearch.core.events.ProgressEvent;
import com.deepresearch.core.logging.MdcContext;
import com.deepresearch.core.metrics.ResearchMetrics;
import com.deepresearch.core.model.ClarificationTurn;
import com.deepresearch.core.model.Plan;
import com.deepresearch.core.model.PlanApproval;
import com.deepresearch.core.model.ResearchConfig;
import com.deepresearch.core.model.ResearchConfigurationException;
import com.deepresearch.core.model.ResearchOutcome;
import com.deepresearch.core.model.ResearchResult;
import com.deepresearch.core.model.ResearchStage;
import com.deepresearch.core.state.CancellationToken;
import com.deepresearch.core.state.ResearchContext;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives research sessions through the {@link ResearchStateMachine}.
 * <p>
 * Creates sessions (new, follow-up after a clarification question, resumed after
 * plan approval), runs the transition loop on the calling thread, emits one progress
 * event per stage entered and turns the final stage into a {@link ResearchResult}.
 */
@Service
public class ResearchOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ResearchOrchestrator.class);
    private static final AtomicInteger RESEARCH_COUNTER = new AtomicInteger(0);

    private final ResearchStateMachine machine;
    private final EventBus eventBus;
    private final ResearchMetrics metrics;

    private final ScheduledExecutorService deadlines = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "research-deadline");
        t.setDaemon(true);
        return t;
    });

    public ResearchOrchestrator(ResearchStateMachine machine, EventBus eventBus, ResearchMetrics metrics) {
        this.machine = machine;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Runs a new session to completion on the calling thread.
     *
     * @throws ResearchConfigurationException if the query or configuration is invalid
     */
    public ResearchResult run(String query, ResearchConfig config) {
        return drive(newSession(query, config));
    }

    /**
     * Creates a session for a new query without running it.
     *
     * @throws ResearchConfigurationException if the query or configuration is invalid
     */
    public ResearchSession newSession(String query, ResearchConfig config) {
        if (config == null) {
            throw new ResearchConfigurationException("Research configuration is required");
        }
        config.validate(query);
        var context = new ResearchContext(generateResearchId(), query.trim(), config, List.of());
        return new ResearchSession(context, machine.initialStage(config), 0);
    }

    /**
     * Creates the follow-up session that answers a pending clarification question.
     * The follow-up gets a new research id and carries every earlier exchange.
     */
    public ResearchSession followUp(ResearchSession previous, String answer) {
        ResearchResult last = previous.result().orElse(null);
        if (last == null || last.outcome() != ResearchOutcome.NEEDS_CLARIFICATION) {
            throw new IllegalStateException("Research " + previous.researchId() + " is not waiting for clarification");
        }
        if (answer == null || answer.isBlank()) {
            throw new ResearchConfigurationException("Clarification answer is required");
        }
        if (!previous.claimContinuation()) {
            throw new IllegalStateException("Research " + previous.researchId() + " was already answered");
        }
        ResearchContext old = previous.context();
        var history = new ArrayList<>(old.clarificationHistory());
        history.add(new ClarificationTurn(old.pendingQuestion(), answer.trim()));
        var context = new ResearchContext(generateResearchId(), old.originalQuery(), old.config(), history);
        log.info("Research {} continues as {} after clarification round {}",
                old.researchId(), context.researchId(), history.size());
        return new ResearchSession(context, machine.initialStage(old.config()), 0);
    }

    /**
     * Creates the session that continues a plan awaiting approval. Same context, same
     * research id. A rejection produces a session that ends CANCELLED immediately.
     */
    public ResearchSession resume(ResearchSession suspended, PlanApproval approval) {
        ResearchResult last = suspended.result().orElse(null);
        if (last == null || last.outcome() != ResearchOutcome.AWAITING_PLAN_APPROVAL) {
            throw new IllegalStateException("Research " + suspended.researchId() + " is not awaiting plan approval");
        }
        if (!suspended.claimContinuation()) {
            throw new IllegalStateException("Research " + suspended.researchId() + " was already resumed");
        }
        ResearchContext context = suspended.context();
        if (approval == null || !approval.approved()) {
            context.setError("Plan rejected by caller");
            return new ResearchSession(context, ResearchStage.CANCELLED, suspended.lastSequence());
        }
        if (approval.editedPlan() != null) {
            Plan edited = machine.adopt(approval.editedPlan().withStepsReset(), context);
            log.info("Research {} resumes with an edited plan of {} step(s)", context.researchId(), edited.totalSteps());
        }
        return new ResearchSession(context, machine.afterApproval(context), suspended.lastSequence());
    }

    /**
     * Runs the transition loop of a session until it reaches a terminal stage.
     * Never throws for collaborator failures; they end the session FAILED.
     */
    public ResearchResult drive(ResearchSession session) {
        ResearchContext context = session.context();
        CancellationToken token = context.cancellation();
        String researchId = context.researchId();

        MdcContext.setResearch(researchId);
        token.bind(Thread.currentThread());
        ScheduledFuture<?> deadline = scheduleDeadline(session);
        ResearchStage stage = session.startStage();
        try {
            log.info("Research {} starting at {}: {}", researchId, stage, context.originalQuery());
            if (!stage.isTerminal()) {
                publish(session, stage);
            }
            while (!stage.isTerminal()) {
                if (token.isCancelled()) {
                    stage = ResearchStage.CANCELLED;
                    break;
                }
                MdcContext.setStage(researchId, stage.name());
                try {
                    stage = machine.next(stage, context);
                } catch (CollaboratorException e) {
                    if (token.isCancelled()) {
                        stage = ResearchStage.CANCELLED;
                    } else {
                        log.error("Research {} failed in {}: {}", researchId, e.getStage(), e.getMessage(), e);
                        context.setError(e.getMessage());
                        stage = ResearchStage.FAILED;
                    }
                }
                if (!stage.isTerminal()) {
                    publish(session, stage);
                }
            }
        } catch (RuntimeException e) {
            log.error("Research {} stopped unexpectedly in {}", researchId, stage, e);
            context.setError(e.getClass().getSimpleName() + ": " + e.getMessage());
            stage = token.isCancelled() ? ResearchStage.CANCELLED : ResearchStage.FAILED;
        } finally {
            token.unbind();
            if (deadline != null) {
                deadline.cancel(false);
            }
            if (token.isCancelled()) {
                // the interrupt came from our own cancel; don't leak it to the caller's thread
                Thread.interrupted();
            }
        }

        try {
            return finish(session, stage);
        } finally {
            MdcContext.clear();
        }
    }

    private ResearchResult finish(ResearchSession session, ResearchStage stage) {
        ResearchContext context = session.context();
        if (stage == ResearchStage.CANCELLED && context.error() == null) {
            String reason = context.cancellation().reason();
            context.setError(reason != null ? reason : "cancelled");
        }
        ResearchOutcome outcome = ResearchOutcome.fromStage(stage);
        ResearchResult result = context.toResult(outcome);

        metrics.recordSessionOutcome(outcome.name());
        if (outcome != ResearchOutcome.AWAITING_PLAN_APPROVAL) {
            metrics.recordPlanIterations(context.planIterationCount());
        }
        switch (outcome) {
            case FAILED -> log.error("Research {} FAILED: {}", context.researchId(), context.error());
            case CANCELLED -> log.warn("Research {} CANCELLED: {}", context.researchId(), context.error());
            default -> log.info("Research {} finished with {} after {} plan(s) and {} step(s)",
                    context.researchId(), outcome, context.planIterationCount(), context.totalStepsExecuted());
        }

        session.complete(result);
        publish(session, stage);
        return result;
    }

    private void publish(ResearchSession session, ResearchStage stage) {
        ResearchContext context = session.context();
        Integer stepIndex = null;
        if (stage == ResearchStage.EXECUTING_STEP && context.currentPlan() != null) {
            stepIndex = context.currentPlan().nextPendingIndex().orElse(null);
        }
        ProgressEvent event = session.emit(stage, describe(stage, context, stepIndex), stepIndex);
        eventBus.publish(event);
    }

    private static String describe(ResearchStage stage, ResearchContext context, Integer stepIndex) {
        Plan plan = context.currentPlan();
        return switch (stage) {
            case CLARIFYING -> "Clarifying the research question";
            case BACKGROUND_INVESTIGATING -> "Running background investigation";
            case PLANNING -> "Planning research (iteration " + (context.planIterationCount() + 1)
                    + " of at most " + context.config().maxPlanIterations() + ")";
            case AWAITING_PLAN_APPROVAL -> "Plan ready with " + plan.totalSteps() + " step(s), awaiting approval";
            case EXECUTING_STEP -> stepIndex != null
                    ? "Executing step " + (stepIndex + 1) + "/" + plan.totalSteps() + ": " + plan.steps().get(stepIndex).title()
                    : "Executing steps";
            case REPORTING -> "Writing the final report";
            case DONE -> "Research completed";
            case NEEDS_CLARIFICATION -> "Clarification needed: " + context.pendingQuestion();
            case FAILED -> "Research failed: " + context.error();
            case CANCELLED -> "Research cancelled: " + context.error();
        };
    }

    private ScheduledFuture<?> scheduleDeadline(ResearchSession session) {
        var timeout = session.context().config().timeout();
        if (timeout == null) {
            return null;
        }
        return deadlines.schedule(() -> {
            if (session.cancel("deadline exceeded")) {
                log.warn("Research {} exceeded its deadline of {}", session.researchId(), timeout);
            }
        }, timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Generates a research id in the format DR-YYYY-NNNN.
     */
    public String generateResearchId() {
        int count = RESEARCH_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("DR-%d-%04d", year, count);
    }

    @PreDestroy
    void shutdown() {
        deadlines.shutdownNow();
    }
}
