package com.deepresearch.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Locale;

/**
 * Centralised Micrometer metrics for research sessions.
 */
@Service
public class ResearchMetrics {

    private final MeterRegistry registry;

    public ResearchMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordPlanningDuration(long ms) {
        Timer.builder("deepresearch.planning.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordStepExecution(String stepType, String status, long ms) {
        Timer.builder("deepresearch.step.duration")
                .tag("type", stepType.toLowerCase(Locale.ROOT))
                .tag("status", status.toLowerCase(Locale.ROOT))
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordPlanIterations(int iterations) {
        DistributionSummary.builder("deepresearch.plan.iterations")
                .description("Planner invocations per session")
                .register(registry)
                .record(iterations);
    }

    public void recordSessionOutcome(String outcome) {
        Counter.builder("deepresearch.sessions.total")
                .tag("outcome", outcome.toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    /**
     * Background investigation failures are tolerated, so they only show up here and in the log.
     */
    public void incrementBackgroundFailures() {
        Counter.builder("deepresearch.background.failures")
                .register(registry)
                .increment();
    }
}
