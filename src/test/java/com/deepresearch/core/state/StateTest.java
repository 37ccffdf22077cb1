package com.deepresearch.core.state;

import com.deepresearch.core.model.Observation;
import com.deepresearch.core.model.Plan;
import com.deepresearch.core.model.ResearchConfig;
import com.deepresearch.core.model.ResearchOutcome;
import com.deepresearch.core.model.Resource;
import com.deepresearch.core.model.Step;
import com.deepresearch.core.model.StepType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the per-session state holders.
 */
class StateTest {

    @Nested
    @DisplayName("ObservationStore")
    class ObservationStoreTests {

        @Test
        @DisplayName("keeps observations in append order")
        void keepsOrder() {
            var store = new ObservationStore();
            store.append(Observation.background("bg"));
            store.append(Observation.stepResult("first", 0, 1));
            store.appendAll(List.of(Observation.stepFailure("second", 1, 1)));

            assertEquals(List.of("bg", "first", "second"), store.contents());
            assertEquals(3, store.size());
        }

        @Test
        @DisplayName("snapshots do not change after later appends")
        void snapshotIsStable() {
            var store = new ObservationStore();
            store.append(Observation.background("bg"));
            var snapshot = store.snapshot();
            store.append(Observation.stepResult("later", 0, 1));

            assertEquals(1, snapshot.size());
            assertThrows(UnsupportedOperationException.class,
                    () -> snapshot.add(Observation.background("x")));
        }

        @Test
        @DisplayName("rejects null observations")
        void rejectsNull() {
            assertThrows(IllegalArgumentException.class, () -> new ObservationStore().append(null));
        }
    }

    @Nested
    @DisplayName("ResourceRegistry")
    class ResourceRegistryTests {

        @Test
        @DisplayName("deduplicates by URL keeping the first title")
        void deduplicates() {
            var registry = new ResourceRegistry();
            assertTrue(registry.add(new Resource("https://a.example", "A")));
            assertFalse(registry.add(new Resource("https://a.example", "A again")));
            registry.add(new Resource("https://b.example", null));

            var snapshot = registry.snapshot();
            assertEquals(2, snapshot.size());
            assertEquals("A", snapshot.get(0).title());
            assertEquals("https://b.example", snapshot.get(1).title());
        }

        @Test
        @DisplayName("ignores resources without a URL")
        void ignoresBlankUrl() {
            var registry = new ResourceRegistry();
            int added = registry.addAll(List.of(new Resource(" ", "blank"), new Resource("https://c.example", "C")));

            assertEquals(1, added);
            assertEquals(1, registry.size());
        }
    }

    @Nested
    @DisplayName("CancellationToken")
    class CancellationTokenTests {

        @Test
        @DisplayName("first reason wins")
        void firstReasonWins() {
            var token = new CancellationToken();
            assertTrue(token.cancel("deadline exceeded"));
            assertFalse(token.cancel("cancelled by caller"));

            assertTrue(token.isCancelled());
            assertEquals("deadline exceeded", token.reason());
        }

        @Test
        @DisplayName("interrupts the bound worker")
        void interruptsWorker() throws Exception {
            var token = new CancellationToken();
            var started = new java.util.concurrent.CountDownLatch(1);
            var interrupted = new java.util.concurrent.atomic.AtomicBoolean();
            Thread worker = new Thread(() -> {
                started.countDown();
                try {
                    Thread.sleep(10_000);
                } catch (InterruptedException e) {
                    interrupted.set(true);
                }
            });
            token.bind(worker);
            worker.start();
            started.await();

            token.cancel("stop");
            worker.join(5_000);

            assertTrue(interrupted.get());
        }
    }

    @Nested
    @DisplayName("ResearchContext")
    class ResearchContextTests {

        private ResearchContext newContext() {
            return new ResearchContext("DR-1-0001", "original question", ResearchConfig.defaults(), List.of());
        }

        @Test
        @DisplayName("effectiveQuery prefers the clarified query")
        void effectiveQuery() {
            var ctx = newContext();
            assertEquals("original question", ctx.effectiveQuery());
            ctx.setClarifiedQuery("clarified question");
            assertEquals("clarified question", ctx.effectiveQuery());
        }

        @Test
        @DisplayName("replacePlan resets the per-plan step count only")
        void replacePlanResetsCount() {
            var ctx = newContext();
            ctx.replacePlan(new Plan("p1", "", List.of(), false, "en-US"), 3);
            ctx.recordStepExecuted();
            ctx.recordStepExecuted();
            assertEquals(3, ctx.stepsDroppedFromCurrentPlan());
            ctx.replacePlan(new Plan("p2", "", List.of(), false, "en-US"));

            assertEquals(0, ctx.stepsExecutedInCurrentPlan());
            assertEquals(0, ctx.stepsDroppedFromCurrentPlan());
            assertEquals(2, ctx.totalStepsExecuted());
        }

        @Test
        @DisplayName("stepContext carries completed steps and observations")
        void stepContext() {
            var ctx = newContext();
            var done = Step.pending("a", "d", StepType.RESEARCH, true).start().complete("r");
            ctx.replacePlan(new Plan("p", "", List.of(done, Step.pending("b", "d", StepType.PROCESSING, false)),
                    false, "en-US"));
            ctx.observations().append(Observation.stepResult("r", 0, 1));

            StepContext stepContext = ctx.stepContext(1);

            assertEquals(1, stepContext.stepIndex());
            assertEquals(1, stepContext.completedSteps().size());
            assertEquals(1, stepContext.observations().size());
            assertEquals("original question", stepContext.query());
        }

        @Test
        @DisplayName("toResult keeps only the field that matches the outcome")
        void toResultByOutcome() {
            var ctx = newContext();
            ctx.setFinalReport("# Report");
            ctx.setPendingQuestion("Which year?");
            ctx.setError("boom");

            var done = ctx.toResult(ResearchOutcome.DONE);
            assertEquals("# Report", done.finalReport());
            assertNull(done.question());
            assertNull(done.error());

            var failed = ctx.toResult(ResearchOutcome.FAILED);
            assertNull(failed.finalReport());
            assertEquals("boom", failed.error());

            var question = ctx.toResult(ResearchOutcome.NEEDS_CLARIFICATION);
            assertEquals("Which year?", question.question());
            assertEquals("academic", question.metadata().get("report_style"));
        }

        @Test
        @DisplayName("updateStep without a plan is rejected")
        void updateStepWithoutPlan() {
            var ctx = newContext();
            assertThrows(IllegalStateException.class,
                    () -> ctx.updateStep(0, Step.pending("a", "d", StepType.RESEARCH, true)));
        }
    }
}
