package com.deepresearch.dispatch.api;

import com.deepresearch.core.model.Plan;
import com.deepresearch.core.model.ResearchConfig;
import com.deepresearch.core.model.Step;
import com.deepresearch.core.model.StepFailurePolicy;
import com.deepresearch.core.model.StepStatus;
import com.deepresearch.core.model.StepType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the inbound request bodies and {@link PlanPayload}.
 */
class ResearchRequestTest {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    @Nested
    @DisplayName("ResearchRequest")
    class Request {

        @Test
        @DisplayName("query-only request keeps every default")
        void queryOnlyKeepsDefaults() {
            ResearchConfig defaults = ResearchConfig.defaults();
            assertEquals(defaults, ResearchRequest.of("q").toConfig(defaults));
        }

        @Test
        @DisplayName("snake_case JSON fields override the defaults")
        void snakeCaseOverrides() throws Exception {
            var request = OBJECT_MAPPER.readValue("""
                    {"query": "AI chips", "max_step_num": 3, "max_plan_iterations": 2,
                     "enable_clarification": false, "locale": "zh-CN",
                     "abort_on_step_failure": true, "max_step_retries": 1, "timeout_seconds": 90}
                    """, ResearchRequest.class);

            ResearchConfig config = request.toConfig(ResearchConfig.defaults());

            assertEquals("AI chips", request.query());
            assertEquals(3, config.maxStepNum());
            assertEquals(2, config.maxPlanIterations());
            assertFalse(config.enableClarification());
            assertTrue(config.enableBackgroundInvestigation());
            assertEquals("zh-CN", config.locale());
            assertEquals(StepFailurePolicy.ABORT, config.stepFailurePolicy());
            assertEquals(1, config.maxStepRetries());
            assertEquals(Duration.ofSeconds(90), config.timeout());
        }
    }

    @Nested
    @DisplayName("PlanApprovalRequest")
    class Approval {

        @Test
        @DisplayName("approved=false rejects the plan")
        void rejects() {
            assertFalse(new PlanApprovalRequest(false, null).toApproval().approved());
        }

        @Test
        @DisplayName("empty body approves the proposed plan")
        void approvesProposed() {
            var approval = new PlanApprovalRequest(null, null).toApproval();
            assertTrue(approval.approved());
            assertNull(approval.editedPlan());
        }
    }

    @Nested
    @DisplayName("PlanPayload")
    class Payload {

        @Test
        @DisplayName("from(null) is null")
        void fromNull() {
            assertNull(PlanPayload.from(null));
        }

        @Test
        @DisplayName("edited plan drops untitled steps and resets every status")
        void toPlanResetsSteps() throws Exception {
            var payload = OBJECT_MAPPER.readValue("""
                    {"title": "Edited", "thought": "", "has_enough_context": false, "locale": "en-US",
                     "steps": [
                       {"title": "Gather", "description": "Gather data", "step_type": "research",
                        "need_search": true, "status": "completed", "execution_result": "done"},
                       {"title": " ", "description": "ignored"},
                       {"title": "Model", "step_type": "processing"}
                     ]}
                    """, PlanPayload.class);

            Plan plan = payload.toPlan();

            assertEquals(2, plan.totalSteps());
            assertTrue(plan.steps().stream().allMatch(s -> s.status() == StepStatus.PENDING));
            assertEquals(StepType.PROCESSING, plan.steps().get(1).stepType());
            assertEquals("", plan.steps().get(1).description());
        }

        @Test
        @DisplayName("renders lowercase step type and status")
        void rendersLowercase() {
            var step = Step.pending("Compute", "Sum", StepType.PROCESSING, false).start().complete("42");
            var payload = PlanPayload.from(new Plan("P", "", List.of(step), true, "en-US"));

            var rendered = payload.steps().get(0);
            assertEquals("processing", rendered.stepType());
            assertEquals("completed", rendered.status());
            assertEquals("42", rendered.executionResult());
            assertTrue(payload.hasEnoughContext());
        }
    }
}
