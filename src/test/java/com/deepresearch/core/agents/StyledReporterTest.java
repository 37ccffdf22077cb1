package com.deepresearch.core.agents;

import com.deepresearch.core.model.Observation;
import com.deepresearch.core.model.Plan;
import com.deepresearch.core.model.ReportStyle;
import com.deepresearch.core.model.Resource;
import com.deepresearch.core.model.Step;
import com.deepresearch.core.model.StepType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StyledReporterTest {

    private final StyledReporter reporter = new StyledReporter();

    private static Plan finishedPlan() {
        Step done = Step.pending("Collect facts", "d", StepType.RESEARCH, true).start().complete("Facts");
        Step failed = Step.pending("Compare", "d", StepType.PROCESSING, false).start().fail("no data");
        Step skipped = Step.pending("Summarise", "d", StepType.PROCESSING, false);
        return new Plan("LangGraph overview", "Start broad", List.of(done, failed, skipped), false, "en-US");
    }

    private static List<Observation> observations() {
        return List.of(
                Observation.background("LangGraph is a library"),
                Observation.stepResult("Facts", 0, 1),
                Observation.stepFailure("Step 'Compare' failed: no data", 1, 1),
                Observation.stepResult("Second plan fact", 0, 2));
    }

    @Test
    @DisplayName("identical inputs give identical reports")
    void deterministic() {
        var resources = List.of(new Resource("https://a.example", "A"));
        String first = reporter.report("q", finishedPlan(), observations(), resources, ReportStyle.NEWS, "en-US");
        String second = reporter.report("q", finishedPlan(), observations(), resources, ReportStyle.NEWS, "en-US");

        assertEquals(first, second);
    }

    @Test
    @DisplayName("academic layout lists steps, findings and references")
    void academicLayout() {
        String report = reporter.report("What is LangGraph?", finishedPlan(), observations(),
                List.of(new Resource("https://a.example", "A")), ReportStyle.ACADEMIC, "en-US");

        assertTrue(report.startsWith("# LangGraph overview\n"));
        assertTrue(report.contains("## Abstract"));
        assertTrue(report.contains("**Question:** What is LangGraph?"));
        assertTrue(report.contains("1. Collect facts [done]"));
        assertTrue(report.contains("2. Compare [failed]"));
        assertTrue(report.contains("3. Summarise [not run]"));
        assertTrue(report.contains("### Background 1"));
        assertTrue(report.contains("### Step 2 (failed)"));
        assertTrue(report.contains("### Step 1, plan 2"));
        assertTrue(report.contains("- [A](https://a.example)"));
        assertTrue(report.endsWith("\n"));
        assertFalse(report.endsWith("\n\n"));
    }

    @Test
    @DisplayName("every style renders with its own headings")
    void everyStyleRenders() {
        for (ReportStyle style : ReportStyle.values()) {
            String report = reporter.report("q", finishedPlan(), observations(), List.of(), style, "zh-CN");

            assertTrue(report.contains("(zh-CN)"), style.name());
            assertFalse(report.contains("## References"), "no reference section without resources");
        }
        assertTrue(reporter.report("q", null, List.of(), List.of(), ReportStyle.INVESTMENT, "en-US")
                .contains("## Executive Summary"));
        assertTrue(reporter.report("q", null, List.of(), List.of(), ReportStyle.SOCIAL_MEDIA, "en-US")
                .contains("## TL;DR"));
    }

    @Test
    @DisplayName("renders without a plan or findings")
    void noPlanNoFindings() {
        String report = reporter.report("What is LangGraph?", null, List.of(), List.of(), null, "en-US");

        assertTrue(report.startsWith("# What is LangGraph?"));
        assertTrue(report.contains("No findings were gathered."));
    }
}
