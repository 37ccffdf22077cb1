package com.deepresearch.core.agents;

import com.deepresearch.core.model.Observation;
import com.deepresearch.core.model.ObservationKind;
import com.deepresearch.core.model.Plan;
import com.deepresearch.core.model.ReportStyle;
import com.deepresearch.core.model.Resource;
import com.deepresearch.core.model.Step;
import com.deepresearch.core.model.StepStatus;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Deterministic Markdown {@link Reporter}. Uses no clock, randomness or I/O, so the
 * same inputs always render the same report.
 */
@Component
public class StyledReporter implements Reporter {

    /**
     * Section headings and framing sentence per style.
     */
    private record Layout(String framing, String overview, String method, String findings, String references) {}

    private static Layout layoutFor(ReportStyle style) {
        return switch (style) {
            case NEWS -> new Layout(
                    "News report", "Key Points", "How We Reported This", "The Story", "Sources");
            case SOCIAL_MEDIA -> new Layout(
                    "Thread", "TL;DR", "What We Looked At", "The Details", "Links");
            case INVESTMENT -> new Layout(
                    "Investment research note", "Executive Summary", "Research Scope", "Analysis", "Sources");
            case ACADEMIC -> new Layout(
                    "Research report", "Abstract", "Methodology", "Findings", "References");
        };
    }

    @Override
    public String report(String query, Plan plan, List<Observation> observations, List<Resource> resources,
                         ReportStyle style, String locale) {
        Layout layout = layoutFor(style != null ? style : ReportStyle.ACADEMIC);
        List<Observation> obs = observations != null ? observations : List.of();
        List<Resource> refs = resources != null ? resources : List.of();

        var sb = new StringBuilder();
        String title = plan != null && !plan.title().isBlank() ? plan.title() : query;
        sb.append("# ").append(title).append("\n\n");
        sb.append("_").append(layout.framing()).append(" (").append(locale).append(")_\n\n");

        sb.append("## ").append(layout.overview()).append("\n\n");
        sb.append("**Question:** ").append(query).append("\n\n");
        if (plan != null && !plan.thought().isBlank()) {
            sb.append(plan.thought()).append("\n\n");
        }

        if (plan != null && !plan.isEmpty()) {
            sb.append("## ").append(layout.method()).append("\n\n");
            List<Step> steps = plan.steps();
            for (int i = 0; i < steps.size(); i++) {
                Step step = steps.get(i);
                sb.append(i + 1).append(". ").append(step.title())
                        .append(" ").append(statusMark(step.status())).append("\n");
            }
            sb.append("\n");
        }

        sb.append("## ").append(layout.findings()).append("\n\n");
        if (obs.isEmpty()) {
            sb.append("No findings were gathered.\n\n");
        }
        int background = 0;
        for (Observation o : obs) {
            if (o.kind() == ObservationKind.BACKGROUND) {
                background++;
                sb.append("### Background ").append(background).append("\n\n");
                sb.append(o.content()).append("\n\n");
            } else if (o.kind() == ObservationKind.STEP_FAILURE) {
                sb.append("### ").append(stepLabel(o)).append(" (failed)\n\n");
                sb.append("> **Step failed:** ").append(o.content()).append("\n\n");
            } else {
                sb.append("### ").append(stepLabel(o)).append("\n\n");
                sb.append(o.content()).append("\n\n");
            }
        }

        if (!refs.isEmpty()) {
            sb.append("## ").append(layout.references()).append("\n\n");
            for (Resource r : refs) {
                sb.append("- [").append(r.title()).append("](").append(r.url()).append(")\n");
            }
        }
        return sb.toString().stripTrailing() + "\n";
    }

    private static String stepLabel(Observation o) {
        String label = "Step " + (o.stepIndex() != null ? o.stepIndex() + 1 : "?");
        return o.planIteration() > 1 ? label + ", plan " + o.planIteration() : label;
    }

    private static String statusMark(StepStatus status) {
        return switch (status) {
            case COMPLETED -> "[done]";
            case FAILED -> "[failed]";
            case RUNNING -> "[interrupted]";
            case PENDING -> "[not run]";
        };
    }
}
