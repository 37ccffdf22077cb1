package com.deepresearch.dispatch.api;

import com.deepresearch.core.engine.ResearchProperties;
import com.deepresearch.core.engine.ResearchSession;
import com.deepresearch.core.engine.ResearchSessionNotFoundException;
import com.deepresearch.core.engine.ResearchSessionRegistry;
import com.deepresearch.core.model.PlanApproval;
import com.deepresearch.core.model.ResearchConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * REST controller for research sessions.
 */
@RestController
@RequestMapping("/api/v1/research")
public class ResearchController {

    private static final Logger log = LoggerFactory.getLogger(ResearchController.class);

    private final ResearchSessionRegistry registry;
    private final SseStreamingService sseStreamingService;
    private final ResearchProperties properties;

    public ResearchController(ResearchSessionRegistry registry,
                              SseStreamingService sseStreamingService,
                              ResearchProperties properties) {
        this.registry = registry;
        this.sseStreamingService = sseStreamingService;
        this.properties = properties;
    }

    /**
     * POST /api/v1/research: Run a research session and wait for its result.
     * <p>
     * The wait is capped by {@code deepresearch.research.sync-timeout-seconds}. Past it the
     * session keeps running and the caller gets 202 with the id to poll or stream.
     */
    @PostMapping
    public ResponseEntity<?> research(@RequestBody ResearchRequest request) {
        ResearchSession session;
        try {
            session = registry.start(request.query(), request.toConfig(properties.toConfig()));
        } catch (ResearchConfigurationException e) {
            return badRequest(e);
        }
        log.info("Research {} started (sync)", session.researchId());
        Duration ceiling = Duration.ofSeconds(properties.getSyncTimeoutSeconds());
        try {
            return ResponseEntity.ok(ResearchResponse.from(session.awaitResult(ceiling)));
        } catch (TimeoutException e) {
            log.warn("Research {} still running after {}s, handing it off to polling",
                    session.researchId(), ceiling.toSeconds());
            return ResponseEntity.accepted().body(Map.of(
                    "research_id", session.researchId(),
                    "status", session.stage().name(),
                    "error", "Research still running after " + ceiling.toSeconds()
                            + "s; follow it at /api/v1/research/sessions/" + session.researchId()
            ));
        }
    }

    /**
     * POST /api/v1/research/stream: Start a session and stream its progress as SSE.
     */
    @PostMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<?> stream(@RequestBody ResearchRequest request) {
        ResearchSession session;
        try {
            session = registry.start(request.query(), request.toConfig(properties.toConfig()));
        } catch (ResearchConfigurationException e) {
            return ResponseEntity.badRequest().contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("error", e.getMessage()));
        }
        log.info("Research {} started (stream)", session.researchId());
        return ResponseEntity.ok(sseStreamingService.streamSession(session));
    }

    /**
     * POST /api/v1/research/sessions: Start a session in the background.
     */
    @PostMapping("/sessions")
    public ResponseEntity<?> startSession(@RequestBody ResearchRequest request) {
        ResearchSession session;
        try {
            session = registry.start(request.query(), request.toConfig(properties.toConfig()));
        } catch (ResearchConfigurationException e) {
            return badRequest(e);
        }
        log.info("Research {} started (async)", session.researchId());
        return ResponseEntity.accepted().body(Map.of(
                "research_id", session.researchId(),
                "status", session.stage().name()
        ));
    }

    /**
     * GET /api/v1/research/sessions/{id}: Current snapshot or terminal result.
     */
    @GetMapping("/sessions/{id}")
    public ResponseEntity<ResearchResponse> getSession(@PathVariable String id) {
        return registry.find(id)
                .map(session -> ResponseEntity.ok(ResearchResponse.from(session)))
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * GET /api/v1/research/sessions/{id}/events: SSE stream of live progress events.
     */
    @GetMapping(value = "/sessions/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> events(@PathVariable String id) {
        return registry.find(id)
                .map(session -> ResponseEntity.ok(sseStreamingService.subscribe(session)))
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * POST /api/v1/research/sessions/{id}/approve: Approve, edit or reject a proposed plan.
     */
    @PostMapping("/sessions/{id}/approve")
    public ResponseEntity<?> approve(@PathVariable String id,
                                     @RequestBody(required = false) PlanApprovalRequest request) {
        PlanApproval approval = request != null ? request.toApproval() : PlanApproval.accept();
        try {
            ResearchSession resumed = registry.resume(id, approval);
            log.info("Research {} plan {}", id, approval.approved() ? "approved" : "rejected");
            return ResponseEntity.accepted().body(Map.of(
                    "research_id", resumed.researchId(),
                    "status", resumed.startStage().name()
            ));
        } catch (ResearchSessionNotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (IllegalStateException e) {
            return conflict(e);
        }
    }

    /**
     * POST /api/v1/research/sessions/{id}/clarify: Answer the pending clarification question.
     * The follow-up runs under a new research id.
     */
    @PostMapping("/sessions/{id}/clarify")
    public ResponseEntity<?> clarify(@PathVariable String id, @RequestBody ClarificationAnswerRequest request) {
        try {
            ResearchSession followUp = registry.answer(id, request.answer());
            return ResponseEntity.accepted().body(Map.of(
                    "research_id", followUp.researchId(),
                    "previous_research_id", id,
                    "status", followUp.startStage().name()
            ));
        } catch (ResearchSessionNotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (ResearchConfigurationException e) {
            return badRequest(e);
        } catch (IllegalStateException e) {
            return conflict(e);
        }
    }

    /**
     * POST /api/v1/research/sessions/{id}/cancel: Cancel a running session.
     */
    @PostMapping("/sessions/{id}/cancel")
    public ResponseEntity<?> cancel(@PathVariable String id) {
        try {
            boolean cancelled = registry.cancel(id);
            return ResponseEntity.ok(Map.of(
                    "research_id", id,
                    "cancelled", cancelled
            ));
        } catch (ResearchSessionNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }

    private static ResponseEntity<Map<String, String>> badRequest(RuntimeException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    private static ResponseEntity<Map<String, String>> conflict(RuntimeException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
    }
}
