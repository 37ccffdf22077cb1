package com.deepresearch.dispatch.api;

import com.deepresearch.core.engine.ResearchSession;
import com.deepresearch.core.events.EventBus;
import com.deepresearch.core.events.ProgressEvent;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Streams research progress to {@link SseEmitter} instances.
 * <p>
 * Two sources are supported. {@link #streamSession(ResearchSession)} drains the session's own
 * event stream on a dedicated thread, so a client that started the session sees every event.
 * {@link #subscribe(ResearchSession)} attaches to the {@link EventBus} and only sees events
 * published after it connected. Both send {@code progress} events followed by one
 * {@code result} event and then complete the emitter.
 * <p>
 * Heartbeats are sent as SSE comments to keep idle connections open through proxies.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    /** Default emitter timeout: 30 minutes. */
    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;

    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    private final EventBus eventBus;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    private final AtomicInteger streamThreads = new AtomicInteger();
    private final ExecutorService streamExecutor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "sse-stream-" + streamThreads.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBus eventBus) {
        this(eventBus, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(EventBus eventBus, long timeoutMs) {
        this.eventBus = eventBus;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(
                this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS,
                HEARTBEAT_INTERVAL_SECONDS,
                TimeUnit.SECONDS
        );
        log.info("SSE heartbeat scheduler started (interval={}s)", HEARTBEAT_INTERVAL_SECONDS);
    }

    @PreDestroy
    void stop() {
        heartbeatScheduler.shutdown();
        streamExecutor.shutdownNow();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("SSE streaming stopped");
    }

    private void sendHeartbeats() {
        if (activeRegistrations.isEmpty()) {
            return;
        }
        log.debug("Sending heartbeat to {} active SSE emitters", activeRegistrations.size());
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter.send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException e) {
                // onError/onCompletion callbacks remove the registration
                log.debug("Heartbeat failed for research {}: {}", registration.researchId, e.getMessage());
            } catch (IllegalStateException e) {
                log.debug("Heartbeat skipped for research {} (emitter not active)", registration.researchId);
            }
        }
    }

    /**
     * Streams every event of a session the caller has just started, then its result.
     *
     * @param session a session whose {@link ResearchSession#events()} has not been consumed
     * @return a configured {@link SseEmitter}
     */
    public SseEmitter streamSession(ResearchSession session) {
        String researchId = session.researchId();
        SseEmitter emitter = new SseEmitter(timeoutMs);
        var registration = register(researchId, emitter, null);

        streamExecutor.execute(() -> {
            try {
                session.events().forEach(event -> sendEvent(emitter, event));
                sendResult(emitter, session);
                emitter.complete();
            } catch (IllegalStateException e) {
                log.debug("Stream for research {} ended early: {}", researchId, e.getMessage());
                emitter.completeWithError(e);
            } finally {
                cleanup(registration);
            }
        });

        log.info("SSE stream started for research {} (timeout={}ms)", researchId, timeoutMs);
        return emitter;
    }

    /**
     * Subscribes to the live events of an existing session. A finished session gets its
     * result immediately.
     */
    public SseEmitter subscribe(ResearchSession session) {
        String researchId = session.researchId();
        SseEmitter emitter = new SseEmitter(timeoutMs);

        if (session.isFinished()) {
            sendResult(emitter, session);
            emitter.complete();
            return emitter;
        }

        var registrationRef = new AtomicReference<EmitterRegistration>();
        EventBus.Subscription subscription = eventBus.subscribe(researchId, event -> {
            sendEvent(emitter, event);
            if (event.isTerminal()) {
                // the result future completes before the terminal event is published
                sendResult(emitter, session);
                emitter.complete();
                EmitterRegistration registration = registrationRef.get();
                if (registration != null) {
                    cleanup(registration);
                }
            }
        });
        var registration = register(researchId, emitter, subscription);
        registrationRef.set(registration);

        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.warn("Failed to send initial heartbeat for research {}: {}", researchId, e.getMessage());
        }

        // the session may have finished between the check above and the subscription
        if (session.isFinished()) {
            cleanup(registration);
            sendResult(emitter, session);
            emitter.complete();
        }

        log.info("SSE subscription created for research {} (timeout={}ms)", researchId, timeoutMs);
        return emitter;
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    /**
     * Snake_case view of a progress event sent as the SSE data frame.
     */
    static Map<String, Object> toPayload(ProgressEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("research_id", event.researchId());
        data.put("sequence", event.sequence());
        data.put("stage", event.stage().name());
        data.put("message", event.message());
        if (event.plan() != null) {
            data.put("plan", PlanPayload.from(event.plan()));
        }
        if (event.currentStepIndex() != null) {
            data.put("current_step_index", event.currentStepIndex());
        }
        if (event.totalSteps() != null) {
            data.put("total_steps", event.totalSteps());
        }
        data.put("observations_so_far", event.observationsSoFar());
        data.put("timestamp", event.timestamp().toString());
        return data;
    }

    private EmitterRegistration register(String researchId, SseEmitter emitter, EventBus.Subscription subscription) {
        var registration = new EmitterRegistration(researchId, emitter, subscription);
        activeRegistrations.add(registration);
        emitter.onCompletion(() -> {
            log.debug("SSE emitter completed for research {}", researchId);
            cleanup(registration);
        });
        emitter.onTimeout(() -> {
            log.debug("SSE emitter timed out for research {}", researchId);
            cleanup(registration);
        });
        emitter.onError(ex -> {
            log.debug("SSE emitter error for research {}: {}", researchId, ex.getMessage());
            cleanup(registration);
        });
        return registration;
    }

    private void sendEvent(SseEmitter emitter, ProgressEvent event) {
        try {
            emitter.send(SseEmitter.event()
                    .id(String.valueOf(event.sequence()))
                    .name("progress")
                    .data(toPayload(event)));
        } catch (IOException | IllegalStateException e) {
            log.debug("Failed to send SSE progress {} for research {}: {}",
                    event.sequence(), event.researchId(), e.getMessage());
        }
    }

    private void sendResult(SseEmitter emitter, ResearchSession session) {
        try {
            emitter.send(SseEmitter.event()
                    .name("result")
                    .data(ResearchResponse.from(session.awaitResult())));
        } catch (IOException | IllegalStateException e) {
            log.debug("Failed to send SSE result for research {}: {}", session.researchId(), e.getMessage());
        }
    }

    private void cleanup(EmitterRegistration registration) {
        if (registration.subscription != null) {
            registration.subscription.unsubscribe();
        }
        if (activeRegistrations.remove(registration)) {
            log.debug("Cleaned up SSE registration for research {}", registration.researchId);
        }
    }

    private record EmitterRegistration(
            String researchId,
            SseEmitter emitter,
            EventBus.Subscription subscription
    ) {}
}
