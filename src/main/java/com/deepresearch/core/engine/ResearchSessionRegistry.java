package com.deepresearch.core.engine;

import com.deepresearch.core.model.PlanApproval;
import com.deepresearch.core.model.ResearchConfig;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs research sessions on a bounded worker pool and keeps them addressable by id.
 * <p>
 * Sessions queue when every worker is busy. Finished sessions stay available for
 * lookups until {@code maxRetainedSessions} is exceeded, oldest first out.
 */
@Service
public class ResearchSessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(ResearchSessionRegistry.class);

    private final ResearchOrchestrator orchestrator;
    private final int maxRetainedSessions;
    private final ExecutorService workers;
    private final ConcurrentHashMap<String, ResearchSession> sessions = new ConcurrentHashMap<>();

    public ResearchSessionRegistry(ResearchOrchestrator orchestrator, ResearchProperties properties) {
        this.orchestrator = orchestrator;
        this.maxRetainedSessions = Math.max(1, properties.getMaxRetainedSessions());
        int threads = Math.max(1, properties.getWorkerThreads());
        var counter = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "research-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        log.info("Research worker pool started with {} thread(s)", threads);
    }

    /**
     * Starts a new session in the background and returns at once.
     *
     * @throws com.deepresearch.core.model.ResearchConfigurationException if the request is invalid
     */
    public ResearchSession start(String query, ResearchConfig config) {
        ResearchSession session = orchestrator.newSession(query, config);
        submit(session);
        return session;
    }

    /**
     * Continues a session that is awaiting plan approval. The returned session keeps the
     * research id and replaces the suspended one in the registry.
     *
     * @throws IllegalStateException if the session is not awaiting approval or was already resumed
     */
    public ResearchSession resume(String researchId, PlanApproval approval) {
        ResearchSession resumed = orchestrator.resume(get(researchId), approval);
        submit(resumed);
        return resumed;
    }

    /**
     * Answers the clarification question of a session; the follow-up runs under a new id.
     *
     * @throws IllegalStateException if no question is pending or it was already answered
     */
    public ResearchSession answer(String researchId, String answer) {
        ResearchSession followUp = orchestrator.followUp(get(researchId), answer);
        submit(followUp);
        return followUp;
    }

    /**
     * @return true if a running session was cancelled
     */
    public boolean cancel(String researchId) {
        boolean cancelled = get(researchId).cancel("cancelled by caller");
        if (cancelled) {
            log.info("Cancellation requested for research {}", researchId);
        }
        return cancelled;
    }

    public Optional<ResearchSession> find(String researchId) {
        return Optional.ofNullable(sessions.get(researchId));
    }

    /**
     * @throws ResearchSessionNotFoundException if the id is unknown
     */
    public ResearchSession get(String researchId) {
        return find(researchId).orElseThrow(() -> new ResearchSessionNotFoundException(researchId));
    }

    public int activeCount() {
        return (int) sessions.values().stream().filter(s -> !s.isFinished()).count();
    }

    public int size() {
        return sessions.size();
    }

    private void submit(ResearchSession session) {
        sessions.put(session.researchId(), session);
        evictFinished();
        workers.execute(new SessionTask(orchestrator, session));
        log.debug("Research {} queued at {}", session.researchId(), session.startStage());
    }

    private void evictFinished() {
        int excess = sessions.size() - maxRetainedSessions;
        if (excess <= 0) {
            return;
        }
        sessions.values().stream()
                .filter(ResearchSession::isFinished)
                .sorted(Comparator.comparing(ResearchSession::createdAt))
                .limit(excess)
                .forEach(s -> sessions.remove(s.researchId(), s));
    }

    @PreDestroy
    void shutdown() {
        sessions.values().forEach(s -> s.cancel("shutting down"));
        List<Runnable> neverStarted = workers.shutdownNow();
        // queued sessions still need a terminal result for anyone waiting on them
        for (Runnable r : neverStarted) {
            if (r instanceof SessionTask task) {
                orchestrator.drive(task.session());
            }
        }
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Research workers did not stop within 10s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Research worker pool stopped");
    }

    private record SessionTask(ResearchOrchestrator orchestrator, ResearchSession session) implements Runnable {
        @Override
        public void run() {
            orchestrator.drive(session);
        }
    }
}
