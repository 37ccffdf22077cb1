package com.deepresearch.core.engine;

import com.deepresearch.core.events.ProgressEvent;
import com.deepresearch.core.model.Plan;
import com.deepresearch.core.model.ResearchResult;
import com.deepresearch.core.model.ResearchStage;
import com.deepresearch.core.state.ResearchContext;

import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Handle on one run of the research state machine.
 * <p>
 * Progress events are queued without bound and never dropped. {@link #events()} can
 * be consumed once; it blocks for each event and ends after the terminal one. The
 * terminal result becomes available before the terminal event is queued.
 * <p>
 * Resuming an approved plan creates a new session over the same context; its
 * event sequence continues where the suspended one stopped.
 */
public class ResearchSession {

    private final ResearchContext context;
    private final ResearchStage startStage;
    private final Instant createdAt = Instant.now();
    private final LinkedBlockingQueue<ProgressEvent> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean eventsTaken = new AtomicBoolean();
    private final AtomicBoolean continued = new AtomicBoolean();
    private final AtomicLong sequence;
    private final CompletableFuture<ResearchResult> result = new CompletableFuture<>();

    private volatile ResearchStage stage;

    ResearchSession(ResearchContext context, ResearchStage startStage, long lastSequence) {
        this.context = context;
        this.startStage = startStage;
        this.stage = startStage;
        this.sequence = new AtomicLong(lastSequence);
    }

    public String researchId() {
        return context.researchId();
    }

    public ResearchContext context() {
        return context;
    }

    public ResearchStage startStage() {
        return startStage;
    }

    /**
     * Stage most recently entered.
     */
    public ResearchStage stage() {
        return stage;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public boolean isFinished() {
        return result.isDone();
    }

    long lastSequence() {
        return sequence.get();
    }

    /**
     * Claims the right to continue this suspended session. Only the first caller wins,
     * so an approval or clarification answer is applied at most once.
     */
    boolean claimContinuation() {
        return continued.compareAndSet(false, true);
    }

    /**
     * Requests cancellation. A no-op once the session has finished.
     *
     * @return true if this call cancelled a running session
     */
    public boolean cancel(String reason) {
        if (isFinished()) {
            return false;
        }
        return context.cancellation().cancel(reason);
    }

    /**
     * Ordered progress events of this session. Lazy and finite: each element is taken
     * from the queue when requested and the stream ends after the terminal event.
     *
     * @throws IllegalStateException on a second call
     */
    public Stream<ProgressEvent> events() {
        if (!eventsTaken.compareAndSet(false, true)) {
            throw new IllegalStateException("Events of research " + researchId() + " were already consumed");
        }
        Iterator<ProgressEvent> iterator = new Iterator<>() {
            private boolean done;

            @Override
            public boolean hasNext() {
                return !done;
            }

            @Override
            public ProgressEvent next() {
                if (done) {
                    throw new NoSuchElementException();
                }
                try {
                    ProgressEvent event = queue.take();
                    done = event.isTerminal();
                    return event;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Interrupted while waiting for events of " + researchId(), e);
                }
            }
        };
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    /**
     * The terminal result, if the session has finished.
     */
    public Optional<ResearchResult> result() {
        return Optional.ofNullable(result.getNow(null));
    }

    public CompletableFuture<ResearchResult> resultFuture() {
        return result;
    }

    /**
     * Blocks until the session reaches a terminal stage.
     */
    public ResearchResult awaitResult() {
        try {
            return result.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for research " + researchId(), e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Research " + researchId() + " ended abnormally", e.getCause());
        }
    }

    /**
     * Blocks until the session finishes or the timeout elapses.
     */
    public ResearchResult awaitResult(Duration timeout) throws TimeoutException {
        try {
            return result.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for research " + researchId(), e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Research " + researchId() + " ended abnormally", e.getCause());
        }
    }

    ProgressEvent emit(ResearchStage entered, String message, Integer currentStepIndex) {
        this.stage = entered;
        Plan plan = context.currentPlan();
        var event = new ProgressEvent(
                researchId(),
                sequence.incrementAndGet(),
                entered,
                message,
                plan,
                currentStepIndex,
                plan != null ? plan.totalSteps() : null,
                context.observations().contents(),
                Instant.now());
        queue.add(event);
        return event;
    }

    void complete(ResearchResult terminal) {
        result.complete(terminal);
    }
}
