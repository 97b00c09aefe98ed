package com.phillippitts.affectsignal.service.pipeline;

import com.phillippitts.affectsignal.domain.CaptureKey;
import com.phillippitts.affectsignal.domain.EmotionVector;
import com.phillippitts.affectsignal.domain.ExpressionSource;
import com.phillippitts.affectsignal.domain.ImageArtifact;
import com.phillippitts.affectsignal.domain.QuestionExpression;
import com.phillippitts.affectsignal.exception.AffectSignalException;
import com.phillippitts.affectsignal.exception.SubmissionException;
import com.phillippitts.affectsignal.service.aggregate.EmotionAggregator;
import com.phillippitts.affectsignal.service.aggregate.SessionReport;
import com.phillippitts.affectsignal.service.inference.InferenceJobClient;
import com.phillippitts.affectsignal.service.inference.JobHandle;
import com.phillippitts.affectsignal.service.inference.Resolution;
import com.phillippitts.affectsignal.service.normalize.LabelNormalizer;
import com.phillippitts.affectsignal.service.pipeline.event.ExpressionRecordedEvent;
import com.phillippitts.affectsignal.service.store.ExpressionStore;
import com.phillippitts.affectsignal.service.synthesis.FallbackSynthesizer;
import com.phillippitts.affectsignal.util.TimeUtils;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Resolves captured frames into stored expressions for one interview session.
 *
 * <p>Per question:
 * <pre>
 * Triggered → JobSubmitted → Polling → { Completed → FetchingResult → { Real | Empty } | Failed | TimedOut }
 *           → Resolved(Real | Synthetic) → Stored
 * </pre>
 * Submission runs on the inference executor and polling on the client's scheduler, so
 * {@link #capture} returns immediately. Every outcome other than a non-empty real vector
 * (submission rejected, job failed, poll budget or deadline exhausted, no face) is replaced by
 * a synthetic vector, so each accepted trigger ends in exactly one store write.
 *
 * <p>A second trigger for a question that is in flight or stored does not submit another job; it
 * receives the first trigger's future. After {@link #close()} outstanding jobs are abandoned:
 * their futures are cancelled and nothing more is written.
 *
 * <p>Thread-safe. Instances are created by {@link AffectPipelineFactory}.
 */
public final class AffectPipeline implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(AffectPipeline.class);

    private final String sessionId;
    private final InferenceJobClient client;
    private final Executor executor;
    private final LabelNormalizer normalizer;
    private final FallbackSynthesizer synthesizer;
    private final ExpressionStore store;
    private final EmotionAggregator aggregator;
    private final ApplicationEventPublisher publisher;
    private final InferenceMetricsPublisher metrics;
    private final Duration deadline;

    private final Map<String, CompletableFuture<QuestionExpression>> triggered = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<Resolution>> polling = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Lock writeLock = new ReentrantLock();
    private volatile boolean closed;

    AffectPipeline(String sessionId,
                   InferenceJobClient client,
                   Executor executor,
                   LabelNormalizer normalizer,
                   FallbackSynthesizer synthesizer,
                   ExpressionStore store,
                   EmotionAggregator aggregator,
                   ApplicationEventPublisher publisher,
                   InferenceMetricsPublisher metrics,
                   Duration deadline) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.client = Objects.requireNonNull(client, "client");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.synthesizer = Objects.requireNonNull(synthesizer, "synthesizer");
        this.store = Objects.requireNonNull(store, "store");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = metrics != null ? metrics : InferenceMetricsPublisher.NOOP;
        this.deadline = Objects.requireNonNull(deadline, "deadline");
    }

    /**
     * Starts resolving the frame captured for a question.
     *
     * <p>The image reference is released once the submission call has returned.
     *
     * @param key round, question and ordinal of the capture
     * @param image captured frame
     * @return copy of the future completing with the stored expression; completes exceptionally
     *         only with {@link com.phillippitts.affectsignal.exception.DuplicateKeyException} if the
     *         store already held the question, or with a
     *         {@link java.util.concurrent.CancellationException} cause if the session closes first.
     *         Completing or cancelling the copy does not affect the store write.
     * @throws IllegalStateException if the session is closed
     */
    public CompletableFuture<QuestionExpression> capture(CaptureKey key, ImageArtifact image) {
        return trigger(key, image).expression();
    }

    /**
     * Same as {@link #capture} but also reports whether the trigger was a duplicate.
     *
     * @throws IllegalStateException if the session is closed
     */
    public CaptureTrigger trigger(CaptureKey key, ImageArtifact image) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(image, "image");
        if (closed) {
            throw new IllegalStateException("Session " + sessionId + " is closed");
        }

        CompletableFuture<QuestionExpression> fresh = new CompletableFuture<>();
        CompletableFuture<QuestionExpression> existing = triggered.putIfAbsent(key.questionId(), fresh);
        if (existing != null) {
            metrics.recordDuplicate();
            LOG.debug("Duplicate trigger for question {} in session {}; no new job", key.questionId(), sessionId);
            return new CaptureTrigger(key.questionId(), true, existing.copy());
        }
        if (closed) {
            triggered.remove(key.questionId(), fresh);
            fresh.cancel(false);
            throw new IllegalStateException("Session " + sessionId + " is closed");
        }

        long seq = sequence.getAndIncrement();
        Instant capturedAt = Instant.now();
        long startNanos = System.nanoTime();
        AtomicReference<ImageArtifact> imageRef = new AtomicReference<>(image);

        CompletableFuture<Resolution> resolution;
        try {
            resolution = CompletableFuture
                    .supplyAsync(() -> submitAndPoll(key, imageRef, startNanos), executor)
                    .thenCompose(Function.identity());
        } catch (RejectedExecutionException e) {
            imageRef.set(null);
            resolution = CompletableFuture.completedFuture(Resolution.failed(null, 0,
                    TimeUtils.elapsedMillis(startNanos), new AffectSignalException("Inference executor rejected capture", e)));
        }

        resolution
                .exceptionally(t -> Resolution.failed(null, 0, TimeUtils.elapsedMillis(startNanos),
                        new AffectSignalException("Unexpected inference failure: " + t.getMessage(), t)))
                .thenAccept(res -> record(key, seq, capturedAt, res, fresh));
        return new CaptureTrigger(key.questionId(), false, fresh.copy());
    }

    private CompletableFuture<Resolution> submitAndPoll(CaptureKey key,
                                                        AtomicReference<ImageArtifact> imageRef,
                                                        long startNanos) {
        try (CloseableThreadContext.Instance ctx = questionContext(key)) {
            ImageArtifact image = imageRef.getAndSet(null);
            if (closed || image == null) {
                return CompletableFuture.completedFuture(Resolution.failed(null, 0,
                        TimeUtils.elapsedMillis(startNanos), new AffectSignalException("Session closed before submission")));
            }
            JobHandle handle;
            try {
                handle = client.submit(image);
            } catch (SubmissionException e) {
                LOG.warn("Submission failed for question {}: {}", key.questionId(), e.getMessage());
                return CompletableFuture.completedFuture(
                        Resolution.failed(null, 0, TimeUtils.elapsedMillis(startNanos), e));
            }
            Duration remaining = deadline.minusMillis(TimeUtils.elapsedMillis(startNanos));
            CompletableFuture<Resolution> poll = client.poll(handle, remaining.isNegative() ? Duration.ZERO : remaining);
            polling.put(key.questionId(), poll);
            if (closed) {
                poll.cancel(false);
            }
            return poll;
        }
    }

    private void record(CaptureKey key,
                        long seq,
                        Instant capturedAt,
                        Resolution res,
                        CompletableFuture<QuestionExpression> fresh) {
        polling.remove(key.questionId());
        try (CloseableThreadContext.Instance ctx = questionContext(key)) {
            EmotionVector vector = res.hasSignal() ? normalizer.normalize(res.vector()) : EmotionVector.empty();
            ExpressionSource source = ExpressionSource.REAL;
            if (vector.isEmpty()) {
                vector = synthesizer.synthesize(key);
                source = ExpressionSource.SYNTHETIC;
                logFallback(key, res);
            }
            QuestionExpression expression = QuestionExpression.of(key, seq, vector, source, capturedAt);

            writeLock.lock();
            try {
                if (closed) {
                    LOG.debug("Session {} closed; discarding {} result for question {}",
                            sessionId, res.tag(), key.questionId());
                    fresh.cancel(false);
                    return;
                }
                store.put(expression);
            } finally {
                writeLock.unlock();
            }

            metrics.recordResolution(metricTag(res), res.elapsedMs());
            metrics.recordExpression(source);
            LOG.info("Recorded {} expression for question {} (outcome={}, jobId={}, elapsedMs={})",
                    source, key.questionId(), res.tag(), res.jobId(), res.elapsedMs());
            publisher.publishEvent(new ExpressionRecordedEvent(sessionId, expression, res.outcome(), Instant.now()));
            fresh.complete(expression);
        } catch (RuntimeException e) {
            LOG.warn("Could not record expression for question {}: {}", key.questionId(), e.getMessage());
            fresh.completeExceptionally(e);
        }
    }

    private void logFallback(CaptureKey key, Resolution res) {
        String cause = res.cause() != null ? res.cause().getMessage() : "no face detected";
        switch (res.outcome()) {
            case EMPTY -> LOG.info("No usable expression for question {} (jobId={}, elapsedMs={}): {}; using synthetic",
                    key.questionId(), res.jobId(), res.elapsedMs(), cause);
            case TIMED_OUT -> LOG.warn("Inference timed out for question {} (jobId={}, attempts={}, elapsedMs={}); using synthetic",
                    key.questionId(), res.jobId(), res.pollAttempts(), res.elapsedMs());
            default -> LOG.warn("Inference failed for question {} (jobId={}, elapsedMs={}): {}; using synthetic",
                    key.questionId(), res.jobId(), res.elapsedMs(), cause);
        }
    }

    private static String metricTag(Resolution res) {
        if (res.jobId() == null && res.cause() instanceof SubmissionException) {
            return "submission_failed";
        }
        return res.tag();
    }

    private CloseableThreadContext.Instance questionContext(CaptureKey key) {
        return CloseableThreadContext.put("sessionId", sessionId)
                .put("questionId", key.questionId());
    }

    /**
     * @return the stored expression for a question, if resolved
     */
    public Optional<QuestionExpression> expression(String questionId) {
        return store.get(questionId);
    }

    /**
     * @return per-round and overall statistics over everything stored so far
     */
    public SessionReport report() {
        return aggregator.report(store.rounds());
    }

    public ExpressionStore store() {
        return store;
    }

    public String sessionId() {
        return sessionId;
    }

    /**
     * @return triggers whose expression has not been stored yet
     */
    public int pendingCount() {
        int pending = 0;
        for (CompletableFuture<QuestionExpression> f : triggered.values()) {
            if (!f.isDone()) {
                pending++;
            }
        }
        return pending;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Ends the session. Outstanding captures are cancelled and never written. Idempotent.
     */
    @Override
    public void close() {
        writeLock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
        } finally {
            writeLock.unlock();
        }
        for (CompletableFuture<Resolution> poll : polling.values()) {
            poll.cancel(false);
        }
        int abandoned = 0;
        for (CompletableFuture<QuestionExpression> f : triggered.values()) {
            if (f.cancel(false)) {
                abandoned++;
            }
        }
        LOG.info("Closed session {} ({} expressions stored, {} captures abandoned)", sessionId, store.size(), abandoned);
    }
}
