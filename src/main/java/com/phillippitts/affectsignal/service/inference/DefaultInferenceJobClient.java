package com.phillippitts.affectsignal.service.inference;

import com.phillippitts.affectsignal.config.properties.InferenceProperties;
import com.phillippitts.affectsignal.domain.EmotionVector;
import com.phillippitts.affectsignal.domain.ImageArtifact;
import com.phillippitts.affectsignal.exception.AffectSignalException;
import com.phillippitts.affectsignal.exception.PollTimeoutException;
import com.phillippitts.affectsignal.exception.SchemaException;
import com.phillippitts.affectsignal.exception.SubmissionException;
import com.phillippitts.affectsignal.util.MdcPropagation;
import com.phillippitts.affectsignal.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

/**
 * Drives remote jobs through submit, poll and fetch on a shared scheduler.
 *
 * <p>No thread ever sleeps: every status check and every fetch retry is a separately scheduled
 * task, so one scheduler thread can interleave many jobs. A poll run ends on the first of
 * <ul>
 *   <li>a COMPLETED status followed by a fetch (with its own bounded retries),</li>
 *   <li>a FAILED status or a failing status call,</li>
 *   <li>the poll attempt budget running out,</li>
 *   <li>the caller's deadline.</li>
 * </ul>
 * Once the returned future is complete, outstanding ticks and fetch retries see it and stop
 * without calling the service again.
 *
 * <p>Thread-safe.
 */
public final class DefaultInferenceJobClient implements InferenceJobClient {

    private static final Logger LOG = LogManager.getLogger(DefaultInferenceJobClient.class);

    private final InferenceApi api;
    private final ScheduledExecutorService scheduler;
    private final InferenceProperties props;

    public DefaultInferenceJobClient(InferenceApi api, ScheduledExecutorService scheduler, InferenceProperties props) {
        this.api = Objects.requireNonNull(api, "api");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.props = Objects.requireNonNull(props, "props");
    }

    @Override
    public JobHandle submit(ImageArtifact image) {
        Objects.requireNonNull(image, "image");
        long start = System.nanoTime();
        String jobId;
        try {
            jobId = api.createJob(image);
        } catch (SubmissionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SubmissionException("Job submission failed: " + e.getMessage(), e);
        }
        if (jobId == null || jobId.isBlank()) {
            throw new SubmissionException("Job submission returned no job id");
        }
        JobHandle handle = new JobHandle(jobId, Instant.now(), start);
        LOG.debug("Submitted inference job {} in {} ms", jobId, TimeUtils.elapsedMillis(start));
        return handle;
    }

    @Override
    public CompletableFuture<Resolution> poll(JobHandle handle, Duration deadline) {
        Objects.requireNonNull(handle, "handle");
        Objects.requireNonNull(deadline, "deadline");
        PollRun run = new PollRun(handle);
        CompletableFuture<Resolution> result = new CompletableFuture<>();

        long deadlineMs = Math.max(0, deadline.toMillis());
        ScheduledFuture<?> timer = scheduleOrFail(() -> expire(run, result, deadlineMs), deadlineMs, run, result);
        result.whenComplete((r, t) -> {
            if (timer != null) {
                timer.cancel(false);
            }
            run.cancelPending();
        });
        scheduleTick(run, result);
        return result;
    }

    @Override
    public CompletableFuture<EmotionVector> fetchResult(JobHandle handle) {
        Objects.requireNonNull(handle, "handle");
        return fetch(handle, () -> false).thenApply(FetchOutcome::vector);
    }

    private void scheduleTick(PollRun run, CompletableFuture<Resolution> result) {
        run.pending = scheduleOrFail(() -> tick(run, result), props.getPollIntervalMs(), run, result);
    }

    private void tick(PollRun run, CompletableFuture<Resolution> result) {
        if (result.isDone()) {
            return;
        }
        String jobId = run.handle.jobId();
        int attempt = run.attempts.incrementAndGet();
        JobState state;
        try {
            state = InferenceJsonParser.parseStatus(api.fetchStatus(jobId));
        } catch (RuntimeException e) {
            run.state = JobState.FAILED;
            result.complete(Resolution.failed(jobId, attempt, run.elapsedMs(), asAffectSignal(e, "Status check failed")));
            return;
        }
        run.state = state;
        LOG.debug("Job {} status check {}/{}: {}", jobId, attempt, props.getMaxPollAttempts(), state);

        switch (state) {
            case COMPLETED -> fetch(run.handle, result::isDone).whenComplete((fetched, err) -> {
                if (err != null) {
                    result.complete(Resolution.failed(jobId, attempt, run.elapsedMs(),
                            asAffectSignal(err, "Predictions fetch failed")));
                } else if (fetched.vector().isEmpty()) {
                    result.complete(Resolution.empty(jobId, attempt, run.elapsedMs(), fetched.lastFailure()));
                } else {
                    result.complete(Resolution.completed(fetched.vector(), jobId, attempt, run.elapsedMs()));
                }
            });
            case FAILED -> result.complete(Resolution.failed(jobId, attempt, run.elapsedMs(),
                    new AffectSignalException("Inference job " + jobId + " reported FAILED")));
            default -> {
                if (attempt >= props.getMaxPollAttempts()) {
                    run.state = JobState.TIMED_OUT;
                    long elapsed = run.elapsedMs();
                    result.complete(Resolution.timedOut(jobId, attempt, elapsed,
                            new PollTimeoutException(jobId, elapsed, attempt + " status checks")));
                } else {
                    scheduleTick(run, result);
                }
            }
        }
    }

    private void expire(PollRun run, CompletableFuture<Resolution> result, long deadlineMs) {
        long elapsed = run.elapsedMs();
        Resolution timedOut = Resolution.timedOut(run.handle.jobId(), run.attempts.get(), elapsed,
                new PollTimeoutException(run.handle.jobId(), elapsed, "deadline of " + deadlineMs + " ms"));
        JobState last = run.state;
        if (result.complete(timedOut)) {
            run.state = JobState.TIMED_OUT;
            LOG.debug("Job {} abandoned at deadline in state {} after {} status checks",
                    run.handle.jobId(), last, run.attempts.get());
        }
    }

    private CompletableFuture<FetchOutcome> fetch(JobHandle handle, BooleanSupplier abandoned) {
        CompletableFuture<FetchOutcome> out = new CompletableFuture<>();
        scheduleFetch(handle, 1, null, out, abandoned, props.getFetchInitialDelayMs());
        return out;
    }

    private void scheduleFetch(JobHandle handle, int attempt, AffectSignalException previous,
                               CompletableFuture<FetchOutcome> out, BooleanSupplier abandoned, long delayMs) {
        try {
            scheduler.schedule(MdcPropagation.wrap(() -> fetchAttempt(handle, attempt, previous, out, abandoned)),
                    delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            out.completeExceptionally(e);
        }
    }

    private void fetchAttempt(JobHandle handle, int attempt, AffectSignalException previous,
                              CompletableFuture<FetchOutcome> out, BooleanSupplier abandoned) {
        if (abandoned.getAsBoolean()) {
            out.complete(new FetchOutcome(EmotionVector.empty(), previous));
            return;
        }
        AffectSignalException failure;
        try {
            EmotionVector vector = InferenceJsonParser.parseEmotions(api.fetchPredictions(handle.jobId()));
            if (vector.isEmpty()) {
                LOG.debug("Job {} completed with no face detected", handle.jobId());
            }
            out.complete(new FetchOutcome(vector, null));
            return;
        } catch (RuntimeException e) {
            failure = asAffectSignal(e, "Predictions fetch failed");
        }

        int maxAttempts = props.getFetchAttempts();
        if (attempt >= maxAttempts) {
            if (failure instanceof SchemaException schema) {
                LOG.warn("No usable predictions for job {} after {} attempts (layer {}): {}",
                        handle.jobId(), attempt, schema.getLayer(), schema.getMessage());
            } else {
                LOG.warn("No usable predictions for job {} after {} attempts: {}",
                        handle.jobId(), attempt, failure.getMessage());
            }
            out.complete(new FetchOutcome(EmotionVector.empty(), failure));
            return;
        }
        LOG.debug("Predictions attempt {}/{} for job {} unusable, retrying: {}",
                attempt, maxAttempts, handle.jobId(), failure.getMessage());
        scheduleFetch(handle, attempt + 1, failure, out, abandoned, props.getFetchRetryPauseMs());
    }

    private ScheduledFuture<?> scheduleOrFail(Runnable task, long delayMs, PollRun run,
                                              CompletableFuture<Resolution> result) {
        try {
            return scheduler.schedule(MdcPropagation.wrap(task), delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            result.complete(Resolution.failed(run.handle.jobId(), run.attempts.get(), run.elapsedMs(),
                    new AffectSignalException("Inference scheduler rejected work", e)));
            return null;
        }
    }

    private static AffectSignalException asAffectSignal(Throwable t, String message) {
        if (t instanceof AffectSignalException ase) {
            return ase;
        }
        return new AffectSignalException(message + ": " + t.getMessage(), t);
    }

    /** Mutable progress of one poll run. */
    private static final class PollRun {
        private final JobHandle handle;
        private final AtomicInteger attempts = new AtomicInteger();
        private volatile JobState state = JobState.SUBMITTED;
        private volatile ScheduledFuture<?> pending;

        PollRun(JobHandle handle) {
            this.handle = handle;
        }

        long elapsedMs() {
            return TimeUtils.elapsedMillis(handle.submittedNanos());
        }

        void cancelPending() {
            ScheduledFuture<?> p = pending;
            if (p != null) {
                p.cancel(false);
            }
        }
    }

    private record FetchOutcome(EmotionVector vector, AffectSignalException lastFailure) {
    }
}
