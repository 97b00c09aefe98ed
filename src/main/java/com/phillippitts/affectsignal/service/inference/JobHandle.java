package com.phillippitts.affectsignal.service.inference;

import java.time.Instant;
import java.util.Objects;

/**
 * Reference to a submitted job, returned by {@link InferenceJobClient#submit}.
 *
 * @param jobId identifier assigned by the inference service
 * @param submittedAt wall-clock submission time
 * @param submittedNanos {@link System#nanoTime()} at submission, for elapsed-time measurement
 */
public record JobHandle(String jobId, Instant submittedAt, long submittedNanos) {

    public JobHandle {
        Objects.requireNonNull(jobId, "jobId");
        Objects.requireNonNull(submittedAt, "submittedAt");
    }

    public static JobHandle submittedNow(String jobId) {
        return new JobHandle(jobId, Instant.now(), System.nanoTime());
    }
}
