package com.phillippitts.affectsignal.service.inference;

import com.phillippitts.affectsignal.domain.EmotionVector;
import com.phillippitts.affectsignal.domain.ImageArtifact;
import com.phillippitts.affectsignal.exception.SubmissionException;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Turns one captured image into one {@link Resolution} through an asynchronous remote job.
 *
 * <p>Apart from {@link #submit}, no method surfaces transport or payload failures: they become
 * FAILED, TIMED_OUT or EMPTY resolutions.
 */
public interface InferenceJobClient {

    /**
     * Submits an image for analysis. The caller may drop the image once this returns.
     *
     * @param image frame to analyze
     * @return handle of the created job
     * @throws SubmissionException if the service rejects the submission (not retried)
     */
    JobHandle submit(ImageArtifact image);

    /**
     * Polls the job until it reaches a terminal state, racing the given deadline. When the job
     * completes, the result is fetched (see {@link #fetchResult}) inside the same deadline.
     *
     * @param handle submitted job
     * @param deadline wall-clock budget, measured from this call
     * @return future that always completes normally with a resolution
     */
    CompletableFuture<Resolution> poll(JobHandle handle, Duration deadline);

    /**
     * Fetches and unwraps the predictions of a completed job, retrying a bounded number of times
     * while the payload is missing or inconsistent.
     *
     * @param handle completed job
     * @return future completing with the raw vector, empty when nothing was detected
     */
    CompletableFuture<EmotionVector> fetchResult(JobHandle handle);
}
