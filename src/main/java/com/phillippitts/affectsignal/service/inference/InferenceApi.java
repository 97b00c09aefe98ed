package com.phillippitts.affectsignal.service.inference;

import com.phillippitts.affectsignal.domain.ImageArtifact;
import com.phillippitts.affectsignal.exception.SubmissionException;

/**
 * Raw request/response seam of the remote batch inference protocol.
 *
 * <p>Implementations perform one HTTP exchange per call and return the response body untouched;
 * interpretation of the payloads belongs to {@link InferenceJobClient}. Any call may block for
 * the duration of one request.
 */
public interface InferenceApi {

    /**
     * {@code POST /jobs} with the image and the face-model descriptor.
     *
     * @param image frame to analyze
     * @return job identifier
     * @throws SubmissionException on transport failure, non-2xx response, or a response without a job id
     */
    String createJob(ImageArtifact image);

    /**
     * {@code GET /jobs/{id}}.
     *
     * @return raw status JSON
     * @throws com.phillippitts.affectsignal.exception.AffectSignalException on transport failure or non-2xx response
     */
    String fetchStatus(String jobId);

    /**
     * {@code GET /jobs/{id}/predictions}.
     *
     * @return raw predictions JSON
     * @throws com.phillippitts.affectsignal.exception.AffectSignalException on transport failure or non-2xx response
     */
    String fetchPredictions(String jobId);
}
