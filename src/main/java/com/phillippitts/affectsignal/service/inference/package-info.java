/**
 * Client for the remote batch inference service: job submission, status polling and predictions
 * fetching, surfaced as a single {@link com.phillippitts.affectsignal.service.inference.Resolution}.
 */
package com.phillippitts.affectsignal.service.inference;
