/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.affectsignal.exception.AffectSignalException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.affectsignal.exception.SubmissionException} - The inference
 *       service rejected a job submission (transport or auth)</li>
 *   <li>{@link com.phillippitts.affectsignal.exception.PollTimeoutException} - A job did not
 *       resolve before its deadline; carried as a diagnostic cause, routes to fallback</li>
 *   <li>{@link com.phillippitts.affectsignal.exception.SchemaException} - A predictions payload
 *       could not be unwrapped; routes to fallback after all fetch attempts</li>
 *   <li>{@link com.phillippitts.affectsignal.exception.DuplicateKeyException} - A second write
 *       for the same question; the only error surfaced to callers</li>
 *   <li>{@link com.phillippitts.affectsignal.exception.UnknownSessionException} - A request
 *       named a session that is not open</li>
 * </ul>
 *
 * <p>A face-less but successful inference result is not an exception; it is the empty
 * outcome of {@link com.phillippitts.affectsignal.service.inference.Resolution}.
 *
 * @see com.phillippitts.affectsignal.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.affectsignal.exception;
