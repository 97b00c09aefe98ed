/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.affectsignal.exception.DuplicateKeyException} → 409 Conflict</li>
 *   <li>{@link IllegalStateException} (closed session) → 409 Conflict</li>
 *   <li>{@link com.phillippitts.affectsignal.exception.UnknownSessionException} → 404 Not Found</li>
 *   <li>Invalid or missing request input → 400 Bad Request</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "UnknownSessionException",
 *   "message": "Session not found",
 *   "details": "No active session: s1",
 *   "timestamp": "2026-03-02T10:15:30.000Z"
 * }
 * </pre>
 */
package com.phillippitts.affectsignal.presentation.exception;
