/**
 * REST API controllers.
 *
 * <p>Endpoints (all under {@code /api/sessions/{sessionId}}):
 * <ul>
 *   <li>{@code POST /captures} - multipart frame plus round, question and ordinal; 202</li>
 *   <li>{@code GET /expressions/{questionId}} - stored expression or 404</li>
 *   <li>{@code GET /report} - per-round and overall statistics</li>
 *   <li>{@code DELETE} - close the session, abandoning outstanding captures</li>
 * </ul>
 *
 * @see com.phillippitts.affectsignal.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.affectsignal.presentation.controller;
