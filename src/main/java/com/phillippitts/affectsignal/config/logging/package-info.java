/**
 * Request correlation for Log4j2.
 *
 * <p>MDC keys:
 * <ul>
 *   <li>{@code requestId}, {@code method}, {@code uri}: set by
 *       {@link com.phillippitts.affectsignal.config.logging.MdcFilter} per HTTP request</li>
 *   <li>{@code sessionId}, {@code questionId}: set around pipeline work for one capture</li>
 * </ul>
 */
package com.phillippitts.affectsignal.config.logging;
