/**
 * Domain models for per-question affect signals.
 *
 * <p>All domain models are immutable and self-validating:
 * <ul>
 *   <li>{@link com.phillippitts.affectsignal.domain.EmotionScore} - one label/score pair,
 *       score clamped to [0, 1]</li>
 *   <li>{@link com.phillippitts.affectsignal.domain.EmotionVector} - ordered scores, possibly empty</li>
 *   <li>{@link com.phillippitts.affectsignal.domain.QuestionExpression} - the one resolved
 *       vector recorded for a question, with provenance</li>
 *   <li>{@link com.phillippitts.affectsignal.domain.RoundRecord} - expressions of one round
 *       in capture order</li>
 *   <li>{@link com.phillippitts.affectsignal.domain.CaptureKey} and
 *       {@link com.phillippitts.affectsignal.domain.ImageArtifact} - the inputs handed in by a
 *       capture trigger</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.affectsignal.domain;
