/**
 * Service layer.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code service.inference} - remote job submission, polling and result parsing</li>
 *   <li>{@code service.normalize} - label reconciliation with the canonical taxonomy</li>
 *   <li>{@code service.synthesis} - deterministic fallback vectors</li>
 *   <li>{@code service.store} - per-session expression storage</li>
 *   <li>{@code service.aggregate} - round and session statistics</li>
 *   <li>{@code service.pipeline} - per-session orchestration and session registry</li>
 *   <li>{@code service.metrics}, {@code service.health} - Micrometer and Actuator integration</li>
 * </ul>
 *
 * <p>Services throw domain exceptions from {@code com.phillippitts.affectsignal.exception}, never
 * HTTP exceptions, and use constructor injection.
 */
package com.phillippitts.affectsignal.service;
