/**
 * Per-session capture pipeline: submission, resolution, fallback and recording of question
 * expressions, plus the registry of open sessions.
 */
package com.phillippitts.affectsignal.service.pipeline;
