package com.phillippitts.affectsignal.domain;

/**
 * Provenance of a stored expression.
 */
public enum ExpressionSource {
    /** Vector came from a successful, non-empty remote inference result. */
    REAL,
    /** Vector was generated locally by the fallback synthesizer. */
    SYNTHETIC
}
