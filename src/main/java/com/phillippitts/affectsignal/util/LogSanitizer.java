package com.phillippitts.affectsignal.util;

/** Keeps response bodies and identifiers short and single-line before they reach the logs. */
public final class LogSanitizer {

    /** Default preview length for remote response bodies. */
    public static final int BODY_PREVIEW = 200;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Truncates to {@link #BODY_PREVIEW} characters and collapses line breaks, so a remote error
     * page cannot spill over several log lines.
     */
    public static String preview(String body) {
        return truncate(body, BODY_PREVIEW).replaceAll("[\\r\\n]+", " ");
    }
}
