package com.phillippitts.affectsignal.util;

import org.apache.logging.log4j.ThreadContext;

import java.util.Map;

/**
 * Carries the Log4j2 {@link ThreadContext} of the submitting thread into a task run elsewhere.
 */
public final class MdcPropagation {

    private MdcPropagation() {
    }

    /**
     * Captures the current context now and installs it around {@code task} when it runs. The
     * worker's previous context is restored afterwards.
     */
    public static Runnable wrap(Runnable task) {
        Map<String, String> contextMap = ThreadContext.getImmutableContext();
        return () -> {
            Map<String, String> previous = ThreadContext.getImmutableContext();
            try {
                if (contextMap != null && !contextMap.isEmpty()) {
                    ThreadContext.putAll(contextMap);
                }
                task.run();
            } finally {
                ThreadContext.clearAll();
                if (previous != null && !previous.isEmpty()) {
                    ThreadContext.putAll(previous);
                }
            }
        };
    }
}
