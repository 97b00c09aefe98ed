package com.phillippitts.affectsignal.service.pipeline;

import com.phillippitts.affectsignal.domain.ExpressionSource;
import com.phillippitts.affectsignal.service.metrics.InferenceMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Null-safe front for {@link InferenceMetrics} used by the pipeline.
 *
 * <p>Every method is a no-op when constructed without metrics, so pipelines built in tests
 * can pass {@link #NOOP}.
 */
@Component
public final class InferenceMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(InferenceMetricsPublisher.class);

    public static final InferenceMetricsPublisher NOOP = new InferenceMetricsPublisher(null);

    private final InferenceMetrics metrics;

    /**
     * @param metrics metrics service (nullable for test mode)
     */
    public InferenceMetricsPublisher(InferenceMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("InferenceMetricsPublisher created without metrics (test mode)");
        }
    }

    public void recordResolution(String outcome, long elapsedMs) {
        if (metrics == null) {
            return;
        }
        metrics.recordLatency(outcome, elapsedMs);
        metrics.incrementOutcome(outcome);
    }

    public void recordExpression(ExpressionSource source) {
        if (metrics == null) {
            return;
        }
        metrics.incrementRecorded(source.name().toLowerCase(Locale.ROOT));
    }

    public void recordDuplicate() {
        if (metrics == null) {
            return;
        }
        metrics.incrementDuplicate();
    }

    public boolean isEnabled() {
        return metrics != null;
    }
}
