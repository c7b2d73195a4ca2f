package com.phillippitts.hsie.service.metrics;

import com.phillippitts.hsie.domain.AnalysisFailure;
import com.phillippitts.hsie.domain.AnalyzedPayload;
import com.phillippitts.hsie.domain.DimensionOutcome;
import com.phillippitts.hsie.domain.SegmentAnalysis;
import com.phillippitts.hsie.exception.PipelineStage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.TreeMap;

/**
 * Records stage outcomes into {@link PipelineMetrics}, tolerating a missing metrics backend.
 *
 * <p><b>Null Safety:</b> all methods are no-ops when constructed without metrics, so stages and
 * the pipeline run unchanged in tests.
 *
 * @see PipelineMetrics
 */
@Component
public final class PipelineMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(PipelineMetricsPublisher.class);

    /**
     * No-op instance for tests and manual wiring.
     */
    public static final PipelineMetricsPublisher NOOP = new PipelineMetricsPublisher(null);

    private final PipelineMetrics metrics;

    /**
     * @param metrics metrics service (nullable for test mode)
     */
    public PipelineMetricsPublisher(PipelineMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("PipelineMetricsPublisher created without metrics (test mode)");
        }
    }

    public void recordSuccess(PipelineStage stage, long durationNanos) {
        if (metrics == null) {
            return;
        }
        metrics.recordLatency(stage.label(), durationNanos);
        metrics.incrementSuccess(stage.label());
    }

    public void recordFailure(PipelineStage stage, long durationNanos, String errorKind) {
        if (metrics == null) {
            return;
        }
        metrics.recordLatency(stage.label(), durationNanos);
        metrics.incrementFailure(stage.label(), errorKind);
    }

    /**
     * Counts the failure markers of an Analyzed payload per (dimension, reason).
     */
    public void recordAnalysisFailures(AnalyzedPayload payload) {
        if (metrics == null) {
            return;
        }
        Map<String, Long> counts = new TreeMap<>();
        for (SegmentAnalysis s : payload.segments()) {
            for (DimensionOutcome o : s.results().values()) {
                if (o instanceof AnalysisFailure f) {
                    counts.merge(f.analyzer().name().toLowerCase() + '|' + f.reason(), 1L, Long::sum);
                }
            }
        }
        counts.forEach((key, count) -> {
            int sep = key.indexOf('|');
            metrics.incrementAnalysisFailure(key.substring(0, sep), key.substring(sep + 1), count);
        });
    }

    public boolean isEnabled() {
        return metrics != null;
    }
}
