package com.phillippitts.hsie.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for pipeline stages.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Stage latency (entry, preprocessing, analysis, aggregation)</li>
 *   <li>Success/failure counts per stage, failures tagged with the error kind</li>
 *   <li>Analysis failure markers per dimension and reason</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class PipelineMetrics {

    static final String METRIC_PREFIX = "hsie.stage";

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param stage         stage label
     * @param durationNanos duration in nanoseconds
     */
    public void recordLatency(String stage, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken by a pipeline stage")
                .tag("stage", stage)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementSuccess(String stage) {
        Counter.builder(METRIC_PREFIX + ".success")
                .description("Number of Evidence objects committed by a stage")
                .tag("stage", stage)
                .register(registry)
                .increment();
    }

    /**
     * @param stage     stage label
     * @param errorKind error taxonomy name (e.g. NotFoundError)
     */
    public void incrementFailure(String stage, String errorKind) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Number of failed stage runs")
                .tag("stage", stage)
                .tag("error", errorKind)
                .register(registry)
                .increment();
    }

    /**
     * Counts analyzer failure markers recorded in Analyzed Evidence.
     */
    public void incrementAnalysisFailure(String dimension, String reason, long count) {
        Counter.builder(METRIC_PREFIX + ".analysis.failure")
                .description("Number of analyzer calls recorded as failure markers")
                .tag("dimension", dimension)
                .tag("reason", reason)
                .register(registry)
                .increment(count);
    }
}
