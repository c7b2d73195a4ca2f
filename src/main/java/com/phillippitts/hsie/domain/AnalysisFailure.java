package com.phillippitts.hsie.domain;

import java.util.Objects;

/**
 * Explicit marker for an analyzer that failed on a segment. Recorded instead of a score;
 * never defaulted to zero.
 *
 * @param analyzer        dimension
 * @param analyzerVersion scorer implementation that was invoked
 * @param reason          reason code ({@code timeout}, {@code analyzer_error}, {@code out_of_range},
 *                        {@code cancelled})
 * @param message         diagnostic message
 */
public record AnalysisFailure(AnalyzerKind analyzer, String analyzerVersion, String reason, String message)
        implements DimensionOutcome {

    public static final String ERROR_KIND = "PartialAnalysisError";

    public static final String TIMEOUT = "timeout";
    public static final String ANALYZER_ERROR = "analyzer_error";
    public static final String OUT_OF_RANGE = "out_of_range";
    public static final String CANCELLED = "cancelled";

    public AnalysisFailure {
        Objects.requireNonNull(analyzer, "analyzer must not be null");
        Objects.requireNonNull(analyzerVersion, "analyzerVersion must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
        message = message == null ? "" : message;
    }

    @Override
    public boolean isSuccess() {
        return false;
    }
}
