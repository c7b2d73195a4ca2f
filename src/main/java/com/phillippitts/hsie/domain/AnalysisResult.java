package com.phillippitts.hsie.domain;

import java.util.Objects;

/**
 * Bounded score produced by one analyzer for one segment.
 *
 * @param analyzer        dimension
 * @param value           score in [0, 1]
 * @param confidence      analyzer confidence in [0, 1]
 * @param analyzerVersion scorer implementation that produced the value
 */
public record AnalysisResult(AnalyzerKind analyzer, double value, double confidence, String analyzerVersion)
        implements DimensionOutcome {

    public AnalysisResult {
        Objects.requireNonNull(analyzer, "analyzer must not be null");
        Objects.requireNonNull(analyzerVersion, "analyzerVersion must not be null");
        requireUnit("value", value);
        requireUnit("confidence", confidence);
    }

    @Override
    public boolean isSuccess() {
        return true;
    }

    private static void requireUnit(String name, double v) {
        if (Double.isNaN(v) || v < 0.0 || v > 1.0) {
            throw new IllegalArgumentException(name + " must be between 0.0 and 1.0, got: " + v);
        }
    }
}
