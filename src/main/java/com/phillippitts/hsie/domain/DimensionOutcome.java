package com.phillippitts.hsie.domain;

/**
 * Outcome of one analyzer on one segment: either an {@link AnalysisResult} or an explicit
 * {@link AnalysisFailure} marker.
 */
public interface DimensionOutcome {

    AnalyzerKind analyzer();

    String analyzerVersion();

    boolean isSuccess();
}
