package com.phillippitts.hsie.exception;

import com.phillippitts.hsie.domain.AnalyzerKind;

/**
 * Failure of a single analyzer on a single segment.
 *
 * <p>Analyzers may throw it to report a failure with a specific reason; the Analysis Stage also
 * creates one for any other failure. It is recorded in the Analyzed payload as a failure marker and
 * never aborts the analysis run.
 */
public class PartialAnalysisException extends HsieException {

    private final int segmentIndex;
    private final AnalyzerKind analyzer;
    private final String reason;

    public PartialAnalysisException(String message, int segmentIndex, AnalyzerKind analyzer, String reason) {
        this(message, segmentIndex, analyzer, reason, null, null);
    }

    public PartialAnalysisException(String message, int segmentIndex, AnalyzerKind analyzer, String reason,
                                    String evidenceId, Throwable cause) {
        super(message, PipelineStage.ANALYSIS, evidenceId, cause);
        this.segmentIndex = segmentIndex;
        this.analyzer = analyzer;
        this.reason = reason;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.PARTIAL_ANALYSIS;
    }

    public int getSegmentIndex() {
        return segmentIndex;
    }

    public AnalyzerKind getAnalyzer() {
        return analyzer;
    }

    public String getReason() {
        return reason;
    }
}
