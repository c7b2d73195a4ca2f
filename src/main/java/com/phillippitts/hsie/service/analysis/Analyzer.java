package com.phillippitts.hsie.service.analysis;

import com.phillippitts.hsie.domain.AnalyzerKind;

/**
 * Capability contract of a scoring collaborator: {@code score(segment) -> (value, confidence)}.
 *
 * <p>Implementations must be stateless or thread-safe; one instance scores many segments
 * concurrently. Failures are reported by throwing; a
 * {@link com.phillippitts.hsie.exception.PartialAnalysisException} carries a specific reason code,
 * any other exception is recorded as {@code analyzer_error}.
 */
public interface Analyzer {

    AnalyzerKind kind();

    /**
     * @return model/implementation version recorded as provenance with every score
     */
    String version();

    AnalyzerScore score(ScoringTarget target);
}
