package com.phillippitts.hsie.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-segment analysis outcomes. Only requested dimensions have an entry.
 */
public record SegmentAnalysis(
        int segment,
        double start,
        double end,
        String speakerId,
        Map<AnalyzerKind, DimensionOutcome> results
) {

    public SegmentAnalysis {
        Objects.requireNonNull(speakerId, "speakerId must not be null");
        Objects.requireNonNull(results, "results must not be null");
        Map<AnalyzerKind, DimensionOutcome> copy = new EnumMap<>(AnalyzerKind.class);
        copy.putAll(results);
        results = Collections.unmodifiableMap(copy);
    }

    /**
     * @return the valid result for a dimension, empty if absent or failed
     */
    public Optional<AnalysisResult> validResult(AnalyzerKind kind) {
        DimensionOutcome outcome = results.get(kind);
        return outcome instanceof AnalysisResult r ? Optional.of(r) : Optional.empty();
    }

    public boolean hasAnyValidResult() {
        return results.values().stream().anyMatch(DimensionOutcome::isSuccess);
    }

    public boolean isSpeakerUnknown() {
        return Segment.UNKNOWN_SPEAKER.equals(speakerId);
    }
}
