package com.phillippitts.hsie.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Payload of Analyzed Evidence.
 *
 * @param analyzerSet requested dimensions and the analyzer version used for each
 * @param segments    per-segment outcomes in segment order
 */
public record AnalyzedPayload(Map<AnalyzerKind, String> analyzerSet, List<SegmentAnalysis> segments)
        implements EvidencePayload {

    public AnalyzedPayload {
        Objects.requireNonNull(analyzerSet, "analyzerSet must not be null");
        Map<AnalyzerKind, String> copy = new EnumMap<>(AnalyzerKind.class);
        copy.putAll(analyzerSet);
        analyzerSet = Collections.unmodifiableMap(copy);
        segments = List.copyOf(Objects.requireNonNull(segments, "segments must not be null"));
    }

    @Override
    public VersionKind kind() {
        return VersionKind.ANALYZED;
    }

    public long failureCount() {
        return segments.stream()
                .flatMap(s -> s.results().values().stream())
                .filter(o -> !o.isSuccess())
                .count();
    }
}
