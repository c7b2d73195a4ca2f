package com.phillippitts.hsie.service.analysis;

import com.phillippitts.hsie.domain.AnalyzerKind;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Which dimensions an analysis run scores and with which analyzer version.
 *
 * <p>A {@code null} version means "the only registered analyzer of that dimension".
 * Dimensions not in the set produce no entries at all in the Analyzed payload.
 */
public record AnalyzerSet(Map<AnalyzerKind, String> versions) {

    public AnalyzerSet {
        Objects.requireNonNull(versions, "versions must not be null");
        if (versions.isEmpty()) {
            throw new IllegalArgumentException("Analyzer set must name at least one dimension");
        }
        versions = Collections.unmodifiableMap(new EnumMap<>(versions));
    }

    /**
     * @param kinds    requested dimensions
     * @param versions preferred version per dimension; dimensions without one resolve to the sole
     *                 registered analyzer
     */
    public static AnalyzerSet of(Collection<AnalyzerKind> kinds, Map<AnalyzerKind, String> versions) {
        Map<AnalyzerKind, String> map = new LinkedHashMap<>();
        for (AnalyzerKind kind : kinds) {
            map.put(kind, versions == null ? null : versions.get(kind));
        }
        return new AnalyzerSet(map.isEmpty() ? Map.of() : new EnumMap<>(map));
    }

    public boolean contains(AnalyzerKind kind) {
        return versions.containsKey(kind);
    }
}
