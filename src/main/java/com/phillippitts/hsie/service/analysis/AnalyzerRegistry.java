package com.phillippitts.hsie.service.analysis;

import com.phillippitts.hsie.domain.AnalyzerKind;
import com.phillippitts.hsie.exception.NotFoundException;
import com.phillippitts.hsie.exception.PipelineStage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Registered analyzers, looked up by {@code (dimension, version)}.
 */
public class AnalyzerRegistry {

    private final Map<AnalyzerKind, List<Analyzer>> byKind = new EnumMap<>(AnalyzerKind.class);

    public AnalyzerRegistry(List<? extends Analyzer> analyzers) {
        for (Analyzer a : analyzers) {
            List<Analyzer> list = byKind.computeIfAbsent(a.kind(), k -> new ArrayList<>());
            for (Analyzer existing : list) {
                if (existing.version().equals(a.version())) {
                    throw new IllegalArgumentException("Duplicate analyzer " + reference(a.kind(), a.version()));
                }
            }
            list.add(a);
        }
    }

    /**
     * Resolves every entry of the set before any work starts.
     *
     * @throws NotFoundException naming the first {@code dimension@version} with no analyzer
     */
    public Map<AnalyzerKind, Analyzer> resolve(AnalyzerSet set) {
        Map<AnalyzerKind, Analyzer> resolved = new EnumMap<>(AnalyzerKind.class);
        set.versions().forEach((kind, version) -> resolved.put(kind, find(kind, version)));
        return resolved;
    }

    public List<Analyzer> analyzersOf(AnalyzerKind kind) {
        return Collections.unmodifiableList(byKind.getOrDefault(kind, List.of()));
    }

    private Analyzer find(AnalyzerKind kind, String version) {
        List<Analyzer> candidates = byKind.getOrDefault(kind, List.of());
        if (version == null) {
            if (candidates.size() == 1) {
                return candidates.get(0);
            }
            throw new NotFoundException(candidates.isEmpty()
                    ? "No analyzer registered for " + kind
                    : "Several analyzers registered for " + kind + "; a version must be chosen",
                    PipelineStage.ANALYSIS, reference(kind, null));
        }
        for (Analyzer a : candidates) {
            if (a.version().equals(version)) {
                return a;
            }
        }
        throw new NotFoundException("No analyzer registered for " + reference(kind, version),
                PipelineStage.ANALYSIS, reference(kind, version));
    }

    static String reference(AnalyzerKind kind, String version) {
        return kind.name().toLowerCase() + "@" + (version == null ? "*" : version);
    }
}
