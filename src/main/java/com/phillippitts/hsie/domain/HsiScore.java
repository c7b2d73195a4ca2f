package com.phillippitts.hsie.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Harassment Strength Index and its extended form, with the components that explain them.
 *
 * @param hsi                weighted index in [0, 1]
 * @param hsie               HSI with speaker-pair escalation applied
 * @param dimensionWeights   effective weights of the dimensions that contributed; sum to 1
 * @param segmentsConsidered segments carrying at least one valid result
 * @param components         per (segment, dimension) contributions
 */
public record HsiScore(
        double hsi,
        double hsie,
        Map<AnalyzerKind, Double> dimensionWeights,
        int segmentsConsidered,
        List<HsiContribution> components
) {

    public HsiScore {
        Objects.requireNonNull(dimensionWeights, "dimensionWeights must not be null");
        Map<AnalyzerKind, Double> copy = new EnumMap<>(AnalyzerKind.class);
        copy.putAll(dimensionWeights);
        dimensionWeights = Collections.unmodifiableMap(copy);
        components = List.copyOf(Objects.requireNonNull(components, "components must not be null"));
    }
}
