package com.phillippitts.hsie.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Declared weighting used by the HSI/HSIE aggregation.
 *
 * @param weights        raw weight per dimension (finite, non-negative); renormalised over the dimensions
 *                       actually present in the input
 * @param escalationStep HSIE increment per repeated occurrence of the same speaker pair
 * @param escalationCap  upper bound of the HSIE escalation factor (at least 1.0)
 */
public record WeightingConfig(Map<AnalyzerKind, Double> weights, double escalationStep, double escalationCap) {

    public static final double DEFAULT_ESCALATION_STEP = 0.25;
    public static final double DEFAULT_ESCALATION_CAP = 2.0;

    public WeightingConfig {
        Objects.requireNonNull(weights, "weights must not be null");
        Map<AnalyzerKind, Double> copy = new EnumMap<>(AnalyzerKind.class);
        weights.forEach((k, v) -> {
            if (v == null || !Double.isFinite(v) || v < 0.0) {
                throw new IllegalArgumentException("Weight for " + k + " must be finite and non-negative, got: " + v);
            }
            copy.put(k, v);
        });
        weights = Collections.unmodifiableMap(copy);
        if (!Double.isFinite(escalationStep) || escalationStep < 0.0) {
            throw new IllegalArgumentException("escalationStep must be finite and non-negative, got: " + escalationStep);
        }
        if (!Double.isFinite(escalationCap) || escalationCap < 1.0) {
            throw new IllegalArgumentException("escalationCap must be finite and at least 1.0, got: " + escalationCap);
        }
    }

    /**
     * Equal weights over all dimensions with default escalation.
     */
    public static WeightingConfig equalWeights() {
        Map<AnalyzerKind, Double> w = new EnumMap<>(AnalyzerKind.class);
        for (AnalyzerKind k : AnalyzerKind.values()) {
            w.put(k, 1.0);
        }
        return new WeightingConfig(w, DEFAULT_ESCALATION_STEP, DEFAULT_ESCALATION_CAP);
    }

    public double weightOf(AnalyzerKind kind) {
        return weights.getOrDefault(kind, 0.0);
    }
}
