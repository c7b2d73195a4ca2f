package com.phillippitts.hsie.service.aggregation;

import com.phillippitts.hsie.domain.AnalysisResult;
import com.phillippitts.hsie.domain.AnalyzedPayload;
import com.phillippitts.hsie.domain.AnalyzerKind;
import com.phillippitts.hsie.domain.HsiContribution;
import com.phillippitts.hsie.domain.HsiScore;
import com.phillippitts.hsie.domain.SegmentAnalysis;
import com.phillippitts.hsie.domain.WeightingConfig;
import com.phillippitts.hsie.exception.InsufficientEvidenceException;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Declared weighting function reducing per-segment scores to HSI and HSIE.
 *
 * <p>For every dimension {@code d} with at least one valid result:
 * <pre>
 * mean_d = mean of valid values of d
 * w'_d   = w_d / sum of w over present dimensions
 * HSI    = sum_d w'_d * mean_d
 * </pre>
 * Missing or failed results are excluded from their dimension instead of counting as zero, and a
 * dimension with no valid result drops out of the weighting entirely. Each (segment, dimension)
 * value contributes {@code w'_d * v / n_d}, so the contributions sum to HSI.
 *
 * <p>HSIE multiplies a segment's contributions by {@code min(cap, 1 + step * (k - 1))}, where
 * {@code k} counts how often the directed speaker pair (previous segment's speaker, this
 * segment's speaker) has occurred so far. Only two different known speakers form a pair;
 * segments next to an {@code unknown} speaker get factor 1.
 *
 * <p>Pure function; thread-safe.
 */
public final class HsiAggregator {

    private HsiAggregator() {}

    /**
     * @param analyzed   analysis outcomes
     * @param weighting  declared weights and escalation parameters
     * @param evidenceId Analyzed Evidence id, for error reports
     * @throws InsufficientEvidenceException if no segment carries a valid result, or every present
     *                                       dimension has weight zero
     */
    public static HsiScore aggregate(AnalyzedPayload analyzed, WeightingConfig weighting, String evidenceId) {
        Map<AnalyzerKind, Integer> counts = new EnumMap<>(AnalyzerKind.class);
        for (SegmentAnalysis s : analyzed.segments()) {
            for (AnalyzerKind kind : AnalyzerKind.values()) {
                if (s.validResult(kind).isPresent()) {
                    counts.merge(kind, 1, Integer::sum);
                }
            }
        }
        if (counts.isEmpty()) {
            throw new InsufficientEvidenceException(
                    "No segment carries a valid analyzer result; refusing to score", evidenceId);
        }

        double weightSum = 0.0;
        for (AnalyzerKind kind : counts.keySet()) {
            weightSum += weighting.weightOf(kind);
        }
        if (weightSum <= 0.0) {
            throw new InsufficientEvidenceException("Every dimension with valid results " + counts.keySet()
                    + " has weight zero", evidenceId);
        }
        Map<AnalyzerKind, Double> effective = new EnumMap<>(AnalyzerKind.class);
        for (AnalyzerKind kind : counts.keySet()) {
            effective.put(kind, weighting.weightOf(kind) / weightSum);
        }

        double[] escalation = escalationFactors(analyzed.segments(), weighting);
        List<HsiContribution> components = new ArrayList<>();
        double hsi = 0.0;
        double hsie = 0.0;
        int considered = 0;
        for (int i = 0; i < analyzed.segments().size(); i++) {
            SegmentAnalysis s = analyzed.segments().get(i);
            boolean any = false;
            for (Map.Entry<AnalyzerKind, Double> e : effective.entrySet()) {
                Optional<AnalysisResult> result = s.validResult(e.getKey());
                if (result.isEmpty()) {
                    continue;
                }
                any = true;
                double value = result.get().value();
                double contribution = e.getValue() * value / counts.get(e.getKey());
                HsiContribution c = new HsiContribution(s.segment(), e.getKey(), s.speakerId(), value,
                        e.getValue(), contribution, escalation[i]);
                components.add(c);
                hsi += contribution;
                hsie += c.extendedContribution();
            }
            if (any) {
                considered++;
            }
        }
        return new HsiScore(clampUnit(hsi), hsie, effective, considered, components);
    }

    static double[] escalationFactors(List<SegmentAnalysis> segments, WeightingConfig weighting) {
        double[] factors = new double[segments.size()];
        Map<String, Integer> pairCounts = new HashMap<>();
        for (int i = 0; i < segments.size(); i++) {
            factors[i] = 1.0;
            if (i == 0) {
                continue;
            }
            SegmentAnalysis prev = segments.get(i - 1);
            SegmentAnalysis cur = segments.get(i);
            if (prev.isSpeakerUnknown() || cur.isSpeakerUnknown() || prev.speakerId().equals(cur.speakerId())) {
                continue;
            }
            int k = pairCounts.merge(prev.speakerId() + "\u0000" + cur.speakerId(), 1, Integer::sum);
            factors[i] = Math.min(weighting.escalationCap(), 1.0 + weighting.escalationStep() * (k - 1));
        }
        return factors;
    }

    // contributions of values in [0, 1] can exceed 1 only by rounding
    private static double clampUnit(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
