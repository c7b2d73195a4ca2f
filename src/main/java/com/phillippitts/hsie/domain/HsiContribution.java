package com.phillippitts.hsie.domain;

import java.util.Objects;

/**
 * Weighted contribution of one (segment, dimension) score to the aggregate.
 *
 * @param segment      segment index
 * @param dimension    analyzer dimension
 * @param speakerId    speaker of the segment
 * @param score        analyzer value
 * @param weight       effective dimension weight after renormalisation
 * @param contribution share of HSI; contributions sum to HSI
 * @param escalation   HSIE factor applied to this contribution
 */
public record HsiContribution(
        int segment,
        AnalyzerKind dimension,
        String speakerId,
        double score,
        double weight,
        double contribution,
        double escalation
) {

    public HsiContribution {
        Objects.requireNonNull(dimension, "dimension must not be null");
        Objects.requireNonNull(speakerId, "speakerId must not be null");
    }

    public double extendedContribution() {
        return contribution * escalation;
    }
}
