package com.phillippitts.hsie.domain;

import java.util.Objects;

/**
 * Terminal payload: the aggregate score and the weighting it was computed with.
 */
public record ScoredPayload(HsiScore score, WeightingConfig weighting) implements EvidencePayload {

    public ScoredPayload {
        Objects.requireNonNull(score, "score must not be null");
        Objects.requireNonNull(weighting, "weighting must not be null");
    }

    @Override
    public VersionKind kind() {
        return VersionKind.SCORED;
    }
}
