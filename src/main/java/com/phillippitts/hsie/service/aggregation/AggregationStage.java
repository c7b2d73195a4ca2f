package com.phillippitts.hsie.service.aggregation;

import com.phillippitts.hsie.domain.AnalyzedPayload;
import com.phillippitts.hsie.domain.Evidence;
import com.phillippitts.hsie.domain.HsiScore;
import com.phillippitts.hsie.domain.ScoredPayload;
import com.phillippitts.hsie.domain.VersionKind;
import com.phillippitts.hsie.domain.WeightingConfig;
import com.phillippitts.hsie.exception.NotFoundException;
import com.phillippitts.hsie.exception.PipelineStage;
import com.phillippitts.hsie.service.store.EvidenceFactory;
import com.phillippitts.hsie.service.store.EvidenceStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Attaches the HSI/HSIE score to an Analyzed Evidence as a final Scored Evidence.
 */
public class AggregationStage {

    private static final Logger LOG = LogManager.getLogger(AggregationStage.class);

    public static final String PRODUCER = "aggregation-stage";

    private final EvidenceStore store;
    private final EvidenceFactory factory;

    public AggregationStage(EvidenceStore store, EvidenceFactory factory) {
        this.store = Objects.requireNonNull(store, "store");
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    /**
     * @return the committed Scored Evidence; its payload holds the {@link HsiScore} and the weighting used
     * @throws com.phillippitts.hsie.exception.InsufficientEvidenceException if nothing can be scored;
     *         no Evidence is written in that case
     */
    public Evidence aggregate(String analyzedEvidenceId, WeightingConfig weighting) {
        Objects.requireNonNull(weighting, "weighting");
        Evidence input = store.get(analyzedEvidenceId);
        if (input.versionKind() != VersionKind.ANALYZED) {
            throw new NotFoundException("Evidence " + analyzedEvidenceId + " is " + input.versionKind().wireName()
                    + ", aggregation requires Analyzed", PipelineStage.AGGREGATION, analyzedEvidenceId);
        }
        HsiScore score = HsiAggregator.aggregate(input.payloadAs(AnalyzedPayload.class), weighting,
                analyzedEvidenceId);
        String id = store.put(factory.create(analyzedEvidenceId, PRODUCER, new ScoredPayload(score, weighting)));
        LOG.info("Scored {} -> {}: HSI={} HSIE={} over {} segments, weights={}", analyzedEvidenceId, id,
                String.format("%.4f", score.hsi()), String.format("%.4f", score.hsie()),
                score.segmentsConsidered(), score.dimensionWeights());
        return store.get(id);
    }
}
