package com.phillippitts.hsie.service.aggregation;

import com.phillippitts.hsie.domain.AnalysisFailure;
import com.phillippitts.hsie.domain.AnalyzedPayload;
import com.phillippitts.hsie.domain.AnalyzerKind;
import com.phillippitts.hsie.domain.Evidence;
import com.phillippitts.hsie.domain.ScoredPayload;
import com.phillippitts.hsie.domain.SegmentAnalysis;
import com.phillippitts.hsie.domain.VersionKind;
import com.phillippitts.hsie.domain.WeightingConfig;
import com.phillippitts.hsie.exception.InsufficientEvidenceException;
import com.phillippitts.hsie.exception.NotFoundException;
import com.phillippitts.hsie.exception.PipelineStage;
import com.phillippitts.hsie.service.store.EvidenceFactory;
import com.phillippitts.hsie.service.store.InMemoryEvidenceStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.phillippitts.hsie.testutil.EvidenceFixtures.analysis;
import static com.phillippitts.hsie.testutil.EvidenceFixtures.failure;
import static com.phillippitts.hsie.testutil.EvidenceFixtures.fixedClock;
import static com.phillippitts.hsie.testutil.EvidenceFixtures.preprocessed;
import static com.phillippitts.hsie.testutil.EvidenceFixtures.raw;
import static com.phillippitts.hsie.testutil.EvidenceFixtures.result;
import static com.phillippitts.hsie.testutil.EvidenceFixtures.segment;
import static com.phillippitts.hsie.testutil.EvidenceFixtures.word;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class AggregationStageTest {

    private InMemoryEvidenceStore store;
    private EvidenceFactory factory;
    private AggregationStage stage;
    private String preId;

    @BeforeEach
    void setUp() {
        store = new InMemoryEvidenceStore();
        factory = new EvidenceFactory(fixedClock());
        stage = new AggregationStage(store, factory);
        String rawId = store.put(factory.create(null, "entry-stage",
                raw(word(0, "stop", 0.0, 0.4), word(1, "now", 1.0, 1.4))));
        preId = store.put(factory.create(rawId, "preprocessing-stage", preprocessed(
                segment(0, 0.0, 0.4, "A", "stop"), segment(1, 1.0, 1.4, "B", "now"))));
    }

    private String commitAnalyzed(SegmentAnalysis... segments) {
        AnalyzedPayload payload = new AnalyzedPayload(Map.of(AnalyzerKind.SEMANTIC, "v1"), List.of(segments));
        return store.put(factory.create(preId, "analysis-stage", payload));
    }

    @Test
    void commitsScoredEvidenceAsChildOfAnalyzed() {
        String analyzedId = commitAnalyzed(
                analysis(0, "A", result(AnalyzerKind.SEMANTIC, 0.2)),
                analysis(1, "B", result(AnalyzerKind.SEMANTIC, 0.6)));
        WeightingConfig weighting = WeightingConfig.equalWeights();

        Evidence scored = stage.aggregate(analyzedId, weighting);

        assertThat(scored.versionKind()).isEqualTo(VersionKind.SCORED);
        assertThat(scored.parentId()).isEqualTo(analyzedId);
        assertThat(scored.producer()).isEqualTo(AggregationStage.PRODUCER);
        ScoredPayload payload = scored.payloadAs(ScoredPayload.class);
        assertThat(payload.score().hsi()).isCloseTo(0.4, within(1e-9));
        assertThat(payload.weighting()).isEqualTo(weighting);
        assertThat(store.lineage(scored.id())).extracting(Evidence::versionKind)
                .containsExactly(VersionKind.RAW, VersionKind.PREPROCESSED, VersionKind.ANALYZED, VersionKind.SCORED);
    }

    @Test
    void insufficientEvidenceWritesNothing() {
        String analyzedId = commitAnalyzed(
                analysis(0, "A", failure(AnalyzerKind.SEMANTIC, AnalysisFailure.TIMEOUT)),
                analysis(1, "B", failure(AnalyzerKind.SEMANTIC, AnalysisFailure.CANCELLED)));
        int before = store.size();

        assertThatThrownBy(() -> stage.aggregate(analyzedId, WeightingConfig.equalWeights()))
                .isInstanceOfSatisfying(InsufficientEvidenceException.class, e -> {
                    assertThat(e.getStage()).isEqualTo(PipelineStage.AGGREGATION);
                    assertThat(e.getEvidenceId()).isEqualTo(analyzedId);
                });
        assertThat(store.size()).isEqualTo(before);
        assertThat(store.children(analyzedId)).isEmpty();
    }

    @Test
    void rejectsEvidenceThatIsNotAnalyzed() {
        assertThatThrownBy(() -> stage.aggregate(preId, WeightingConfig.equalWeights()))
                .isInstanceOfSatisfying(NotFoundException.class,
                        e -> assertThat(e.getStage()).isEqualTo(PipelineStage.AGGREGATION));
    }

    @Test
    void unknownIdIsNotFound() {
        assertThatThrownBy(() -> stage.aggregate("00".repeat(32), WeightingConfig.equalWeights()))
                .isInstanceOf(NotFoundException.class);
    }
}
