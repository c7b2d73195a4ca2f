package com.phillippitts.hsie.service.analysis;

import com.phillippitts.hsie.domain.AnalysisFailure;
import com.phillippitts.hsie.domain.AnalysisResult;
import com.phillippitts.hsie.domain.AnalyzedPayload;
import com.phillippitts.hsie.domain.AnalyzerKind;
import com.phillippitts.hsie.domain.DimensionOutcome;
import com.phillippitts.hsie.domain.Evidence;
import com.phillippitts.hsie.domain.SegmentAnalysis;
import com.phillippitts.hsie.domain.VersionKind;
import com.phillippitts.hsie.exception.NotFoundException;
import com.phillippitts.hsie.exception.PartialAnalysisException;
import com.phillippitts.hsie.exception.PipelineStage;
import com.phillippitts.hsie.service.store.EvidenceFactory;
import com.phillippitts.hsie.service.store.InMemoryEvidenceStore;
import com.phillippitts.hsie.testutil.ScriptedAnalyzer;
import com.phillippitts.hsie.testutil.SyncExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Executor;

import static com.phillippitts.hsie.testutil.EvidenceFixtures.AUDIO_SHA;
import static com.phillippitts.hsie.testutil.EvidenceFixtures.fixedClock;
import static com.phillippitts.hsie.testutil.EvidenceFixtures.preprocessed;
import static com.phillippitts.hsie.testutil.EvidenceFixtures.raw;
import static com.phillippitts.hsie.testutil.EvidenceFixtures.segment;
import static com.phillippitts.hsie.testutil.EvidenceFixtures.word;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnalysisStageTest {

    private InMemoryEvidenceStore store;
    private EvidenceFactory factory;
    private ExecutorService pool;
    private String preId;

    @BeforeEach
    void setUp() {
        store = new InMemoryEvidenceStore();
        factory = new EvidenceFactory(fixedClock());
        String rawId = store.put(factory.create(null, "entry-stage", raw(
                word(0, "one", 0.0, 0.5), word(1, "two", 1.0, 1.5), word(2, "three", 2.0, 2.5))));
        preId = store.put(factory.create(rawId, "preprocessing-stage", preprocessed(
                segment(0, 0.0, 0.5, "A", "one"),
                segment(1, 1.0, 1.5, "B", "two"),
                segment(2, 2.0, 2.5, "A", "three"))));
    }

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.shutdownNow();
        }
    }

    private AnalysisStage stage(Executor executor, Duration timeout, ScriptedAnalyzer... analyzers) {
        return new AnalysisStage(store, factory, new AnalyzerRegistry(List.of(analyzers)), executor, timeout);
    }

    private static AnalyzerSet setOf(AnalyzerKind... kinds) {
        return AnalyzerSet.of(List.of(kinds), null);
    }

    @Test
    void scoresEverySegmentForEveryRequestedDimension() {
        // Arrange
        ScriptedAnalyzer acoustic = ScriptedAnalyzer.constant(AnalyzerKind.ACOUSTIC, 0.2);
        ScriptedAnalyzer semantic = ScriptedAnalyzer.constant(AnalyzerKind.SEMANTIC, 0.6);
        SyncExecutor executor = new SyncExecutor();
        AnalysisStage stage = stage(executor, Duration.ofSeconds(5), acoustic, semantic);

        // Act
        Evidence analyzed = stage.analyze(preId, setOf(AnalyzerKind.ACOUSTIC, AnalyzerKind.SEMANTIC));

        // Assert
        assertThat(analyzed.versionKind()).isEqualTo(VersionKind.ANALYZED);
        assertThat(analyzed.parentId()).isEqualTo(preId);
        AnalyzedPayload payload = analyzed.payloadAs(AnalyzedPayload.class);
        assertThat(payload.analyzerSet()).containsOnlyKeys(AnalyzerKind.ACOUSTIC, AnalyzerKind.SEMANTIC)
                .containsEntry(AnalyzerKind.ACOUSTIC, "v1");
        assertThat(payload.segments()).extracting(SegmentAnalysis::speakerId).containsExactly("A", "B", "A");
        assertThat(payload.segments()).allSatisfy(s ->
                assertThat(s.results()).containsOnlyKeys(AnalyzerKind.ACOUSTIC, AnalyzerKind.SEMANTIC));
        assertThat(payload.failureCount()).isZero();
        assertThat(acoustic.calls()).isEqualTo(3);
        assertThat(executor.executed()).isEqualTo(6);
    }

    @Test
    void failedCallBecomesMarkerWithoutAffectingOthers() {
        ScriptedAnalyzer acoustic = ScriptedAnalyzer.constant(AnalyzerKind.ACOUSTIC, 0.2);
        ScriptedAnalyzer semantic = new ScriptedAnalyzer(AnalyzerKind.SEMANTIC, "v1", t -> {
            if (t.segment().index() == 1) {
                throw new IllegalStateException("model crashed");
            }
            return new AnalyzerScore(0.5, 0.9);
        });

        AnalyzedPayload payload = stage(new SyncExecutor(), Duration.ofSeconds(5), acoustic, semantic)
                .analyze(preId, setOf(AnalyzerKind.ACOUSTIC, AnalyzerKind.SEMANTIC))
                .payloadAs(AnalyzedPayload.class);

        DimensionOutcome failed = payload.segments().get(1).results().get(AnalyzerKind.SEMANTIC);
        assertThat(failed).isInstanceOfSatisfying(AnalysisFailure.class, f -> {
            assertThat(f.reason()).isEqualTo(AnalysisFailure.ANALYZER_ERROR);
            assertThat(f.message()).contains("model crashed");
            assertThat(f.analyzerVersion()).isEqualTo("v1");
        });
        assertThat(payload.segments().get(1).validResult(AnalyzerKind.ACOUSTIC)).isPresent();
        assertThat(payload.segments().get(0).validResult(AnalyzerKind.SEMANTIC)).isPresent();
        assertThat(payload.failureCount()).isEqualTo(1);
    }

    @Test
    void slowCallTimesOutWhileOthersComplete() {
        pool = Executors.newFixedThreadPool(4);
        ScriptedAnalyzer acoustic = new ScriptedAnalyzer(AnalyzerKind.ACOUSTIC, "v1", t -> {
            if (t.segment().index() == 2) {
                ScriptedAnalyzer.sleep(3000);
            }
            return new AnalyzerScore(0.3, 1.0);
        });

        long start = System.nanoTime();
        AnalyzedPayload payload = stage(pool, Duration.ofMillis(200), acoustic)
                .analyze(preId, setOf(AnalyzerKind.ACOUSTIC))
                .payloadAs(AnalyzedPayload.class);
        long elapsedMs = (System.nanoTime() - start) / 1_000_000L;

        assertThat(payload.segments().get(2).results().get(AnalyzerKind.ACOUSTIC))
                .isInstanceOfSatisfying(AnalysisFailure.class,
                        f -> assertThat(f.reason()).isEqualTo(AnalysisFailure.TIMEOUT));
        assertThat(payload.segments().get(0).validResult(AnalyzerKind.ACOUSTIC)).isPresent();
        assertThat(payload.segments().get(1).validResult(AnalyzerKind.ACOUSTIC)).isPresent();
        assertThat(elapsedMs).isLessThan(2500);
    }

    @Test
    void outOfRangeScoresAreRecordedAsFailures() {
        ScriptedAnalyzer linguistic = new ScriptedAnalyzer(AnalyzerKind.LINGUISTIC, "l1", t -> switch (t.segment().index()) {
            case 0 -> new AnalyzerScore(1.5, 0.9);
            case 1 -> new AnalyzerScore(Double.NaN, 0.9);
            default -> new AnalyzerScore(1.0, 0.0);
        });

        AnalyzedPayload payload = stage(new SyncExecutor(), Duration.ofSeconds(5), linguistic)
                .analyze(preId, setOf(AnalyzerKind.LINGUISTIC))
                .payloadAs(AnalyzedPayload.class);

        assertThat(payload.segments().get(0).results().get(AnalyzerKind.LINGUISTIC))
                .isInstanceOfSatisfying(AnalysisFailure.class,
                        f -> assertThat(f.reason()).isEqualTo(AnalysisFailure.OUT_OF_RANGE));
        assertThat(payload.segments().get(1).results().get(AnalyzerKind.LINGUISTIC))
                .isInstanceOfSatisfying(AnalysisFailure.class,
                        f -> assertThat(f.reason()).isEqualTo(AnalysisFailure.OUT_OF_RANGE));
        assertThat(payload.segments().get(2).results().get(AnalyzerKind.LINGUISTIC))
                .isInstanceOf(AnalysisResult.class);
    }

    @Test
    void analyzerReasonCodeIsKept() {
        ScriptedAnalyzer acoustic = new ScriptedAnalyzer(AnalyzerKind.ACOUSTIC, "v1", t -> {
            throw new PartialAnalysisException("scorer process timed out", t.segment().index(),
                    AnalyzerKind.ACOUSTIC, AnalysisFailure.TIMEOUT);
        });

        AnalyzedPayload payload = stage(new SyncExecutor(), Duration.ofSeconds(5), acoustic)
                .analyze(preId, setOf(AnalyzerKind.ACOUSTIC))
                .payloadAs(AnalyzedPayload.class);

        assertThat(payload.failureCount()).isEqualTo(3);
        assertThat(payload.segments().get(0).results().get(AnalyzerKind.ACOUSTIC))
                .isInstanceOfSatisfying(AnalysisFailure.class,
                        f -> assertThat(f.reason()).isEqualTo(AnalysisFailure.TIMEOUT));
        assertThat(payload.segments()).noneMatch(SegmentAnalysis::hasAnyValidResult);
    }

    @Test
    void missingReasonCodeFallsBackToAnalyzerError() {
        ScriptedAnalyzer acoustic = new ScriptedAnalyzer(AnalyzerKind.ACOUSTIC, "v1", t -> {
            if (t.segment().index() == 1) {
                throw new PartialAnalysisException("model refused", 1, AnalyzerKind.ACOUSTIC, null);
            }
            return new AnalyzerScore(0.4, 1.0);
        });

        AnalyzedPayload payload = stage(new SyncExecutor(), Duration.ofSeconds(5), acoustic)
                .analyze(preId, setOf(AnalyzerKind.ACOUSTIC))
                .payloadAs(AnalyzedPayload.class);

        assertThat(payload.segments().get(1).results().get(AnalyzerKind.ACOUSTIC))
                .isInstanceOfSatisfying(AnalysisFailure.class, f -> {
                    assertThat(f.reason()).isEqualTo(AnalysisFailure.ANALYZER_ERROR);
                    assertThat(f.message()).isEqualTo("model refused");
                });
        assertThat(payload.segments().get(0).validResult(AnalyzerKind.ACOUSTIC)).isPresent();
        assertThat(payload.segments().get(2).validResult(AnalyzerKind.ACOUSTIC)).isPresent();
    }

    @Test
    void timedOutCallFreesItsWorkerForQueuedCalls() {
        pool = Executors.newFixedThreadPool(1);
        ScriptedAnalyzer acoustic = new ScriptedAnalyzer(AnalyzerKind.ACOUSTIC, "v1", t -> {
            if (t.segment().index() == 0) {
                ScriptedAnalyzer.sleep(6000);
            }
            return new AnalyzerScore(0.3, 1.0);
        });

        long start = System.nanoTime();
        AnalyzedPayload payload = stage(pool, Duration.ofMillis(200), acoustic)
                .analyze(preId, setOf(AnalyzerKind.ACOUSTIC))
                .payloadAs(AnalyzedPayload.class);
        long elapsedMs = (System.nanoTime() - start) / 1_000_000L;

        assertThat(payload.segments().get(0).results().get(AnalyzerKind.ACOUSTIC))
                .isInstanceOfSatisfying(AnalysisFailure.class,
                        f -> assertThat(f.reason()).isEqualTo(AnalysisFailure.TIMEOUT));
        assertThat(payload.segments().get(1).validResult(AnalyzerKind.ACOUSTIC)).isPresent();
        assertThat(payload.segments().get(2).validResult(AnalyzerKind.ACOUSTIC)).isPresent();
        assertThat(elapsedMs).isLessThan(2000);
        assertThat(acoustic.calls()).isEqualTo(3);
    }

    @Test
    void unregisteredAnalyzerFailsBeforeAnyScoring() {
        ScriptedAnalyzer acoustic = ScriptedAnalyzer.constant(AnalyzerKind.ACOUSTIC, 0.2);
        AnalysisStage stage = stage(new SyncExecutor(), Duration.ofSeconds(5), acoustic);
        int before = store.size();

        assertThatThrownBy(() -> stage.analyze(preId,
                new AnalyzerSet(Map.of(AnalyzerKind.ACOUSTIC, "v1", AnalyzerKind.SEMANTIC, "v7"))))
                .isInstanceOfSatisfying(NotFoundException.class,
                        e -> assertThat(e.getReference()).isEqualTo("semantic@v7"));
        assertThat(acoustic.calls()).isZero();
        assertThat(store.size()).isEqualTo(before);
    }

    @Test
    void nonPreprocessedInputIsRejected() {
        ScriptedAnalyzer acoustic = ScriptedAnalyzer.constant(AnalyzerKind.ACOUSTIC, 0.2);
        String rawId = store.get(preId).parentId();

        assertThatThrownBy(() -> stage(new SyncExecutor(), Duration.ofSeconds(5), acoustic)
                .analyze(rawId, setOf(AnalyzerKind.ACOUSTIC)))
                .isInstanceOfSatisfying(NotFoundException.class,
                        e -> assertThat(e.getStage()).isEqualTo(PipelineStage.ANALYSIS));
    }

    @Test
    void analyzersSeeSourceAudioAndLanguage() {
        ScriptedAnalyzer acoustic = ScriptedAnalyzer.constant(AnalyzerKind.ACOUSTIC, 0.2);

        stage(new SyncExecutor(), Duration.ofSeconds(5), acoustic).analyze(preId, setOf(AnalyzerKind.ACOUSTIC));

        assertThat(acoustic.targets()).allSatisfy(t -> {
            assertThat(t.source().sha256()).isEqualTo(AUDIO_SHA);
            assertThat(t.language()).isEqualTo("en");
        });
        assertThat(acoustic.targets()).extracting(t -> t.segment().index()).containsExactly(0, 1, 2);
    }

    @Test
    void interruptionCancelsOutstandingCalls() {
        pool = Executors.newFixedThreadPool(4);
        ScriptedAnalyzer acoustic = new ScriptedAnalyzer(AnalyzerKind.ACOUSTIC, "v1", t -> {
            ScriptedAnalyzer.sleep(5000);
            return new AnalyzerScore(0.1, 1.0);
        });
        AnalysisStage stage = stage(pool, Duration.ofSeconds(30), acoustic);

        Thread.currentThread().interrupt();
        AnalyzedPayload payload;
        try {
            payload = stage.analyze(preId, setOf(AnalyzerKind.ACOUSTIC)).payloadAs(AnalyzedPayload.class);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }

        assertThat(payload.segments()).allSatisfy(s ->
                assertThat(s.results().get(AnalyzerKind.ACOUSTIC)).isInstanceOfSatisfying(AnalysisFailure.class,
                        f -> assertThat(f.reason()).isEqualTo(AnalysisFailure.CANCELLED)));
    }

    @Test
    void repeatedAnalysisWithSameAnalyzersYieldsSameEvidence() {
        ScriptedAnalyzer acoustic = ScriptedAnalyzer.constant(AnalyzerKind.ACOUSTIC, 0.4);
        AnalysisStage stage = stage(new SyncExecutor(), Duration.ofSeconds(5), acoustic);

        String first = stage.analyze(preId, setOf(AnalyzerKind.ACOUSTIC)).id();
        String second = stage.analyze(preId, setOf(AnalyzerKind.ACOUSTIC)).id();

        assertThat(first).isEqualTo(second);
    }
}
