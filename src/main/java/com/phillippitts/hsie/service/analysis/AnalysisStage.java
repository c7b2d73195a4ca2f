package com.phillippitts.hsie.service.analysis;

import com.phillippitts.hsie.domain.AnalysisFailure;
import com.phillippitts.hsie.domain.AnalysisResult;
import com.phillippitts.hsie.domain.AnalyzedPayload;
import com.phillippitts.hsie.domain.AnalyzerKind;
import com.phillippitts.hsie.domain.AudioSource;
import com.phillippitts.hsie.domain.DimensionOutcome;
import com.phillippitts.hsie.domain.Evidence;
import com.phillippitts.hsie.domain.PreprocessedPayload;
import com.phillippitts.hsie.domain.RawPayload;
import com.phillippitts.hsie.domain.Segment;
import com.phillippitts.hsie.domain.SegmentAnalysis;
import com.phillippitts.hsie.domain.VersionKind;
import com.phillippitts.hsie.exception.NotFoundException;
import com.phillippitts.hsie.exception.PartialAnalysisException;
import com.phillippitts.hsie.exception.PipelineStage;
import com.phillippitts.hsie.service.store.EvidenceFactory;
import com.phillippitts.hsie.service.store.EvidenceStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Scores every segment of a Preprocessed Evidence with every analyzer of an {@link AnalyzerSet}
 * and commits the outcomes as Analyzed Evidence.
 *
 * <p>Each (segment, analyzer) call runs as its own task on the analysis executor, so segments and
 * dimensions are scored concurrently up to the pool limit. A call's timeout starts when the call
 * starts running, not when it is queued; on expiry the worker is interrupted and freed for the
 * next queued call. Failures are isolated: a failed, timed-out or
 * out-of-range call becomes an {@link AnalysisFailure} marker for that pair and every other pair
 * is still scored. The Analyzed payload has an entry for every requested dimension on every
 * segment and none for dimensions that were not requested.
 */
public class AnalysisStage {

    private static final Logger LOG = LogManager.getLogger(AnalysisStage.class);

    public static final String PRODUCER = "analysis-stage";

    private final EvidenceStore store;
    private final EvidenceFactory factory;
    private final AnalyzerRegistry registry;
    private final Executor executor;
    private final Duration callTimeout;

    public AnalysisStage(EvidenceStore store, EvidenceFactory factory, AnalyzerRegistry registry,
                         Executor executor, Duration callTimeout) {
        this.store = Objects.requireNonNull(store, "store");
        this.factory = Objects.requireNonNull(factory, "factory");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.callTimeout = Objects.requireNonNull(callTimeout, "callTimeout");
        if (callTimeout.isNegative() || callTimeout.isZero()) {
            throw new IllegalArgumentException("callTimeout must be positive");
        }
    }

    /**
     * @param preprocessedEvidenceId id of a Preprocessed Evidence
     * @param analyzerSet            dimensions to score and their analyzer versions
     * @return the committed Analyzed Evidence
     * @throws NotFoundException if the id is unknown, is not Preprocessed, or an analyzer in the
     *                           set is not registered (checked before any scoring starts)
     */
    public Evidence analyze(String preprocessedEvidenceId, AnalyzerSet analyzerSet) {
        Objects.requireNonNull(analyzerSet, "analyzerSet");
        Evidence input = store.get(preprocessedEvidenceId);
        if (input.versionKind() != VersionKind.PREPROCESSED) {
            throw new NotFoundException("Evidence " + preprocessedEvidenceId + " is "
                    + input.versionKind().wireName() + ", analysis requires Preprocessed",
                    PipelineStage.ANALYSIS, preprocessedEvidenceId);
        }
        Map<AnalyzerKind, Analyzer> analyzers = registry.resolve(analyzerSet);
        PreprocessedPayload pre = input.payloadAs(PreprocessedPayload.class);
        RawPayload raw = rawParentOf(input);
        AudioSource source = raw == null ? null : raw.source();
        String language = raw == null ? null : raw.language();

        Map<Integer, Map<AnalyzerKind, ScoringCall>> pending = new LinkedHashMap<>();
        for (Segment segment : pre.segments()) {
            ScoringTarget target = new ScoringTarget(segment, source, language);
            Map<AnalyzerKind, ScoringCall> calls = new EnumMap<>(AnalyzerKind.class);
            analyzers.forEach((kind, analyzer) -> calls.put(kind, submit(analyzer, target, preprocessedEvidenceId)));
            pending.put(segment.index(), calls);
        }

        List<SegmentAnalysis> analyses = new ArrayList<>(pre.segments().size());
        boolean interrupted = false;
        for (Segment segment : pre.segments()) {
            Map<AnalyzerKind, DimensionOutcome> results = new EnumMap<>(AnalyzerKind.class);
            for (Map.Entry<AnalyzerKind, ScoringCall> e : pending.get(segment.index()).entrySet()) {
                ScoringCall call = e.getValue();
                if (interrupted) {
                    call.cancel();
                }
                try {
                    results.put(e.getKey(), call.outcome.get());
                } catch (InterruptedException ie) {
                    interrupted = true;
                    call.cancel();
                    results.put(e.getKey(), call.outcome.getNow(call.cancelledMarker()));
                } catch (CancellationException ce) {
                    results.put(e.getKey(), call.cancelledMarker());
                } catch (ExecutionException ee) {
                    results.put(e.getKey(), marker(call.analyzer, segment.index(), AnalysisFailure.ANALYZER_ERROR,
                            "outcome mapping failed: " + ee.getCause(), preprocessedEvidenceId, ee.getCause()));
                }
            }
            analyses.add(new SegmentAnalysis(segment.index(), segment.start(), segment.end(),
                    segment.speakerId(), results));
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }

        Map<AnalyzerKind, String> versions = new EnumMap<>(AnalyzerKind.class);
        analyzers.forEach((kind, analyzer) -> versions.put(kind, analyzer.version()));
        AnalyzedPayload payload = new AnalyzedPayload(versions, analyses);
        String id = store.put(factory.create(preprocessedEvidenceId, PRODUCER, payload));
        LOG.info("Analyzed {} -> {}: {} segments x {} dimensions, {} failure markers",
                preprocessedEvidenceId, id, analyses.size(), versions.size(), payload.failureCount());
        return store.get(id);
    }

    private ScoringCall submit(Analyzer analyzer, ScoringTarget target, String evidenceId) {
        ScoringCall call = new ScoringCall(analyzer, target, evidenceId);
        try {
            executor.execute(call::run);
        } catch (RejectedExecutionException ex) {
            call.score.completeExceptionally(ex);
        }
        return call;
    }

    /**
     * One (segment, analyzer) call. When the call times out or is cancelled, the worker running
     * the analyzer is interrupted so it returns to the pool instead of blocking queued calls.
     */
    private final class ScoringCall {

        private final Analyzer analyzer;
        private final ScoringTarget target;
        private final CompletableFuture<AnalyzerScore> score = new CompletableFuture<>();
        private final CompletableFuture<DimensionOutcome> outcome;

        // guarded by this
        private Thread worker;
        private boolean workerInterrupted;

        ScoringCall(Analyzer analyzer, ScoringTarget target, String evidenceId) {
            this.analyzer = analyzer;
            this.target = target;
            int segment = target.segment().index();
            this.outcome = score.handle((s, error) -> error == null
                    ? toOutcome(analyzer, segment, s, evidenceId)
                    : toFailure(analyzer, segment, unwrap(error), evidenceId));
            score.whenComplete((s, error) -> {
                if (error != null) {
                    stopWorker();
                }
            });
        }

        void run() {
            synchronized (this) {
                if (score.isDone()) {
                    return;
                }
                worker = Thread.currentThread();
            }
            score.orTimeout(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
            try {
                score.complete(analyzer.score(target));
            } catch (RuntimeException | Error ex) {
                score.completeExceptionally(ex);
            } finally {
                synchronized (this) {
                    worker = null;
                    if (workerInterrupted) {
                        // the worker goes back to the pool; drop the interrupt aimed at this call
                        Thread.interrupted();
                    }
                }
            }
        }

        void cancel() {
            score.cancel(true);
        }

        AnalysisFailure cancelledMarker() {
            return new AnalysisFailure(analyzer.kind(), analyzer.version(),
                    AnalysisFailure.CANCELLED, "analysis interrupted");
        }

        private synchronized void stopWorker() {
            if (worker != null && worker != Thread.currentThread()) {
                workerInterrupted = true;
                worker.interrupt();
            }
        }
    }

    private static DimensionOutcome toOutcome(Analyzer analyzer, int segment, AnalyzerScore score,
                                              String evidenceId) {
        if (score == null || !inUnitRange(score.value()) || !inUnitRange(score.confidence())) {
            String detail = score == null ? "no score returned"
                    : "value=" + score.value() + ", confidence=" + score.confidence();
            return marker(analyzer, segment, AnalysisFailure.OUT_OF_RANGE, detail, evidenceId, null);
        }
        return new AnalysisResult(analyzer.kind(), score.value(), score.confidence(), analyzer.version());
    }

    private static DimensionOutcome toFailure(Analyzer analyzer, int segment, Throwable error, String evidenceId) {
        if (error instanceof TimeoutException) {
            return marker(analyzer, segment, AnalysisFailure.TIMEOUT, "no score within call timeout", evidenceId, null);
        }
        if (error instanceof CancellationException) {
            return marker(analyzer, segment, AnalysisFailure.CANCELLED, "call cancelled", evidenceId, null);
        }
        if (error instanceof PartialAnalysisException pae) {
            String reason = pae.getReason() == null || pae.getReason().isBlank()
                    ? AnalysisFailure.ANALYZER_ERROR : pae.getReason();
            return marker(analyzer, segment, reason, pae.getMessage(), evidenceId, pae);
        }
        String message = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        return marker(analyzer, segment, AnalysisFailure.ANALYZER_ERROR, message, evidenceId, error);
    }

    private static AnalysisFailure marker(Analyzer analyzer, int segment, String reason, String message,
                                          String evidenceId, Throwable cause) {
        PartialAnalysisException report = new PartialAnalysisException(message, segment, analyzer.kind(), reason,
                evidenceId, cause);
        LOG.warn("{} (segment={}, analyzer={}@{}, reason={})", report.toReport(), segment,
                analyzer.kind(), analyzer.version(), reason);
        return new AnalysisFailure(analyzer.kind(), analyzer.version(), reason, message);
    }

    private static Throwable unwrap(Throwable t) {
        return t instanceof CompletionException && t.getCause() != null ? t.getCause() : t;
    }

    private static boolean inUnitRange(double v) {
        return !Double.isNaN(v) && v >= 0.0 && v <= 1.0;
    }

    private RawPayload rawParentOf(Evidence preprocessed) {
        if (preprocessed.parentId() == null || !store.contains(preprocessed.parentId())) {
            return null;
        }
        Evidence parent = store.get(preprocessed.parentId());
        return parent.payload() instanceof RawPayload raw ? raw : null;
    }
}
