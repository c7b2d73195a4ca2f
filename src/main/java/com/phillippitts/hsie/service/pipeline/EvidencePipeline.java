package com.phillippitts.hsie.service.pipeline;

import com.phillippitts.hsie.domain.AnalyzedPayload;
import com.phillippitts.hsie.domain.Evidence;
import com.phillippitts.hsie.domain.WeightingConfig;
import com.phillippitts.hsie.exception.HsieException;
import com.phillippitts.hsie.exception.PipelineStage;
import com.phillippitts.hsie.service.aggregation.AggregationStage;
import com.phillippitts.hsie.service.analysis.AnalysisStage;
import com.phillippitts.hsie.service.analysis.AnalyzerSet;
import com.phillippitts.hsie.service.entry.EntryStage;
import com.phillippitts.hsie.service.events.EvidenceCommittedEvent;
import com.phillippitts.hsie.service.events.StageFailedEvent;
import com.phillippitts.hsie.service.metrics.PipelineMetricsPublisher;
import com.phillippitts.hsie.service.preprocessing.PreprocessingStage;
import com.phillippitts.hsie.service.store.EvidenceStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Entry point to the pipeline for the CLI and REST surfaces.
 *
 * <p>Runs one stage at a time against committed Evidence, so a failed chain can be resumed from
 * the last Evidence it produced. Every stage call is wrapped with:
 * <ul>
 *   <li>Log4j2 ThreadContext keys {@code stage} and {@code evidenceId}</li>
 *   <li>latency and outcome metrics via {@link PipelineMetricsPublisher}</li>
 *   <li>{@link EvidenceCommittedEvent} / {@link StageFailedEvent}</li>
 * </ul>
 * Stages share no mutable state; distinct captures may run through one instance concurrently.
 */
public class EvidencePipeline {

    private static final Logger LOG = LogManager.getLogger(EvidencePipeline.class);

    static final String MDC_STAGE = "stage";
    static final String MDC_EVIDENCE_ID = "evidenceId";

    private final EntryStage entryStage;
    private final PreprocessingStage preprocessingStage;
    private final AnalysisStage analysisStage;
    private final AggregationStage aggregationStage;
    private final EvidenceStore store;
    private final AnalyzerSet defaultAnalyzerSet;
    private final WeightingConfig defaultWeighting;
    private final PipelineMetricsPublisher metrics;
    private final ApplicationEventPublisher events;

    public EvidencePipeline(EntryStage entryStage,
                            PreprocessingStage preprocessingStage,
                            AnalysisStage analysisStage,
                            AggregationStage aggregationStage,
                            EvidenceStore store,
                            AnalyzerSet defaultAnalyzerSet,
                            WeightingConfig defaultWeighting,
                            PipelineMetricsPublisher metrics,
                            ApplicationEventPublisher events) {
        this.entryStage = Objects.requireNonNull(entryStage, "entryStage");
        this.preprocessingStage = Objects.requireNonNull(preprocessingStage, "preprocessingStage");
        this.analysisStage = Objects.requireNonNull(analysisStage, "analysisStage");
        this.aggregationStage = Objects.requireNonNull(aggregationStage, "aggregationStage");
        this.store = Objects.requireNonNull(store, "store");
        this.defaultAnalyzerSet = Objects.requireNonNull(defaultAnalyzerSet, "defaultAnalyzerSet");
        this.defaultWeighting = Objects.requireNonNull(defaultWeighting, "defaultWeighting");
        this.metrics = metrics == null ? PipelineMetricsPublisher.NOOP : metrics;
        this.events = Objects.requireNonNull(events, "events");
    }

    public Evidence capture(Path audio, String sessionId) {
        return runStage(PipelineStage.ENTRY, null, () -> entryStage.capture(audio, sessionId));
    }

    public Evidence preprocess(String rawEvidenceId) {
        return runStage(PipelineStage.PREPROCESSING, rawEvidenceId,
                () -> preprocessingStage.preprocess(rawEvidenceId));
    }

    public Evidence analyze(String preprocessedEvidenceId) {
        return analyze(preprocessedEvidenceId, defaultAnalyzerSet);
    }

    public Evidence analyze(String preprocessedEvidenceId, AnalyzerSet analyzerSet) {
        Evidence analyzed = runStage(PipelineStage.ANALYSIS, preprocessedEvidenceId,
                () -> analysisStage.analyze(preprocessedEvidenceId, analyzerSet));
        metrics.recordAnalysisFailures(analyzed.payloadAs(AnalyzedPayload.class));
        return analyzed;
    }

    public Evidence score(String analyzedEvidenceId) {
        return score(analyzedEvidenceId, defaultWeighting);
    }

    public Evidence score(String analyzedEvidenceId, WeightingConfig weighting) {
        return runStage(PipelineStage.AGGREGATION, analyzedEvidenceId,
                () -> aggregationStage.aggregate(analyzedEvidenceId, weighting));
    }

    /**
     * Runs all four stages with the default analyzer set and weighting.
     */
    public PipelineRun run(Path audio, String sessionId) {
        Evidence raw = capture(audio, sessionId);
        Evidence pre = preprocess(raw.id());
        Evidence analyzed = analyze(pre.id());
        Evidence scored = score(analyzed.id());
        return new PipelineRun(raw, pre, analyzed, scored);
    }

    public Evidence get(String id) {
        return store.get(id);
    }

    public List<Evidence> lineage(String id) {
        return store.lineage(id);
    }

    public List<Evidence> children(String id) {
        return store.children(id);
    }

    public Evidence verify(String id) {
        return store.verify(id);
    }

    public AnalyzerSet getDefaultAnalyzerSet() {
        return defaultAnalyzerSet;
    }

    public WeightingConfig getDefaultWeighting() {
        return defaultWeighting;
    }

    private Evidence runStage(PipelineStage stage, String inputId, Supplier<Evidence> work) {
        String previousStage = ThreadContext.get(MDC_STAGE);
        String previousId = ThreadContext.get(MDC_EVIDENCE_ID);
        ThreadContext.put(MDC_STAGE, stage.label());
        if (inputId != null) {
            ThreadContext.put(MDC_EVIDENCE_ID, inputId);
        }
        long start = System.nanoTime();
        try {
            Evidence evidence = work.get();
            metrics.recordSuccess(stage, System.nanoTime() - start);
            events.publishEvent(new EvidenceCommittedEvent(stage, evidence, Instant.now()));
            return evidence;
        } catch (HsieException e) {
            metrics.recordFailure(stage, System.nanoTime() - start, e.getKind().displayName());
            events.publishEvent(new StageFailedEvent(stage, inputId, e.getKind().displayName(), e.toReport(),
                    Instant.now()));
            LOG.warn("Stage {} failed: {}", stage.label(), e.toReport());
            throw e;
        } finally {
            restore(MDC_STAGE, previousStage);
            restore(MDC_EVIDENCE_ID, previousId);
        }
    }

    private static void restore(String key, String value) {
        if (value == null) {
            ThreadContext.remove(key);
        } else {
            ThreadContext.put(key, value);
        }
    }
}
