package com.phillippitts.hsie.config;

import com.phillippitts.hsie.config.analysis.AnalysisProperties;
import com.phillippitts.hsie.config.analysis.WeightingProperties;
import com.phillippitts.hsie.config.preprocessing.DiarizationProperties;
import com.phillippitts.hsie.config.preprocessing.PreprocessingProperties;
import com.phillippitts.hsie.config.store.StoreProperties;
import com.phillippitts.hsie.config.transcription.TranscriptionProperties;
import com.phillippitts.hsie.config.transcription.WhisperConfig;
import com.phillippitts.hsie.domain.AnalyzerKind;
import com.phillippitts.hsie.service.aggregation.AggregationStage;
import com.phillippitts.hsie.service.analysis.Analyzer;
import com.phillippitts.hsie.service.analysis.AnalysisStage;
import com.phillippitts.hsie.service.analysis.AnalyzerRegistry;
import com.phillippitts.hsie.service.analysis.AnalyzerSet;
import com.phillippitts.hsie.service.analysis.CommandAnalyzer;
import com.phillippitts.hsie.service.diarization.CommandDiarizer;
import com.phillippitts.hsie.service.diarization.Diarizer;
import com.phillippitts.hsie.service.diarization.SingleSpeakerDiarizer;
import com.phillippitts.hsie.service.entry.AudioMetadataCollector;
import com.phillippitts.hsie.service.entry.EntryStage;
import com.phillippitts.hsie.service.metrics.PipelineMetricsPublisher;
import com.phillippitts.hsie.service.pipeline.EvidencePipeline;
import com.phillippitts.hsie.service.preprocessing.PreprocessingStage;
import com.phillippitts.hsie.service.process.ExternalProcessRunner;
import com.phillippitts.hsie.service.store.EvidenceFactory;
import com.phillippitts.hsie.service.store.EvidenceStore;
import com.phillippitts.hsie.service.store.FileSystemEvidenceStore;
import com.phillippitts.hsie.service.store.InMemoryEvidenceStore;
import com.phillippitts.hsie.service.transcription.TranscriptionAdapter;
import com.phillippitts.hsie.service.transcription.WhisperCliTranscriptionAdapter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Wires the Evidence Store, the external collaborators and the four stages.
 *
 * <p>Collaborator beans are {@link ConditionalOnMissingBean} so tests and embedding applications
 * can supply their own transcription adapter, diarizer or analyzers.
 */
@Configuration
public class PipelineConfig {

    private static final Logger LOG = LogManager.getLogger(PipelineConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public EvidenceStore evidenceStore(StoreProperties props) {
        if (props.getType() == StoreProperties.Type.FILESYSTEM) {
            Path dir = Path.of(props.getBaseDir()).toAbsolutePath().normalize();
            LOG.info("Using file-system Evidence Store at {}", dir);
            return new FileSystemEvidenceStore(dir);
        }
        LOG.info("Using in-memory Evidence Store");
        return new InMemoryEvidenceStore();
    }

    @Bean
    public ExternalProcessRunner externalProcessRunner() {
        return new ExternalProcessRunner();
    }

    @Bean
    @ConditionalOnMissingBean
    public TranscriptionAdapter transcriptionAdapter(WhisperConfig whisper, TranscriptionProperties props,
                                                     ExternalProcessRunner runner) {
        return new WhisperCliTranscriptionAdapter(whisper, runner, props.getSupportedFormats(),
                props.getMinConfidence());
    }

    @Bean
    @ConditionalOnMissingBean
    public Diarizer diarizer(DiarizationProperties props, ExternalProcessRunner runner) {
        return switch (props.getType()) {
            case SINGLE -> new SingleSpeakerDiarizer(props.getDefaultSpeaker());
            case COMMAND -> new CommandDiarizer(props.getCommand(), Duration.ofSeconds(props.getTimeoutSeconds()),
                    runner);
        };
    }

    @Bean
    @ConditionalOnMissingBean
    public AnalyzerRegistry analyzerRegistry(AnalysisProperties props, ExternalProcessRunner runner,
                                             ObjectProvider<Analyzer> contributed) {
        List<Analyzer> analyzers = new ArrayList<>(contributed.orderedStream().toList());
        Duration timeout = Duration.ofMillis(props.getCallTimeoutMs());
        props.getCommands().forEach((kind, command) ->
                analyzers.add(new CommandAnalyzer(kind, props.versionOf(kind), command, timeout, runner)));
        for (Analyzer a : analyzers) {
            LOG.info("Registered analyzer {}@{}", a.kind(), a.version());
        }
        return new AnalyzerRegistry(analyzers);
    }

    @Bean
    public EntryStage entryStage(TranscriptionAdapter adapter, EvidenceStore store, EvidenceFactory factory,
                                 TranscriptionProperties props) {
        return new EntryStage(adapter, new AudioMetadataCollector(), store, factory, props.getLanguage());
    }

    @Bean
    public PreprocessingStage preprocessingStage(EvidenceStore store, EvidenceFactory factory, Diarizer diarizer,
                                                 PreprocessingProperties props) {
        return new PreprocessingStage(store, factory, diarizer, props);
    }

    @Bean
    public AnalysisStage analysisStage(EvidenceStore store, EvidenceFactory factory, AnalyzerRegistry registry,
                                       @Qualifier("analysisExecutor") Executor analysisExecutor,
                                       AnalysisProperties props) {
        return new AnalysisStage(store, factory, registry, analysisExecutor,
                Duration.ofMillis(props.getCallTimeoutMs()));
    }

    @Bean
    public AggregationStage aggregationStage(EvidenceStore store, EvidenceFactory factory) {
        return new AggregationStage(store, factory);
    }

    @Bean
    public EvidencePipeline evidencePipeline(EntryStage entry, PreprocessingStage preprocessing,
                                             AnalysisStage analysis, AggregationStage aggregation,
                                             EvidenceStore store, AnalysisProperties analysisProps,
                                             WeightingProperties weighting, PipelineMetricsPublisher metrics,
                                             ApplicationEventPublisher events) {
        AnalyzerSet defaults = defaultAnalyzerSet(analysisProps);
        return new EvidencePipeline(entry, preprocessing, analysis, aggregation, store, defaults,
                weighting.toWeightingConfig(), metrics, events);
    }

    static AnalyzerSet defaultAnalyzerSet(AnalysisProperties props) {
        List<AnalyzerKind> kinds = props.getAnalyzerSet();
        return AnalyzerSet.of(kinds, props.getAnalyzerVersions());
    }
}
