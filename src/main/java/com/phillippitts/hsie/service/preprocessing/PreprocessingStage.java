package com.phillippitts.hsie.service.preprocessing;

import com.phillippitts.hsie.config.preprocessing.PreprocessingProperties;
import com.phillippitts.hsie.domain.DiarizationInfo;
import com.phillippitts.hsie.domain.DiscardReason;
import com.phillippitts.hsie.domain.DiscardedSpan;
import com.phillippitts.hsie.domain.Evidence;
import com.phillippitts.hsie.domain.PreprocessedPayload;
import com.phillippitts.hsie.domain.RawPayload;
import com.phillippitts.hsie.domain.Segment;
import com.phillippitts.hsie.domain.VersionKind;
import com.phillippitts.hsie.domain.WordTiming;
import com.phillippitts.hsie.exception.DiarizationException;
import com.phillippitts.hsie.exception.IntegrityException;
import com.phillippitts.hsie.exception.NotFoundException;
import com.phillippitts.hsie.exception.PipelineStage;
import com.phillippitts.hsie.service.diarization.Diarizer;
import com.phillippitts.hsie.service.diarization.SpeakerTurn;
import com.phillippitts.hsie.service.store.EvidenceFactory;
import com.phillippitts.hsie.service.store.EvidenceStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns Raw Evidence into Preprocessed Evidence: speaker diarization and segment reconstruction.
 *
 * <p>Steps:
 * <ol>
 *   <li>load the Raw parent; anything else is rejected with {@link NotFoundException}</li>
 *   <li>validate word timings (ordered, {@code end >= start}, non-overlapping); violations are
 *       {@link IntegrityException}s</li>
 *   <li>mark blank tokens and non-speech markers as discarded</li>
 *   <li>label words via the {@link Diarizer}; low-confidence spans become {@code unknown}</li>
 *   <li>reconstruct utterance-level segments</li>
 *   <li>verify coverage and commit with the Raw id as parent</li>
 * </ol>
 */
public class PreprocessingStage {

    private static final Logger LOG = LogManager.getLogger(PreprocessingStage.class);

    public static final String PRODUCER = "preprocessing-stage";

    /** Bracketed annotations, asterisk actions and music symbols emitted by ASR engines. */
    static final Pattern NON_SPEECH_MARKER =
            Pattern.compile("^(\\[[^\\]]*\\]|\\([^)]*\\)|\\*[^*]*\\*|[♪♫♬\\s]+)$");

    /** Languages written without spaces between words. */
    private static final Set<String> UNSPACED_LANGUAGES = Set.of("ja", "zh", "th");

    private final EvidenceStore store;
    private final EvidenceFactory factory;
    private final Diarizer diarizer;
    private final double threshold;
    private final SegmentReconstructor reconstructor;

    public PreprocessingStage(EvidenceStore store, EvidenceFactory factory, Diarizer diarizer,
                              PreprocessingProperties properties) {
        this.store = Objects.requireNonNull(store, "store");
        this.factory = Objects.requireNonNull(factory, "factory");
        this.diarizer = Objects.requireNonNull(diarizer, "diarizer");
        this.threshold = properties.getDiarizationConfidenceThreshold();
        this.reconstructor = new SegmentReconstructor(properties.getShortPauseSeconds(),
                properties.getLongPauseSeconds(), properties.getFillerWords(), properties.getIncompleteEndings());
    }

    /**
     * @param rawEvidenceId id of a Raw Evidence
     * @return the committed Preprocessed Evidence (the existing one if equal content was committed before)
     */
    public Evidence preprocess(String rawEvidenceId) {
        Evidence input = store.get(rawEvidenceId);
        if (input.versionKind() != VersionKind.RAW) {
            throw new NotFoundException("Evidence " + rawEvidenceId + " is " + input.versionKind().wireName()
                    + ", preprocessing requires Raw", PipelineStage.PREPROCESSING, rawEvidenceId);
        }
        RawPayload raw = input.payloadAs(RawPayload.class);
        validateTimings(raw.words(), rawEvidenceId);

        List<WordTiming> kept = new ArrayList<>();
        List<DiscardedSpan> discarded = new ArrayList<>();
        for (WordTiming w : raw.words()) {
            DiscardReason reason = discardReason(w.text());
            if (reason == null) {
                kept.add(w);
            } else {
                discarded.add(new DiscardedSpan(w.index(), w.start(), w.end(), w.text(), reason));
            }
        }

        List<SpeakerTurn> turns = diarize(raw, rawEvidenceId);
        List<LabeledWord> labeled = SpeakerLabeler.label(kept, turns, threshold);
        List<Segment> segments = reconstructor.reconstruct(labeled, separatorFor(raw.language()));

        PreprocessedPayload payload = new PreprocessedPayload(raw.rangeStart(), raw.rangeEnd(), segments,
                discarded, new DiarizationInfo(diarizer.name(), threshold));
        SegmentCoverage.verify(raw, payload, rawEvidenceId);

        String id = store.put(factory.create(rawEvidenceId, PRODUCER, payload));
        LOG.info("Preprocessed {} -> {}: {} segments ({} unknown speaker), {} discarded", rawEvidenceId, id,
                segments.size(), payload.unknownSpeakerSegments().size(), discarded.size());
        return store.get(id);
    }

    private List<SpeakerTurn> diarize(RawPayload raw, String rawEvidenceId) {
        if (raw.words().isEmpty()) {
            return List.of();
        }
        try {
            return diarizer.diarize(raw);
        } catch (DiarizationException e) {
            throw new DiarizationException(e.getMessage(), rawEvidenceId, e);
        }
    }

    static void validateTimings(List<WordTiming> words, String rawEvidenceId) {
        WordTiming prev = null;
        for (int i = 0; i < words.size(); i++) {
            WordTiming w = words.get(i);
            if (w.index() != i) {
                throw invalid("word at position " + i + " has index " + w.index(), rawEvidenceId);
            }
            if (w.end() < w.start()) {
                throw invalid("word " + i + " ends before it starts", rawEvidenceId);
            }
            if (prev != null && w.start() < prev.end()) {
                throw invalid("word " + i + " overlaps word " + prev.index(), rawEvidenceId);
            }
            prev = w;
        }
    }

    static DiscardReason discardReason(String text) {
        if (text == null || text.isBlank()) {
            return DiscardReason.BLANK_TOKEN;
        }
        if (NON_SPEECH_MARKER.matcher(text.strip()).matches()) {
            return DiscardReason.NON_SPEECH_MARKER;
        }
        return null;
    }

    static String separatorFor(String language) {
        if (language == null) {
            return " ";
        }
        return UNSPACED_LANGUAGES.contains(language.toLowerCase(Locale.ROOT)) ? "" : " ";
    }

    private static IntegrityException invalid(String detail, String rawEvidenceId) {
        return new IntegrityException("Invalid Raw word timings: " + detail, PipelineStage.PREPROCESSING,
                rawEvidenceId);
    }
}
