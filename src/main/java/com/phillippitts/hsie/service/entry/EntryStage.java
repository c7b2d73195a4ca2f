package com.phillippitts.hsie.service.entry;

import com.phillippitts.hsie.domain.AudioSource;
import com.phillippitts.hsie.domain.CaptureInfo;
import com.phillippitts.hsie.domain.Evidence;
import com.phillippitts.hsie.domain.RawPayload;
import com.phillippitts.hsie.domain.TranscriptResult;
import com.phillippitts.hsie.service.store.EvidenceFactory;
import com.phillippitts.hsie.service.store.EvidenceStore;
import com.phillippitts.hsie.service.transcription.TranscriptionAdapter;
import com.phillippitts.hsie.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Captures audio as Raw Evidence: transcript with word timings, audio facts and capture metadata.
 *
 * <p>The Raw payload carries no speaker labels, scores or judgments. Any transcription failure is
 * terminal for the capture and leaves the store untouched.
 */
public class EntryStage {

    private static final Logger LOG = LogManager.getLogger(EntryStage.class);

    public static final String PRODUCER = "entry-stage";

    /** Hex characters of the audio hash used in a derived session id. */
    static final int SESSION_HASH_CHARS = 12;

    private final TranscriptionAdapter adapter;
    private final AudioMetadataCollector metadataCollector;
    private final EvidenceStore store;
    private final EvidenceFactory factory;
    private final String language;

    public EntryStage(TranscriptionAdapter adapter, AudioMetadataCollector metadataCollector,
                      EvidenceStore store, EvidenceFactory factory, String language) {
        this.adapter = Objects.requireNonNull(adapter, "adapter");
        this.metadataCollector = Objects.requireNonNull(metadataCollector, "metadataCollector");
        this.store = Objects.requireNonNull(store, "store");
        this.factory = Objects.requireNonNull(factory, "factory");
        this.language = language;
    }

    /**
     * Transcribes the audio and commits the result as Raw Evidence.
     *
     * @param audio     audio file
     * @param sessionId session identifier; when blank, one is derived from the audio hash so that
     *                  capturing the same file twice yields the same Evidence
     * @return the committed Raw Evidence
     * @throws com.phillippitts.hsie.exception.TranscriptionException on any transcription failure
     */
    public Evidence capture(Path audio, String sessionId) {
        Objects.requireNonNull(audio, "audio");
        TranscriptResult transcript = adapter.transcribe(audio, language);
        AudioSource source = metadataCollector.collect(audio);

        String session = sessionId == null || sessionId.isBlank()
                ? "session-" + source.sha256().substring(0, SESSION_HASH_CHARS)
                : sessionId;
        CaptureInfo capture = new CaptureInfo(session, transcript.engineName(), transcript.modelName(), PRODUCER);
        RawPayload payload = new RawPayload(transcript.text(), transcript.language(),
                transcript.overallConfidence(), transcript.wordTimings(), transcript.chunks(), source, capture);

        String id = store.put(factory.create(null, PRODUCER, payload));
        LOG.info("Captured {} as Raw {}: {} words, confidence={}, session={}", source.uri(), id,
                payload.words().size(), String.format("%.3f", payload.overallConfidence()), session);
        LOG.debug("Transcript preview: {}", LogSanitizer.preview(transcript.text()));
        return store.get(id);
    }
}
