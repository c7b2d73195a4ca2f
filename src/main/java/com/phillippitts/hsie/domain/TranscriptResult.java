package com.phillippitts.hsie.domain;

import java.util.List;
import java.util.Objects;

/**
 * Output of the transcription collaborator.
 *
 * @param text              full transcript
 * @param language          language code used for recognition
 * @param wordTimings       word-level timings in transcript order
 * @param chunks            engine segments
 * @param overallConfidence aggregate confidence between 0.0 and 1.0
 * @param engineName        engine identity (e.g. "whisper")
 * @param modelName         model identity, or {@code null}
 */
public record TranscriptResult(
        String text,
        String language,
        List<WordTiming> wordTimings,
        List<TranscriptChunk> chunks,
        double overallConfidence,
        String engineName,
        String modelName
) {

    public TranscriptResult {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(engineName, "engineName must not be null");
        wordTimings = List.copyOf(Objects.requireNonNull(wordTimings, "wordTimings must not be null"));
        chunks = List.copyOf(Objects.requireNonNull(chunks, "chunks must not be null"));
        if (Double.isNaN(overallConfidence) || overallConfidence < 0.0 || overallConfidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got: " + overallConfidence);
        }
    }
}
