package com.phillippitts.hsie.domain;

import java.util.List;
import java.util.Objects;

/**
 * Payload of Raw Evidence: what the Entry Stage knew at capture time, without diarization,
 * scoring or judgment. The schema deliberately has no speaker field.
 */
public record RawPayload(
        String transcript,
        String language,
        double overallConfidence,
        List<WordTiming> words,
        List<TranscriptChunk> chunks,
        AudioSource source,
        CaptureInfo capture
) implements EvidencePayload {

    public RawPayload {
        Objects.requireNonNull(transcript, "transcript must not be null");
        words = List.copyOf(Objects.requireNonNull(words, "words must not be null"));
        chunks = List.copyOf(Objects.requireNonNull(chunks, "chunks must not be null"));
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(capture, "capture must not be null");
    }

    @Override
    public VersionKind kind() {
        return VersionKind.RAW;
    }

    /**
     * @return start of the first word, or 0 for an empty transcript
     */
    public double rangeStart() {
        return words.isEmpty() ? 0.0 : words.get(0).start();
    }

    /**
     * @return latest word end, or 0 for an empty transcript
     */
    public double rangeEnd() {
        double end = 0.0;
        for (WordTiming w : words) {
            end = Math.max(end, w.end());
        }
        return end;
    }
}
