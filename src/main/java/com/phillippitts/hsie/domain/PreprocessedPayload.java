package com.phillippitts.hsie.domain;

import java.util.List;
import java.util.Objects;

/**
 * Payload of Preprocessed Evidence: ordered, non-overlapping segments covering the parent
 * transcript, plus every word span that was explicitly discarded.
 */
public record PreprocessedPayload(
        double sourceStart,
        double sourceEnd,
        List<Segment> segments,
        List<DiscardedSpan> discarded,
        DiarizationInfo diarization
) implements EvidencePayload {

    public PreprocessedPayload {
        segments = List.copyOf(Objects.requireNonNull(segments, "segments must not be null"));
        discarded = List.copyOf(Objects.requireNonNull(discarded, "discarded must not be null"));
        Objects.requireNonNull(diarization, "diarization must not be null");
    }

    @Override
    public VersionKind kind() {
        return VersionKind.PREPROCESSED;
    }

    /**
     * @return segments whose speaker could not be assigned with enough confidence
     */
    public List<Segment> unknownSpeakerSegments() {
        return segments.stream().filter(Segment::isSpeakerUnknown).toList();
    }
}
