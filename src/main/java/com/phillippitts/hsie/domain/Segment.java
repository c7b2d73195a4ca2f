package com.phillippitts.hsie.domain;

import java.util.Objects;

/**
 * Utterance-level slice of the interaction produced by the Preprocessing Stage.
 *
 * @param index             position in the segment sequence (0-based)
 * @param start             start time in seconds
 * @param end               end time in seconds
 * @param speakerId         diarized speaker, or {@link #UNKNOWN_SPEAKER}
 * @param speakerConfidence diarization confidence of the assignment
 * @param text              transcript span covered by this segment
 * @param firstWord         index of the first Raw word covered
 * @param lastWord          index of the last Raw word covered (inclusive)
 * @param pauseBefore       silence since the previous segment, seconds
 * @param pauseLevel        classification of {@code pauseBefore}
 */
public record Segment(
        int index,
        double start,
        double end,
        String speakerId,
        double speakerConfidence,
        String text,
        int firstWord,
        int lastWord,
        double pauseBefore,
        PauseLevel pauseLevel
) {

    /**
     * Sentinel speaker id for spans whose diarization confidence was below threshold.
     * Never equal to a real speaker id.
     */
    public static final String UNKNOWN_SPEAKER = "unknown";

    public Segment {
        Objects.requireNonNull(speakerId, "speakerId must not be null");
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(pauseLevel, "pauseLevel must not be null");
        if (end < start) {
            throw new IllegalArgumentException("Segment end " + end + " before start " + start);
        }
        if (lastWord < firstWord) {
            throw new IllegalArgumentException("Segment word range [" + firstWord + ", " + lastWord + "] is empty");
        }
    }

    public boolean isSpeakerUnknown() {
        return UNKNOWN_SPEAKER.equals(speakerId);
    }

    public double duration() {
        return end - start;
    }
}
