package com.phillippitts.hsie.service.diarization;

import java.util.Objects;

/**
 * Time span attributed to one speaker by the diarizer.
 *
 * @param start      start time in seconds
 * @param end        end time in seconds
 * @param speakerId  diarizer speaker label
 * @param confidence confidence of the attribution in [0, 1]
 */
public record SpeakerTurn(double start, double end, String speakerId, double confidence) {

    public SpeakerTurn {
        Objects.requireNonNull(speakerId, "speakerId must not be null");
        if (end < start) {
            throw new IllegalArgumentException("Turn end " + end + " before start " + start);
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Turn confidence must be between 0.0 and 1.0, got: " + confidence);
        }
    }

    /**
     * @return length of the intersection with {@code [from, to]}, 0 when disjoint
     */
    public double overlap(double from, double to) {
        return Math.max(0.0, Math.min(end, to) - Math.max(start, from));
    }

    public boolean contains(double t) {
        return t >= start && t <= end;
    }
}
