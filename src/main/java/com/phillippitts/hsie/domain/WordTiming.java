package com.phillippitts.hsie.domain;

import java.util.Objects;

/**
 * Word-level timing produced by the ASR engine. Times are seconds from the start of the audio.
 *
 * @param index       position in the transcript (0-based, dense)
 * @param text        token text as emitted by the engine
 * @param start       start time in seconds
 * @param end         end time in seconds
 * @param probability engine probability for this token, or {@code null} if not reported
 * @param chunk       index of the ASR chunk this word belongs to
 */
public record WordTiming(int index, String text, double start, double end, Double probability, int chunk) {

    public WordTiming {
        Objects.requireNonNull(text, "text must not be null");
        if (index < 0 || chunk < 0) {
            throw new IllegalArgumentException("index and chunk must be non-negative");
        }
        if (start < 0.0) {
            throw new IllegalArgumentException("start must be non-negative, got: " + start);
        }
    }

    public double duration() {
        return end - start;
    }
}
