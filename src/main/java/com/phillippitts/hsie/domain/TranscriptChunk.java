package com.phillippitts.hsie.domain;

import java.util.Objects;

/**
 * Time-aligned ASR segment as produced by the engine, before any reconstruction.
 * Carries no speaker information.
 */
public record TranscriptChunk(int index, double start, double end, String text) {

    public TranscriptChunk {
        Objects.requireNonNull(text, "text must not be null");
        if (start < 0.0 || end < start) {
            throw new IllegalArgumentException("Invalid chunk span [" + start + ", " + end + "]");
        }
    }
}
