package com.phillippitts.hsie.service.analysis;

import com.phillippitts.hsie.domain.AudioSource;
import com.phillippitts.hsie.domain.Segment;

import java.util.Objects;

/**
 * What an analyzer scores: one segment plus the audio it was cut from, so acoustic analyzers can
 * read the {@code [start, end]} window of the source file.
 */
public record ScoringTarget(Segment segment, AudioSource source, String language) {
    public ScoringTarget {
        Objects.requireNonNull(segment, "segment must not be null");
    }
}
