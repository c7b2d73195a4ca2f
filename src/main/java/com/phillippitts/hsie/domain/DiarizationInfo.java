package com.phillippitts.hsie.domain;

import java.util.Objects;

/**
 * Provenance of the speaker assignment in Preprocessed Evidence.
 *
 * @param diarizer  identity of the diarizer collaborator
 * @param threshold confidence below which spans were labelled {@link Segment#UNKNOWN_SPEAKER}
 */
public record DiarizationInfo(String diarizer, double threshold) {

    public DiarizationInfo {
        Objects.requireNonNull(diarizer, "diarizer must not be null");
    }
}
