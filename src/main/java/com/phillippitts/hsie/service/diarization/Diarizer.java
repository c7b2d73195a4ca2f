package com.phillippitts.hsie.service.diarization;

import com.phillippitts.hsie.domain.RawPayload;

import java.util.List;

/**
 * Speaker diarization collaborator: assigns speaker labels with a confidence to time spans of
 * a Raw transcript. The algorithm is external; this is only its contract.
 */
public interface Diarizer {

    /**
     * @param raw Raw payload (audio reference and word timings)
     * @return speaker turns; may be empty, may overlap
     * @throws com.phillippitts.hsie.exception.DiarizationException if the collaborator fails
     */
    List<SpeakerTurn> diarize(RawPayload raw);

    /**
     * @return identity recorded in the Preprocessed payload
     */
    String name();
}
