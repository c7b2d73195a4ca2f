package com.phillippitts.hsie.service.preprocessing;

import com.phillippitts.hsie.domain.Segment;
import com.phillippitts.hsie.domain.WordTiming;

/**
 * Raw word with the speaker assigned by diarization.
 */
record LabeledWord(WordTiming word, String speakerId, double confidence) {

    boolean isSpeakerUnknown() {
        return Segment.UNKNOWN_SPEAKER.equals(speakerId);
    }
}
