package com.phillippitts.hsie.service.diarization;

import com.phillippitts.hsie.domain.RawPayload;

import java.util.List;
import java.util.Objects;

/**
 * Attributes the whole recording to one fixed speaker with full confidence.
 */
public class SingleSpeakerDiarizer implements Diarizer {

    private final String speakerId;

    public SingleSpeakerDiarizer(String speakerId) {
        this.speakerId = Objects.requireNonNull(speakerId, "speakerId");
    }

    @Override
    public List<SpeakerTurn> diarize(RawPayload raw) {
        if (raw.words().isEmpty()) {
            return List.of();
        }
        return List.of(new SpeakerTurn(raw.rangeStart(), raw.rangeEnd(), speakerId, 1.0));
    }

    @Override
    public String name() {
        return "single-speaker:" + speakerId;
    }
}
