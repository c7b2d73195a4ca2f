package com.phillippitts.hsie.service.preprocessing;

import com.phillippitts.hsie.domain.Segment;
import com.phillippitts.hsie.domain.WordTiming;
import com.phillippitts.hsie.service.diarization.SpeakerTurn;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.phillippitts.hsie.testutil.EvidenceFixtures.word;
import static org.assertj.core.api.Assertions.assertThat;

class SpeakerLabelerTest {

    @Test
    void picksTurnWithLargestOverlap() {
        List<WordTiming> words = List.of(word(0, "hello", 0.0, 1.0));
        List<SpeakerTurn> turns = List.of(new SpeakerTurn(0.0, 0.3, "A", 0.9), new SpeakerTurn(0.3, 1.0, "B", 0.8));

        List<LabeledWord> labeled = SpeakerLabeler.label(words, turns, 0.6);

        assertThat(labeled).singleElement().satisfies(w -> {
            assertThat(w.speakerId()).isEqualTo("B");
            assertThat(w.confidence()).isEqualTo(0.8);
        });
    }

    @Test
    void belowThresholdBecomesUnknownWithoutBestGuess() {
        List<WordTiming> words = List.of(word(0, "maybe", 0.0, 0.5));
        List<SpeakerTurn> turns = List.of(new SpeakerTurn(0.0, 1.0, "A", 0.4));

        LabeledWord w = SpeakerLabeler.label(words, turns, 0.6).get(0);

        assertThat(w.speakerId()).isEqualTo(Segment.UNKNOWN_SPEAKER);
        assertThat(w.isSpeakerUnknown()).isTrue();
        assertThat(w.confidence()).isEqualTo(0.4);
    }

    @Test
    void confidenceEqualToThresholdIsKept() {
        LabeledWord w = SpeakerLabeler.label(List.of(word(0, "yes", 0.0, 0.5)),
                List.of(new SpeakerTurn(0.0, 1.0, "A", 0.6)), 0.6).get(0);

        assertThat(w.speakerId()).isEqualTo("A");
    }

    @Test
    void wordOutsideEveryTurnIsUnknown() {
        LabeledWord w = SpeakerLabeler.label(List.of(word(0, "late", 5.0, 5.5)),
                List.of(new SpeakerTurn(0.0, 1.0, "A", 0.9)), 0.6).get(0);

        assertThat(w.speakerId()).isEqualTo(Segment.UNKNOWN_SPEAKER);
        assertThat(w.confidence()).isZero();
    }

    @Test
    void zeroLengthWordTakesContainingTurn() {
        LabeledWord w = SpeakerLabeler.label(List.of(word(0, "ok", 0.5, 0.5)),
                List.of(new SpeakerTurn(0.0, 1.0, "A", 0.9)), 0.6).get(0);

        assertThat(w.speakerId()).isEqualTo("A");
    }

    @Test
    void diarizerUnknownLabelStaysUnknown() {
        LabeledWord w = SpeakerLabeler.label(List.of(word(0, "hm", 0.0, 0.5)),
                List.of(new SpeakerTurn(0.0, 1.0, Segment.UNKNOWN_SPEAKER, 0.99)), 0.6).get(0);

        assertThat(w.isSpeakerUnknown()).isTrue();
    }
}
