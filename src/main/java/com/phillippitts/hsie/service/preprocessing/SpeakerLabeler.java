package com.phillippitts.hsie.service.preprocessing;

import com.phillippitts.hsie.domain.Segment;
import com.phillippitts.hsie.domain.WordTiming;
import com.phillippitts.hsie.service.diarization.SpeakerTurn;

import java.util.ArrayList;
import java.util.List;

/**
 * Assigns each word the speaker turn with the largest time overlap.
 *
 * <p>Zero-length words take the first turn containing their start. A word no turn touches, or
 * whose best turn has a confidence below the threshold, is labelled {@link Segment#UNKNOWN_SPEAKER};
 * no best guess is recorded in that case. A diarizer label equal to the sentinel is treated as unknown.
 */
final class SpeakerLabeler {

    private SpeakerLabeler() {}

    static List<LabeledWord> label(List<WordTiming> words, List<SpeakerTurn> turns, double threshold) {
        List<LabeledWord> out = new ArrayList<>(words.size());
        for (WordTiming w : words) {
            SpeakerTurn best = bestTurn(w, turns);
            if (best == null) {
                out.add(new LabeledWord(w, Segment.UNKNOWN_SPEAKER, 0.0));
            } else if (best.confidence() < threshold || Segment.UNKNOWN_SPEAKER.equals(best.speakerId())) {
                out.add(new LabeledWord(w, Segment.UNKNOWN_SPEAKER, best.confidence()));
            } else {
                out.add(new LabeledWord(w, best.speakerId(), best.confidence()));
            }
        }
        return out;
    }

    private static SpeakerTurn bestTurn(WordTiming w, List<SpeakerTurn> turns) {
        if (w.duration() <= 0.0) {
            for (SpeakerTurn t : turns) {
                if (t.contains(w.start())) {
                    return t;
                }
            }
            return null;
        }
        SpeakerTurn best = null;
        double bestOverlap = 0.0;
        for (SpeakerTurn t : turns) {
            double o = t.overlap(w.start(), w.end());
            if (o > bestOverlap) {
                best = t;
                bestOverlap = o;
            }
        }
        return best;
    }
}
