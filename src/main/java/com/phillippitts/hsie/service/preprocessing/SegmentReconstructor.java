package com.phillippitts.hsie.service.preprocessing;

import com.phillippitts.hsie.domain.PauseLevel;
import com.phillippitts.hsie.domain.Segment;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Mechanical segment reconstruction over speaker-labelled words.
 *
 * <p>Rules, applied in order:
 * <ol>
 *   <li>Consecutive words form a group while they share ASR chunk and speaker label and the gap
 *       between them is below the long-pause threshold.</li>
 *   <li>A filler-only group is merged into the previous segment.</li>
 *   <li>A group ending with an incomplete ending is merged with the next group when the pause
 *       between them is SHORT and the next group is not filler-only.</li>
 * </ol>
 * Merges require the same known speaker on both sides; {@code unknown} segments are never merged.
 * Words are matched against the lists literally after trimming, lowercasing and dropping trailing
 * punctuation; nothing is interpreted.
 */
final class SegmentReconstructor {

    private static final String TRAILING_PUNCTUATION = ",.!?;:、。！？…";

    private final double shortPause;
    private final double longPause;
    private final Set<String> fillers;
    private final List<String> incompleteEndings;

    SegmentReconstructor(double shortPause, double longPause, Set<String> fillers, List<String> incompleteEndings) {
        this.shortPause = shortPause;
        this.longPause = longPause;
        this.fillers = Objects.requireNonNull(fillers, "fillers");
        this.incompleteEndings = Objects.requireNonNull(incompleteEndings, "incompleteEndings");
    }

    List<Segment> reconstruct(List<LabeledWord> words, String separator) {
        List<Group> groups = group(words);
        List<Group> units = new ArrayList<>();
        int i = 0;
        while (i < groups.size()) {
            Group current = groups.get(i);
            String text = current.text(separator);

            if (isFillerOnly(text) && !units.isEmpty() && sameKnownSpeaker(units.get(units.size() - 1), current)) {
                units.get(units.size() - 1).absorb(current);
                i++;
                continue;
            }
            if (i + 1 < groups.size()) {
                Group next = groups.get(i + 1);
                if (!isFillerOnly(next.text(separator))
                        && sameKnownSpeaker(current, next)
                        && hasIncompleteEnding(text)
                        && next.start() - current.end() < shortPause) {
                    current.absorb(next);
                    units.add(current);
                    i += 2;
                    continue;
                }
            }
            units.add(current);
            i++;
        }
        return toSegments(units, separator);
    }

    private List<Group> group(List<LabeledWord> words) {
        List<Group> groups = new ArrayList<>();
        Group current = null;
        for (LabeledWord w : words) {
            if (current == null || !current.accepts(w, longPause)) {
                current = new Group(w.speakerId(), w.word().chunk());
                groups.add(current);
            }
            current.add(w);
        }
        return groups;
    }

    private List<Segment> toSegments(List<Group> units, String separator) {
        List<Segment> segments = new ArrayList<>(units.size());
        double prevEnd = Double.NaN;
        for (Group g : units) {
            double pause = Double.isNaN(prevEnd) ? 0.0 : Math.max(0.0, g.start() - prevEnd);
            segments.add(new Segment(
                    segments.size(),
                    g.start(),
                    g.end(),
                    g.speakerId,
                    g.minConfidence(),
                    g.text(separator),
                    g.firstWord(),
                    g.lastWord(),
                    pause,
                    PauseLevel.classify(pause, shortPause, longPause)));
            prevEnd = g.end();
        }
        return segments;
    }

    boolean isFillerOnly(String text) {
        return fillers.contains(normalize(text));
    }

    boolean hasIncompleteEnding(String text) {
        String n = normalize(text);
        for (String ending : incompleteEndings) {
            if (n.endsWith(ending)) {
                return true;
            }
        }
        return false;
    }

    private static boolean sameKnownSpeaker(Group a, Group b) {
        return !Segment.UNKNOWN_SPEAKER.equals(a.speakerId) && a.speakerId.equals(b.speakerId);
    }

    static String normalize(String text) {
        String s = text.strip().toLowerCase(Locale.ROOT);
        int end = s.length();
        while (end > 0 && TRAILING_PUNCTUATION.indexOf(s.charAt(end - 1)) >= 0) {
            end--;
        }
        return s.substring(0, end).strip();
    }

    /**
     * Mutable run of words while reconstruction is in progress.
     */
    private static final class Group {
        private final String speakerId;
        private final int chunk;
        private final List<LabeledWord> words = new ArrayList<>();

        Group(String speakerId, int chunk) {
            this.speakerId = speakerId;
            this.chunk = chunk;
        }

        boolean accepts(LabeledWord w, double longPause) {
            LabeledWord last = words.get(words.size() - 1);
            return w.word().chunk() == chunk
                    && w.speakerId().equals(speakerId)
                    && w.word().start() - last.word().end() < longPause;
        }

        void add(LabeledWord w) {
            words.add(w);
        }

        void absorb(Group other) {
            words.addAll(other.words);
        }

        double start() {
            return words.get(0).word().start();
        }

        double end() {
            double end = 0.0;
            for (LabeledWord w : words) {
                end = Math.max(end, w.word().end());
            }
            return end;
        }

        int firstWord() {
            return words.get(0).word().index();
        }

        int lastWord() {
            return words.get(words.size() - 1).word().index();
        }

        double minConfidence() {
            double min = 1.0;
            for (LabeledWord w : words) {
                min = Math.min(min, w.confidence());
            }
            return min;
        }

        String text(String separator) {
            StringBuilder sb = new StringBuilder();
            for (LabeledWord w : words) {
                if (sb.length() > 0) {
                    sb.append(separator);
                }
                sb.append(w.word().text().strip());
            }
            return sb.toString();
        }
    }
}
