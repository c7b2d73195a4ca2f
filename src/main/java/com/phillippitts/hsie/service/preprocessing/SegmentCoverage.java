package com.phillippitts.hsie.service.preprocessing;

import com.phillippitts.hsie.domain.DiscardedSpan;
import com.phillippitts.hsie.domain.PreprocessedPayload;
import com.phillippitts.hsie.domain.RawPayload;
import com.phillippitts.hsie.domain.Segment;
import com.phillippitts.hsie.domain.WordTiming;
import com.phillippitts.hsie.exception.IntegrityException;
import com.phillippitts.hsie.exception.PipelineStage;

import java.util.Arrays;
import java.util.List;

/**
 * Checks that a Preprocessed payload accounts for its Raw parent.
 *
 * <ul>
 *   <li>segments are indexed densely, ordered by start and do not overlap</li>
 *   <li>segment word ranges are ascending and disjoint</li>
 *   <li>every Raw word is either discarded (exactly once) or inside exactly one segment's word range,
 *       and its time span lies within that segment</li>
 *   <li>the recorded source range equals the Raw transcript's range</li>
 * </ul>
 * Coverage is measured over word spans: silence between words carries no transcript content.
 */
public final class SegmentCoverage {

    private static final double EPSILON = 1e-9;

    private SegmentCoverage() {}

    /**
     * @throws IntegrityException on the first violation found
     */
    public static void verify(RawPayload raw, PreprocessedPayload pre, String rawId) {
        List<WordTiming> words = raw.words();
        int n = words.size();
        int[] owner = new int[n];
        Arrays.fill(owner, -1);
        boolean[] discarded = new boolean[n];

        for (DiscardedSpan d : pre.discarded()) {
            if (d.word() < 0 || d.word() >= n) {
                throw violation("discarded span refers to unknown word " + d.word(), rawId);
            }
            if (discarded[d.word()]) {
                throw violation("word " + d.word() + " discarded twice", rawId);
            }
            discarded[d.word()] = true;
        }

        Segment prev = null;
        List<Segment> segments = pre.segments();
        for (int i = 0; i < segments.size(); i++) {
            Segment s = segments.get(i);
            if (s.index() != i) {
                throw violation("segment at position " + i + " has index " + s.index(), rawId);
            }
            if (prev != null) {
                if (s.start() + EPSILON < prev.end()) {
                    throw violation("segment " + i + " overlaps segment " + prev.index(), rawId);
                }
                if (s.firstWord() <= prev.lastWord()) {
                    throw violation("segment " + i + " word range overlaps segment " + prev.index(), rawId);
                }
            }
            if (s.firstWord() < 0 || s.lastWord() >= n) {
                throw violation("segment " + i + " word range outside transcript", rawId);
            }
            for (int w = s.firstWord(); w <= s.lastWord(); w++) {
                if (discarded[w]) {
                    continue;
                }
                WordTiming wt = words.get(w);
                if (wt.start() + EPSILON < s.start() || wt.end() > s.end() + EPSILON) {
                    throw violation("word " + w + " lies outside segment " + i, rawId);
                }
                owner[w] = i;
            }
            prev = s;
        }

        for (int w = 0; w < n; w++) {
            if (!discarded[w] && owner[w] < 0) {
                throw violation("word " + w + " is neither segmented nor discarded", rawId);
            }
        }
        if (Math.abs(pre.sourceStart() - raw.rangeStart()) > EPSILON
                || Math.abs(pre.sourceEnd() - raw.rangeEnd()) > EPSILON) {
            throw violation("source range [" + pre.sourceStart() + ", " + pre.sourceEnd()
                    + "] differs from transcript range [" + raw.rangeStart() + ", " + raw.rangeEnd() + "]", rawId);
        }
    }

    private static IntegrityException violation(String detail, String rawId) {
        return new IntegrityException("Segment coverage violated: " + detail, PipelineStage.PREPROCESSING, rawId);
    }
}
