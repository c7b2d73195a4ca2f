package com.phillippitts.hsie.domain;

/**
 * Classification of the silence preceding a segment.
 */
public enum PauseLevel {
    SHORT,
    NORMAL,
    LONG;

    /**
     * Classifies a pause using fixed thresholds.
     *
     * @param pauseSeconds silence length (negative values are treated as zero)
     * @param shortBelow   pauses below this are SHORT
     * @param longFrom     pauses from this on are LONG
     */
    public static PauseLevel classify(double pauseSeconds, double shortBelow, double longFrom) {
        double p = Math.max(0.0, pauseSeconds);
        if (p < shortBelow) {
            return SHORT;
        }
        return p < longFrom ? NORMAL : LONG;
    }
}
