package com.phillippitts.hsie.config.preprocessing;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.List;
import java.util.Set;

/**
 * Typed properties for the Preprocessing Stage.
 *
 * <p>Pause thresholds and the filler / incomplete-ending lists drive the mechanical segment
 * reconstruction rules; they are matched literally, never interpreted.
 */
@Validated
@ConfigurationProperties(prefix = "hsie.preprocessing")
public class PreprocessingProperties {

    static final Set<String> DEFAULT_FILLERS = Set.of(
            "えー", "あの", "そのー", "えっと", "まあ", "なんか", "その", "あー", "うーん", "んー",
            "um", "uh", "er", "erm", "hmm", "mm");

    static final List<String> DEFAULT_INCOMPLETE_ENDINGS = List.of(
            "て", "で", "から", "ので", "のに", "けど", "が", "けれど", "けれども");

    /** Spans whose diarization confidence is below this are labelled "unknown" (0..1). */
    @Min(0)
    @Max(1)
    private final double diarizationConfidenceThreshold;

    /** Pauses shorter than this (seconds) are SHORT. */
    private final double shortPauseSeconds;

    /** Pauses from this length on (seconds) are LONG and split a segment. */
    private final double longPauseSeconds;

    private final Set<String> fillerWords;

    private final List<String> incompleteEndings;

    @ConstructorBinding
    public PreprocessingProperties(Double diarizationConfidenceThreshold, Double shortPauseSeconds,
                                   Double longPauseSeconds, Set<String> fillerWords,
                                   List<String> incompleteEndings) {
        double t = diarizationConfidenceThreshold == null ? 0.6 : diarizationConfidenceThreshold;
        if (t < 0.0 || t > 1.0) {
            throw new IllegalArgumentException(
                    "hsie.preprocessing.diarization-confidence-threshold must be in [0,1]");
        }
        this.diarizationConfidenceThreshold = t;
        this.shortPauseSeconds = shortPauseSeconds == null ? 0.7 : shortPauseSeconds;
        this.longPauseSeconds = longPauseSeconds == null ? 2.0 : longPauseSeconds;
        if (this.shortPauseSeconds < 0.0 || this.longPauseSeconds < this.shortPauseSeconds) {
            throw new IllegalArgumentException(
                    "hsie.preprocessing pause thresholds must satisfy 0 <= short-pause-seconds <= long-pause-seconds");
        }
        this.fillerWords = fillerWords == null ? DEFAULT_FILLERS : Set.copyOf(fillerWords);
        this.incompleteEndings = incompleteEndings == null ? DEFAULT_INCOMPLETE_ENDINGS
                : List.copyOf(incompleteEndings);
    }

    /**
     * Defaults with a specific threshold; for tests and manual instantiation.
     */
    public PreprocessingProperties(double diarizationConfidenceThreshold) {
        this(diarizationConfidenceThreshold, null, null, null, null);
    }

    public double getDiarizationConfidenceThreshold() {
        return diarizationConfidenceThreshold;
    }

    public double getShortPauseSeconds() {
        return shortPauseSeconds;
    }

    public double getLongPauseSeconds() {
        return longPauseSeconds;
    }

    public Set<String> getFillerWords() {
        return fillerWords;
    }

    public List<String> getIncompleteEndings() {
        return incompleteEndings;
    }
}
