package com.phillippitts.hsie.config.transcription;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.List;
import java.util.Locale;

/**
 * Typed properties for the Entry Stage and its transcription adapter.
 */
@Validated
@ConfigurationProperties(prefix = "hsie.transcription")
public class TranscriptionProperties {

    static final List<String> DEFAULT_FORMATS = List.of("wav", "mp3", "m4a", "flac", "ogg");

    /** Recognition language passed to the engine. */
    @NotBlank
    private final String language;

    /** Lowercase file extensions accepted for capture. */
    private final List<String> supportedFormats;

    /** Transcripts with a lower overall confidence are rejected (0..1, 0 disables). */
    @Min(0)
    @Max(1)
    private final double minConfidence;

    @ConstructorBinding
    public TranscriptionProperties(String language, List<String> supportedFormats, Double minConfidence) {
        this.language = language == null || language.isBlank() ? "en" : language.trim();
        this.supportedFormats = supportedFormats == null || supportedFormats.isEmpty()
                ? DEFAULT_FORMATS
                : supportedFormats.stream().map(f -> f.trim().toLowerCase(Locale.ROOT)).toList();
        double c = minConfidence == null ? 0.0 : minConfidence;
        if (c < 0.0 || c > 1.0) {
            throw new IllegalArgumentException("hsie.transcription.min-confidence must be in [0,1]");
        }
        this.minConfidence = c;
    }

    public String getLanguage() {
        return language;
    }

    public List<String> getSupportedFormats() {
        return supportedFormats;
    }

    public double getMinConfidence() {
        return minConfidence;
    }
}
