package com.phillippitts.hsie.config.transcription;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the whisper CLI transcription adapter.
 * Binds to properties prefixed with "hsie.transcription.whisper".
 *
 * <p>Example application.properties:
 * <pre>
 * hsie.transcription.whisper.binary-path=tools/whisper.cpp/main
 * hsie.transcription.whisper.model-path=models/ggml-base.bin
 * hsie.transcription.whisper.timeout-seconds=600
 * hsie.transcription.whisper.threads=4
 * hsie.transcription.whisper.max-stdout-bytes=16777216
 * </pre>
 *
 * @param binaryPath Path to the whisper binary executable
 * @param modelPath Path to the model file
 * @param timeoutSeconds Maximum time to wait for one transcription (in seconds)
 * @param threads Number of CPU threads to use
 * @param maxStdoutBytes Maximum stdout accumulation in bytes
 */
@ConfigurationProperties(prefix = "hsie.transcription.whisper")
@Validated
public record WhisperConfig(
        @NotBlank(message = "Whisper binary path must not be blank")
        String binaryPath,

        @NotBlank(message = "Whisper model path must not be blank")
        String modelPath,

        @Positive(message = "Timeout must be positive")
        int timeoutSeconds,

        @Positive(message = "Thread count must be positive")
        int threads,

        @Positive(message = "Max stdout bytes must be positive")
        int maxStdoutBytes
) {
    @ConstructorBinding
    public WhisperConfig {
    }

    /**
     * Default constructor with standard values. Full JSON output of a long recording is large,
     * so the stdout cap is 16MB.
     */
    public WhisperConfig() {
        this("tools/whisper.cpp/main", "models/ggml-base.bin", 600, 4, 16 * 1024 * 1024);
    }
}
