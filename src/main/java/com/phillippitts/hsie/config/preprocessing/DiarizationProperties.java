package com.phillippitts.hsie.config.preprocessing;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Selects and configures the diarizer collaborator.
 */
@Validated
@ConfigurationProperties(prefix = "hsie.diarization")
public class DiarizationProperties {

    public enum Type { SINGLE, COMMAND }

    @NotNull
    private final Type type;

    /** Speaker label used by the single-speaker diarizer. */
    private final String defaultSpeaker;

    /** Command line of the external diarizer (type=COMMAND). */
    private final List<String> command;

    private final int timeoutSeconds;

    @ConstructorBinding
    public DiarizationProperties(Type type, String defaultSpeaker, List<String> command, Integer timeoutSeconds) {
        this.type = type == null ? Type.SINGLE : type;
        this.defaultSpeaker = defaultSpeaker == null || defaultSpeaker.isBlank() ? "speaker_0" : defaultSpeaker;
        this.command = command == null ? List.of() : List.copyOf(command);
        this.timeoutSeconds = timeoutSeconds == null || timeoutSeconds <= 0 ? 300 : timeoutSeconds;
        if (this.type == Type.COMMAND && this.command.isEmpty()) {
            throw new IllegalArgumentException("hsie.diarization.command is required when type=COMMAND");
        }
        if ("unknown".equals(this.defaultSpeaker)) {
            throw new IllegalArgumentException("hsie.diarization.default-speaker must not be the sentinel 'unknown'");
        }
    }

    public Type getType() {
        return type;
    }

    public String getDefaultSpeaker() {
        return defaultSpeaker;
    }

    public List<String> getCommand() {
        return command;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }
}
