package com.phillippitts.hsie.exception;

/**
 * Thrown when the transcription collaborator fails. Terminal for the capture that raised it;
 * no Raw Evidence is written.
 */
public class TranscriptionException extends HsieException {

    private final TranscriptionFailureReason reason;
    private final String engineName;

    public TranscriptionException(String message, TranscriptionFailureReason reason) {
        this(message, reason, "unknown", null);
    }

    public TranscriptionException(String message, TranscriptionFailureReason reason, String engineName) {
        this(message, reason, engineName, null);
    }

    public TranscriptionException(String message, TranscriptionFailureReason reason, String engineName,
                                  Throwable cause) {
        super(message + " (engine: " + engineName + ", reason: " + reason + ")",
                PipelineStage.ENTRY, null, cause);
        this.reason = reason;
        this.engineName = engineName;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.TRANSCRIPTION;
    }

    public TranscriptionFailureReason getReason() {
        return reason;
    }

    public String getEngineName() {
        return engineName;
    }
}
