package com.phillippitts.hsie.exception;

/**
 * Error taxonomy reported to callers. The display name is what the CLI prints on stderr
 * and what the REST surface returns as {@code errorCode}.
 */
public enum ErrorKind {
    TRANSCRIPTION("TranscriptionError"),
    INTEGRITY("IntegrityError"),
    NOT_FOUND("NotFoundError"),
    PARTIAL_ANALYSIS("PartialAnalysisError"),
    INSUFFICIENT_EVIDENCE("InsufficientEvidenceError"),
    DIARIZATION("DiarizationError");

    private final String displayName;

    ErrorKind(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
