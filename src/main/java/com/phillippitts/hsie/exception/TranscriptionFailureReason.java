package com.phillippitts.hsie.exception;

/**
 * Reason codes carried by {@link TranscriptionException}.
 */
public enum TranscriptionFailureReason {
    UNSUPPORTED_FORMAT,
    AUDIO_NOT_FOUND,
    LOW_CONFIDENCE,
    TIMEOUT,
    ENGINE_FAILURE,
    MALFORMED_OUTPUT
}
