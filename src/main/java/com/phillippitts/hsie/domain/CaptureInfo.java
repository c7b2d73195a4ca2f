package com.phillippitts.hsie.domain;

import java.util.Objects;

/**
 * Capture metadata recorded with Raw Evidence.
 *
 * @param sessionId  conversation session identifier supplied by the caller
 * @param engine     transcription engine name
 * @param model      transcription model name, or {@code null}
 * @param capturedBy producer identity of the Entry Stage
 */
public record CaptureInfo(String sessionId, String engine, String model, String capturedBy) {

    public CaptureInfo {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(engine, "engine must not be null");
        Objects.requireNonNull(capturedBy, "capturedBy must not be null");
    }
}
