package com.phillippitts.hsie.service.transcription;

import com.phillippitts.hsie.domain.TranscriptResult;

import java.nio.file.Path;

/**
 * Contract for the external speech-recognition collaborator.
 *
 * <p>A pure function from audio to transcript and word timings. Implementations never write
 * Evidence; they either return a complete {@link TranscriptResult} or throw.
 *
 * @see AbstractTranscriptionAdapter
 */
public interface TranscriptionAdapter {

    /**
     * Transcribes an audio file.
     *
     * @param audio    path to the audio file
     * @param language recognition language code
     * @return transcript with word-level timings and overall confidence
     * @throws com.phillippitts.hsie.exception.TranscriptionException with a reason code on any failure
     */
    TranscriptResult transcribe(Path audio, String language);

    /**
     * @return engine identifier recorded in capture metadata (e.g. "whisper")
     */
    String getEngineName();

    /**
     * @return model identifier recorded in capture metadata, or {@code null}
     */
    String getModelName();
}
