package com.phillippitts.hsie.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Physical, objective facts about the captured audio file. Optional fields are {@code null}
 * when the container format does not expose them.
 *
 * @param uri        normalised absolute location of the audio
 * @param format     lowercase file extension (wav, mp3, ...)
 * @param sha256     hash of the audio bytes, hex
 * @param sizeBytes  file size
 * @param duration   length in seconds
 * @param sampleRate sampling frequency in Hz
 * @param channels   channel layout (mono, stereo, Nch)
 * @param modifiedAt file modification time, used as an estimate of the recording time
 */
public record AudioSource(
        String uri,
        String format,
        String sha256,
        long sizeBytes,
        Double duration,
        Integer sampleRate,
        String channels,
        Instant modifiedAt
) {

    public AudioSource {
        Objects.requireNonNull(uri, "uri must not be null");
        Objects.requireNonNull(sha256, "sha256 must not be null");
    }
}
