package com.phillippitts.hsie.service.entry;

import com.phillippitts.hsie.domain.AudioSource;
import com.phillippitts.hsie.exception.TranscriptionException;
import com.phillippitts.hsie.exception.TranscriptionFailureReason;
import com.phillippitts.hsie.service.store.ContentAddress;
import com.phillippitts.hsie.service.transcription.AbstractTranscriptionAdapter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sound.sampled.AudioFileFormat;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.UnsupportedAudioFileException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

/**
 * Collects objective facts about an audio file: location, hash, size and, for containers Java
 * Sound can read (WAV, AIFF, AU), duration, sample rate and channel layout.
 *
 * <p>Nothing here inspects the audio content beyond its header; formats Java Sound does not know
 * leave the optional fields {@code null}.
 */
public class AudioMetadataCollector {

    private static final Logger LOG = LogManager.getLogger(AudioMetadataCollector.class);

    public AudioSource collect(Path audio) {
        Path path = audio.toAbsolutePath().normalize();
        if (!Files.isRegularFile(path)) {
            throw new TranscriptionException("Audio file not found: " + path, TranscriptionFailureReason.AUDIO_NOT_FOUND);
        }
        try {
            String sha256;
            try (InputStream in = Files.newInputStream(path)) {
                sha256 = ContentAddress.sha256Hex(in);
            }
            long size = Files.size(path);
            Instant modifiedAt = Files.getLastModifiedTime(path).toInstant();

            Double duration = null;
            Integer sampleRate = null;
            String channels = null;
            try {
                AudioFileFormat fileFormat = AudioSystem.getAudioFileFormat(path.toFile());
                AudioFormat format = fileFormat.getFormat();
                if (format.getSampleRate() > 0) {
                    sampleRate = Math.round(format.getSampleRate());
                }
                channels = channelLayout(format.getChannels());
                long frames = fileFormat.getFrameLength();
                if (frames > 0 && format.getFrameRate() > 0) {
                    duration = frames / (double) format.getFrameRate();
                }
            } catch (UnsupportedAudioFileException e) {
                LOG.debug("No header metadata for {}: {}", path.getFileName(), e.getMessage());
            }
            return new AudioSource(path.toString(), AbstractTranscriptionAdapter.formatOf(path), sha256,
                    size, duration, sampleRate, channels, modifiedAt);
        } catch (IOException e) {
            throw new TranscriptionException("Cannot read audio file " + path + ": " + e.getMessage(),
                    TranscriptionFailureReason.AUDIO_NOT_FOUND, "unknown", e);
        }
    }

    static String channelLayout(int channels) {
        return switch (channels) {
            case 1 -> "mono";
            case 2 -> "stereo";
            default -> channels > 0 ? channels + "ch" : null;
        };
    }
}
