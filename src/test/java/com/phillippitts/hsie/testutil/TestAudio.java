package com.phillippitts.hsie.testutil;

import javax.sound.sampled.AudioFileFormat;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Writes silent PCM WAV files for tests that need real audio headers.
 */
public final class TestAudio {

    public static final float SAMPLE_RATE = 16000f;

    private TestAudio() {}

    /**
     * @return the written file: 16 kHz, 16-bit signed little-endian PCM of the given channel count
     */
    public static Path writeSilentWav(Path file, double seconds, int channels) throws IOException {
        AudioFormat format = new AudioFormat(SAMPLE_RATE, 16, channels, true, false);
        int frames = (int) Math.round(seconds * SAMPLE_RATE);
        byte[] pcm = new byte[frames * format.getFrameSize()];
        try (AudioInputStream in = new AudioInputStream(new ByteArrayInputStream(pcm), format, frames)) {
            AudioSystem.write(in, AudioFileFormat.Type.WAVE, file.toFile());
        }
        return file;
    }
}
