package com.phillippitts.hsie.service.transcription;

import com.phillippitts.hsie.domain.TranscriptResult;
import com.phillippitts.hsie.exception.TranscriptionException;
import com.phillippitts.hsie.exception.TranscriptionFailureReason;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Abstract base class for transcription adapters.
 *
 * <p>This class implements the Template Method pattern: {@link #transcribe(Path, String)} performs
 * the checks every engine needs and delegates the engine call to {@link #doTranscribe(Path, String)}.
 *
 * <p><b>Checks, in order:</b>
 * <ol>
 *   <li>audio exists and is a regular file, else {@link TranscriptionFailureReason#AUDIO_NOT_FOUND}</li>
 *   <li>file extension is a supported format, else {@link TranscriptionFailureReason#UNSUPPORTED_FORMAT}</li>
 *   <li>engine call; {@link TranscriptionException}s pass through, anything else is wrapped as
 *       {@link TranscriptionFailureReason#ENGINE_FAILURE}</li>
 *   <li>overall confidence at least the configured minimum, else
 *       {@link TranscriptionFailureReason#LOW_CONFIDENCE}</li>
 * </ol>
 *
 * <p>No retries happen here. Retry policy, if any, belongs to the engine behind the adapter.
 */
public abstract class AbstractTranscriptionAdapter implements TranscriptionAdapter {

    private static final Logger LOG = LogManager.getLogger(AbstractTranscriptionAdapter.class);

    private final List<String> supportedFormats;
    private final double minConfidence;

    protected AbstractTranscriptionAdapter(List<String> supportedFormats, double minConfidence) {
        this.supportedFormats = List.copyOf(Objects.requireNonNull(supportedFormats, "supportedFormats"));
        this.minConfidence = minConfidence;
    }

    @Override
    public final TranscriptResult transcribe(Path audio, String language) {
        Objects.requireNonNull(audio, "audio");
        if (!Files.isRegularFile(audio)) {
            throw new TranscriptionException("Audio file not found: " + audio,
                    TranscriptionFailureReason.AUDIO_NOT_FOUND, getEngineName());
        }
        String format = formatOf(audio);
        if (format == null || !supportedFormats.contains(format)) {
            throw new TranscriptionException("Unsupported audio format '" + format + "'; supported: "
                    + supportedFormats, TranscriptionFailureReason.UNSUPPORTED_FORMAT, getEngineName());
        }

        TranscriptResult result;
        try {
            result = doTranscribe(audio, language);
        } catch (TranscriptionException te) {
            throw te;
        } catch (RuntimeException e) {
            throw new TranscriptionException(getEngineName() + " transcription failed: " + e.getMessage(),
                    TranscriptionFailureReason.ENGINE_FAILURE, getEngineName(), e);
        }

        if (result.overallConfidence() < minConfidence) {
            throw new TranscriptionException(String.format(Locale.ROOT,
                    "Overall confidence %.3f below minimum %.3f", result.overallConfidence(), minConfidence),
                    TranscriptionFailureReason.LOW_CONFIDENCE, getEngineName());
        }
        LOG.debug("{} produced {} words, confidence={}", getEngineName(), result.wordTimings().size(),
                result.overallConfidence());
        return result;
    }

    /**
     * Engine-specific transcription.
     *
     * <p><b>Contract:</b> return a complete result or throw; never return partial output. Throw
     * {@link TranscriptionException} with {@link TranscriptionFailureReason#TIMEOUT} or
     * {@link TranscriptionFailureReason#MALFORMED_OUTPUT} where those apply.
     */
    protected abstract TranscriptResult doTranscribe(Path audio, String language);

    /**
     * @return lowercase extension without the dot, or {@code null} if the file has none
     */
    public static String formatOf(Path audio) {
        Path name = audio.getFileName();
        if (name == null) {
            return null;
        }
        String s = name.toString();
        int dot = s.lastIndexOf('.');
        if (dot < 0 || dot == s.length() - 1) {
            return null;
        }
        return s.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
