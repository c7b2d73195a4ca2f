package com.phillippitts.hsie.service.transcription;

import com.phillippitts.hsie.config.transcription.WhisperConfig;
import com.phillippitts.hsie.domain.TranscriptResult;
import com.phillippitts.hsie.exception.TranscriptionException;
import com.phillippitts.hsie.exception.TranscriptionExceptionBuilder;
import com.phillippitts.hsie.exception.TranscriptionFailureReason;
import com.phillippitts.hsie.service.process.ExternalProcessException;
import com.phillippitts.hsie.service.process.ExternalProcessRunner;
import com.phillippitts.hsie.service.process.ProcessResult;
import com.phillippitts.hsie.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Transcription adapter running a whisper binary as an external process.
 *
 * <p>CLI contract:
 * <pre>
 * ${binary} -m ${model} -f ${audio} -l ${language} -ojf -of ${tmp}/transcript -t ${threads}
 * </pre>
 * The JSON document is read from {@code ${tmp}/transcript.json}; when the binary does not write that
 * file (e.g. a wrapper script), stdout is parsed instead.
 */
public class WhisperCliTranscriptionAdapter extends AbstractTranscriptionAdapter {

    private static final Logger LOG = LogManager.getLogger(WhisperCliTranscriptionAdapter.class);

    public static final String ENGINE_NAME = "whisper";
    static final String OUTPUT_BASENAME = "transcript";

    private final WhisperConfig config;
    private final ExternalProcessRunner runner;

    public WhisperCliTranscriptionAdapter(WhisperConfig config, ExternalProcessRunner runner,
                                          List<String> supportedFormats, double minConfidence) {
        super(supportedFormats, minConfidence);
        this.config = Objects.requireNonNull(config, "config");
        this.runner = Objects.requireNonNull(runner, "runner");
    }

    @Override
    protected TranscriptResult doTranscribe(Path audio, String language) {
        Path workDir = createWorkDir();
        try {
            List<String> command = buildCommand(audio, language, workDir.resolve(OUTPUT_BASENAME));
            ProcessResult result = runner.run(command, workDir, null,
                    Duration.ofSeconds(config.timeoutSeconds()), config.maxStdoutBytes());
            String json = readOutput(workDir, result.stdout());
            LOG.debug("Whisper finished in {}ms, output={}", result.durationMs(), LogSanitizer.preview(json));
            return WhisperTranscriptParser.parse(json, ENGINE_NAME, getModelName(), language);
        } catch (ExternalProcessException e) {
            throw toTranscriptionException(e);
        } finally {
            deleteRecursively(workDir);
        }
    }

    @Override
    public String getEngineName() {
        return ENGINE_NAME;
    }

    @Override
    public String getModelName() {
        Path name = Path.of(config.modelPath()).getFileName();
        return name == null ? config.modelPath() : name.toString();
    }

    List<String> buildCommand(Path audio, String language, Path outputBase) {
        List<String> cmd = new ArrayList<>();
        cmd.add(resolvePath(config.binaryPath()).toString());
        cmd.add("-m");
        cmd.add(resolvePath(config.modelPath()).toString());
        cmd.add("-f");
        cmd.add(audio.toAbsolutePath().toString());
        if (language != null && !language.isBlank()) {
            cmd.add("-l");
            cmd.add(language);
        }
        cmd.add("-ojf");
        cmd.add("-of");
        cmd.add(outputBase.toString());
        cmd.add("-t");
        cmd.add(String.valueOf(config.threads()));
        return cmd;
    }

    private TranscriptionException toTranscriptionException(ExternalProcessException e) {
        TranscriptionFailureReason reason = e.getFailure() == ExternalProcessException.Failure.TIMEOUT
                ? TranscriptionFailureReason.TIMEOUT
                : TranscriptionFailureReason.ENGINE_FAILURE;
        return TranscriptionExceptionBuilder.create(e.getMessage(), reason)
                .engine(ENGINE_NAME)
                .exitCode(e.getExitCode())
                .durationMs(e.getDurationMs())
                .metadata("binaryPath", config.binaryPath())
                .metadata("modelPath", config.modelPath())
                .metadata("stderr", e.getStderrSnippet())
                .cause(e)
                .build();
    }

    private static String readOutput(Path workDir, String stdout) {
        Path file = workDir.resolve(OUTPUT_BASENAME + ".json");
        if (Files.isRegularFile(file)) {
            try {
                return Files.readString(file, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new TranscriptionException("Cannot read whisper output " + file,
                        TranscriptionFailureReason.MALFORMED_OUTPUT, ENGINE_NAME, e);
            }
        }
        return stdout;
    }

    private static Path createWorkDir() {
        try {
            return Files.createTempDirectory("hsie-whisper-");
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create whisper work directory", e);
        }
    }

    private static void deleteRecursively(Path dir) {
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted((a, b) -> b.getNameCount() - a.getNameCount()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    LOG.debug("Could not delete {}: {}", p, e.toString());
                }
            });
        } catch (IOException e) {
            LOG.debug("Could not clean up {}: {}", dir, e.toString());
        }
    }

    /**
     * Resolves a configured path to absolute so the command does not depend on the working directory.
     */
    private static Path resolvePath(String pathString) {
        Path path = Path.of(pathString);
        if (path.isAbsolute()) {
            return path;
        }
        return Path.of(".").toAbsolutePath().normalize().resolve(path).normalize();
    }
}
