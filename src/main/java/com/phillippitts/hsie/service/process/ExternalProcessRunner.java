package com.phillippitts.hsie.service.process;

import com.phillippitts.hsie.util.ProcessTimeouts;
import com.phillippitts.hsie.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs one external collaborator (whisper, a diarizer, a scorer) to completion.
 *
 * <p>The request document, if any, goes to stdin; stdout is the result and stderr is kept for
 * diagnostics. Both streams are read on their own daemon threads while the caller waits, so a
 * chatty process cannot block on a full pipe. A run that exceeds its timeout, or whose calling
 * thread is interrupted, is terminated: first {@link Process#destroy()}, then a forced kill.
 *
 * <p>The runner holds no per-run state and is shared by all concurrent analyzer calls.
 */
public final class ExternalProcessRunner {

    private static final Logger LOG = LogManager.getLogger(ExternalProcessRunner.class);

    /** stderr is capped independently of the caller's stdout cap. */
    static final int STDERR_MAX_BYTES = 256 * 1024;

    /** Longest stderr excerpt carried by an {@link ExternalProcessException}. */
    static final int ERROR_SNIPPET_MAX_CHARS = 2048;

    private final ProcessFactory processFactory;

    public ExternalProcessRunner() {
        this(new DefaultProcessFactory());
    }

    public ExternalProcessRunner(ProcessFactory processFactory) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
    }

    /**
     * @param command        executable followed by its arguments
     * @param workingDir     working directory, or {@code null} for the current one
     * @param stdin          request written to stdin, or {@code null}
     * @param timeout        wall-clock limit for the whole run
     * @param maxStdoutBytes cap on captured stdout; the rest is drained and dropped
     * @return output of a process that exited with status 0
     * @throws ExternalProcessException on timeout, non-zero exit, I/O error or interruption
     */
    public ProcessResult run(List<String> command, Path workingDir, String stdin, Duration timeout,
                             int maxStdoutBytes) throws ExternalProcessException {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(timeout, "timeout");
        String name = executableName(command);
        long started = System.nanoTime();

        Process process = null;
        OutputCapture out = null;
        OutputCapture err = null;
        boolean clean = false;
        try {
            process = processFactory.start(command, workingDir);
            out = OutputCapture.start(process.getInputStream(), name + "-out", maxStdoutBytes);
            err = OutputCapture.start(process.getErrorStream(), name + "-err", STDERR_MAX_BYTES);
            sendRequest(process, stdin);

            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw failure(name + " timed out after " + timeout.toMillis() + "ms",
                        ExternalProcessException.Failure.TIMEOUT, -1, err, started, null);
            }
            out.await(ProcessTimeouts.OUTPUT_DRAIN_TIMEOUT);
            err.await(ProcessTimeouts.OUTPUT_DRAIN_TIMEOUT);

            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw failure(name + " exited with " + exitCode,
                        ExternalProcessException.Failure.NON_ZERO_EXIT, exitCode, err, started, null);
            }
            clean = true;
            String stdout = out.text();
            LOG.debug("{} finished in {}ms, stdout {} chars", name, TimeUtils.elapsedMillis(started), stdout.length());
            return new ProcessResult(stdout, err.text(), TimeUtils.elapsedMillis(started));
        } catch (IOException e) {
            throw failure(name + " I/O failure: " + e.getMessage(), ExternalProcessException.Failure.IO_ERROR,
                    -1, err, started, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw failure(name + " interrupted", ExternalProcessException.Failure.INTERRUPTED,
                    -1, err, started, e);
        } finally {
            if (!clean) {
                terminate(process, name);
                if (out != null) {
                    out.await(ProcessTimeouts.OUTPUT_ABANDON_TIMEOUT);
                }
                if (err != null) {
                    err.await(ProcessTimeouts.OUTPUT_ABANDON_TIMEOUT);
                }
            }
        }
    }

    private static void sendRequest(Process process, String stdin) throws IOException {
        try (OutputStream os = process.getOutputStream()) {
            if (stdin != null) {
                os.write(stdin.getBytes(StandardCharsets.UTF_8));
            }
        }
    }

    private static String executableName(List<String> command) {
        if (command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }
        Path exe = Path.of(command.get(0)).getFileName();
        return exe == null ? command.get(0) : exe.toString();
    }

    /**
     * Stops a process that is still running. An interrupted caller skips the grace period and
     * kills at once, since it cannot wait.
     */
    private static void terminate(Process process, String name) {
        if (process == null || !process.isAlive()) {
            return;
        }
        if (Thread.currentThread().isInterrupted()) {
            process.destroyForcibly();
            return;
        }
        try {
            process.destroy();
            if (process.waitFor(ProcessTimeouts.TERMINATE_GRACE_PERIOD.toMillis(), TimeUnit.MILLISECONDS)) {
                return;
            }
            process.destroyForcibly();
            if (!process.waitFor(ProcessTimeouts.KILL_WAIT.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("{} still alive after forced kill", name);
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            LOG.warn("Could not terminate {}: {}", name, e.toString());
        }
    }

    private static ExternalProcessException failure(String msg, ExternalProcessException.Failure kind,
                                                    int exitCode, OutputCapture stderr, long startNanos,
                                                    Throwable cause) {
        String snippet = stderr == null ? "" : stderr.excerpt(ERROR_SNIPPET_MAX_CHARS);
        return new ExternalProcessException(msg, kind, exitCode, TimeUtils.elapsedMillis(startNanos), snippet,
                cause);
    }

    /**
     * Collects one process stream line by line up to a character cap. Past the cap the stream is
     * still read to the end so the process never blocks on a full pipe.
     */
    private static final class OutputCapture implements Runnable {

        private final InputStream source;
        private final String name;
        private final int cap;
        private final StringBuilder text = new StringBuilder();
        private Thread reader;
        private boolean truncated;

        private OutputCapture(InputStream source, String name, int cap) {
            this.source = source;
            this.name = name;
            this.cap = cap;
        }

        static OutputCapture start(InputStream source, String name, int cap) {
            OutputCapture capture = new OutputCapture(source, name, cap);
            capture.reader = new Thread(capture, name);
            capture.reader.setDaemon(true);
            capture.reader.start();
            return capture;
        }

        @Override
        public void run() {
            try (BufferedReader br = new BufferedReader(new InputStreamReader(source, StandardCharsets.UTF_8))) {
                String line;
                while ((line = br.readLine()) != null) {
                    append(line);
                }
            } catch (IOException e) {
                LOG.debug("Reader '{}' stopped: {}", name, e.toString());
            }
        }

        private synchronized void append(String line) {
            if (truncated) {
                return;
            }
            int room = cap - text.length() - (text.length() == 0 ? 0 : 1);
            if (room < 0) {
                markTruncated();
                return;
            }
            if (text.length() > 0) {
                text.append('\n');
            }
            if (line.length() > room) {
                text.append(line, 0, room);
                markTruncated();
            } else {
                text.append(line);
            }
        }

        private void markTruncated() {
            truncated = true;
            LOG.warn("Output of '{}' exceeded {} chars; the remainder is discarded", name, cap);
        }

        void await(Duration timeout) {
            try {
                reader.join(timeout.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        synchronized String text() {
            return text.toString();
        }

        synchronized String excerpt(int maxChars) {
            return text.substring(0, Math.min(maxChars, text.length()));
        }
    }
}
