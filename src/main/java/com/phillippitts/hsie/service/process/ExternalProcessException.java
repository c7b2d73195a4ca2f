package com.phillippitts.hsie.service.process;

/**
 * Failure of an external collaborator process. Checked, so that every caller translates it into
 * its own taxonomy (transcription failure, analysis failure marker, ...).
 */
public class ExternalProcessException extends Exception {

    public enum Failure { TIMEOUT, NON_ZERO_EXIT, IO_ERROR, INTERRUPTED }

    private final Failure failure;
    private final int exitCode;
    private final long durationMs;
    private final String stderrSnippet;

    public ExternalProcessException(String message, Failure failure, int exitCode, long durationMs,
                                    String stderrSnippet, Throwable cause) {
        super(message, cause);
        this.failure = failure;
        this.exitCode = exitCode;
        this.durationMs = durationMs;
        this.stderrSnippet = stderrSnippet == null ? "" : stderrSnippet;
    }

    public Failure getFailure() {
        return failure;
    }

    /**
     * @return process exit code, or -1 when the process did not exit on its own
     */
    public int getExitCode() {
        return exitCode;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public String getStderrSnippet() {
        return stderrSnippet;
    }
}
