package com.phillippitts.hsie.service.process;

/**
 * Outcome of a completed external process with exit code 0.
 *
 * @param stdout     captured standard output (capped)
 * @param stderr     captured standard error (capped)
 * @param durationMs wall-clock time from start to exit
 */
public record ProcessResult(String stdout, String stderr, long durationMs) {
}
