package com.phillippitts.hsie.util;

import java.time.Duration;

/**
 * Bounded waits used when supervising the whisper, diarizer and scorer subprocesses.
 */
public final class ProcessTimeouts {

    /** Wait for stdout/stderr readers to drain after the process exited normally. */
    public static final Duration OUTPUT_DRAIN_TIMEOUT = Duration.ofMillis(500);

    /** Wait for output readers after a failed run; the reader threads are daemons. */
    public static final Duration OUTPUT_ABANDON_TIMEOUT = Duration.ofMillis(100);

    /** Grace period after {@link Process#destroy()} before escalating to a forced kill. */
    public static final Duration TERMINATE_GRACE_PERIOD = Duration.ofMillis(500);

    /** Wait after {@link Process#destroyForcibly()}. */
    public static final Duration KILL_WAIT = Duration.ofMillis(1000);

    private ProcessTimeouts() {
    }
}
