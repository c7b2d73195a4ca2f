package com.phillippitts.hsie.util;

/**
 * Stage and subprocess timing based on {@link System#nanoTime()}.
 */
public final class TimeUtils {

    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
    }

    /**
     * @param startNanos a {@link System#nanoTime()} reading
     * @return whole milliseconds elapsed since {@code startNanos}
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }
}
