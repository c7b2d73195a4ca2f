package com.phillippitts.hsie.util;

/** Utility for privacy-safe logging of transcript previews. */
public final class LogSanitizer {

    /** Default preview length for transcript text in DEBUG logs. */
    public static final int DEFAULT_PREVIEW_CHARS = 40;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Preview of transcript text with its total length, e.g. {@code "hello wo…" (42 chars)}.
     */
    public static String preview(String s) {
        if (s == null) {
            return "<none>";
        }
        String head = truncate(s, DEFAULT_PREVIEW_CHARS).replace('\n', ' ');
        String ellipsis = s.length() > DEFAULT_PREVIEW_CHARS ? "…" : "";
        return "\"" + head + ellipsis + "\" (" + s.length() + " chars)";
    }
}
