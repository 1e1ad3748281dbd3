package com.phillippitts.whisperwriter.util;

/** Privacy-safe previews of transcript text for DEBUG logs. */
public final class LogSanitizer {
    private LogSanitizer() {}

    /**
     * Truncate the input to at most max characters; returns "" for null or non-positive max.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }
}
