package com.phillippitts.callqa.util;

/** Utility for compact, single-line previews of finding text in logs. */
public final class LogSanitizer {
    private static final String ELLIPSIS = "...";

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Collapse whitespace (including line breaks) to single spaces and truncate, appending "..."
     * when the text was cut.
     */
    public static String preview(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        String flat = s.replaceAll("\\s+", " ").trim();
        if (flat.length() <= max) {
            return flat;
        }
        return max <= ELLIPSIS.length() ? truncate(flat, max) : truncate(flat, max - ELLIPSIS.length()) + ELLIPSIS;
    }
}
