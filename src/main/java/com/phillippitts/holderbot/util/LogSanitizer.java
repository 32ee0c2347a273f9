package com.phillippitts.holderbot.util;

/** Utility for privacy-safe logging of oracle rationales and subject values. */
public final class LogSanitizer {
    private LogSanitizer() {}

    /**
     * Single-line preview: line breaks collapsed to spaces, then truncated with an ellipsis
     * marker when something was cut.
     */
    public static String preview(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        String flat = s.replaceAll("[\\r\\n\\t]+", " ").strip();
        return flat.length() <= max ? flat : flat.substring(0, max) + "...";
    }
}
