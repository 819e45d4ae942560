package com.phillippitts.aibakeoff.util;

/**
 * Utility for log-safe previews of prompts, translations and provider response bodies.
 *
 * <p>Provider error bodies and translated text can be long and multi-line; previews are
 * collapsed to one line and capped so a single failure cannot flood the console.
 */
public final class LogSanitizer {

    /** Default preview length for text logged at DEBUG. */
    public static final int DEFAULT_PREVIEW_CHARS = 60;

    private LogSanitizer() {}

    /**
     * Collapses whitespace runs (including newlines) to single spaces and caps the result at
     * {@code max} characters, appending {@code "..."} when text was dropped.
     * Returns "" for null input or a non-positive {@code max}.
     */
    public static String preview(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        String oneLine = s.strip().replaceAll("\\s+", " ");
        if (oneLine.length() <= max) {
            return oneLine;
        }
        return oneLine.substring(0, max) + "...";
    }

    /**
     * Preview capped at {@link #DEFAULT_PREVIEW_CHARS}.
     */
    public static String preview(String s) {
        return preview(s, DEFAULT_PREVIEW_CHARS);
    }
}
