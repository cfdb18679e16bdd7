package com.phillippitts.interviewengine.util;

/** Utility for privacy-safe logging of utterance and response previews. */
public final class LogSanitizer {

    private static final String ELLIPSIS = "...";

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
     * Like {@link #truncate(String, int)} but marks a cut with a trailing ellipsis, keeping the
     * total length within {@code max}. Used for thread titles and log previews.
     */
    public static String abbreviate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        if (s.length() <= max) {
            return s;
        }
        if (max <= ELLIPSIS.length()) {
            return s.substring(0, max);
        }
        return s.substring(0, max - ELLIPSIS.length()) + ELLIPSIS;
    }

    /**
     * Redacts all but the last four characters of a secret-bearing value (auth tokens, relay
     * credentials). Returns "" for null and "****" for values of four characters or fewer.
     */
    public static String mask(String secret) {
        if (secret == null) {
            return "";
        }
        if (secret.length() <= 4) {
            return "****";
        }
        return "****" + secret.substring(secret.length() - 4);
    }
}
