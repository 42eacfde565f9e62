package com.jreinhal.cafefinder.util;

import java.util.regex.Pattern;

/**
 * Keeps user-supplied text out of log lines, or strips it down to something safe to log.
 */
public final class LogSanitizer {
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");
    private static final int MAX_LOGGED_LENGTH = 120;

    private LogSanitizer() {
    }

    /**
     * Length and hash of a query, so repeated queries can be correlated without logging their text.
     */
    public static String querySummary(String query) {
        if (query == null) {
            return "[len=0,id=none]";
        }
        return "[len=" + query.length() + ",id=" + Integer.toHexString(query.hashCode()) + "]";
    }

    /**
     * Strips control characters and line breaks so a value cannot forge log lines; long values are cut.
     */
    public static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        String cleaned = CONTROL_CHARS.matcher(value).replaceAll("")
                .replace("\r", "")
                .replace("\n", " ")
                .replace("\t", " ");
        return cleaned.length() > MAX_LOGGED_LENGTH ? cleaned.substring(0, MAX_LOGGED_LENGTH) + "..." : cleaned;
    }
}
