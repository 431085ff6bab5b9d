package com.phillippitts.voiceanalysis.util;

import java.nio.file.Path;

/** Utility for privacy-safe logging of user titles and file locations. */
public final class LogSanitizer {

    /** Longest title preview written to logs. */
    public static final int TITLE_PREVIEW_CHARS = 40;

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

    public static String title(String title) {
        return truncate(title, TITLE_PREVIEW_CHARS);
    }

    /** File name only, so home directories and user names stay out of logs. */
    public static String fileName(Path path) {
        if (path == null) {
            return "";
        }
        Path name = path.getFileName();
        return name == null ? "" : name.toString();
    }
}
