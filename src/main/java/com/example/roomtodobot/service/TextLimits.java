package com.example.roomtodobot.service;

import java.util.ArrayList;
import java.util.List;

/**
 * Length limits of outgoing Telegram texts. Lengths are counted in UTF-16 units, the way Telegram
 * counts them, and cuts never fall inside a surrogate pair.
 */
public final class TextLimits {

    public static final int MESSAGE_LENGTH = 4096;
    public static final int TASK_ECHO_LENGTH = 200;

    private static final String ELLIPSIS = "…";

    private TextLimits() {
    }

    /**
     * Cuts the text to at most {@code maxLength} units, ending with an ellipsis when something was cut
     */
    public static String shorten(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) return text;
        return text.substring(0, safeCut(text, maxLength - ELLIPSIS.length())) + ELLIPSIS;
    }

    /**
     * Splits a long text into parts of at most {@code limit} units, preferring line breaks
     */
    public static List<String> split(String text, int limit) {
        List<String> parts = new ArrayList<>();
        String rest = text;
        while (rest.length() > limit) {
            int cut = rest.lastIndexOf('\n', limit - 1) + 1;
            if (cut <= 0) cut = safeCut(rest, limit);
            parts.add(rest.substring(0, cut));
            rest = rest.substring(cut);
        }
        if (!rest.isEmpty() || parts.isEmpty()) parts.add(rest);
        return parts;
    }

    private static int safeCut(String text, int end) {
        if (end > 0 && Character.isHighSurrogate(text.charAt(end - 1))) return end - 1;
        return end;
    }
}
