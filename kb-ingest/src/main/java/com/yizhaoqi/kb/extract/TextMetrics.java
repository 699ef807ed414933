package com.yizhaoqi.kb.extract;

import java.util.regex.Pattern;

final class TextMetrics {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextMetrics() {
    }

    /**
     * Number of whitespace-separated tokens; 0 for null or blank text.
     */
    static int wordCount(String text) {
        if (text == null) {
            return 0;
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return 0;
        }
        return WHITESPACE.split(trimmed).length;
    }
}
