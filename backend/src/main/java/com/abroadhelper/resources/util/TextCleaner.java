package com.abroadhelper.resources.util;

import java.util.regex.Pattern;

public final class TextCleaner {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextCleaner() {
    }

    /** Replaces non-breaking spaces and collapses whitespace runs. Blank input yields {@code null}. */
    public static String clean(String value) {
        if (value == null) {
            return null;
        }
        String cleaned = WHITESPACE.matcher(value.replace('\u00A0', ' ')).replaceAll(" ").trim();
        return cleaned.isEmpty() ? null : cleaned;
    }
}
