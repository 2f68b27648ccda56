package com.library.management.service;

import java.util.Locale;

/** Builds case-insensitive substring patterns for {@code LIKE} filters. */
public final class SearchPatterns {

    public static final char ESCAPE = '\\';

    private SearchPatterns() {}

    /**
     * Lower-cases and trims {@code raw}, escapes {@code %}, {@code _} and the escape character,
     * and wraps the result in {@code %}. Use together with {@link #ESCAPE}.
     */
    public static String containing(String raw) {
        String term = raw.trim().toLowerCase(Locale.ROOT);
        StringBuilder pattern = new StringBuilder(term.length() + 2).append('%');
        for (char c : term.toCharArray()) {
            if (c == ESCAPE || c == '%' || c == '_') {
                pattern.append(ESCAPE);
            }
            pattern.append(c);
        }
        return pattern.append('%').toString();
    }
}
