package com.apitools.service.impl;

import java.util.regex.Pattern;

/**
 * Identifier and text normalization for compiled tools.
 */
final class ToolNames {

    private static final String LIST_SUFFIX = "[]";
    private static final Pattern UPPER_CASE = Pattern.compile("(?<=.)([A-Z])");
    private static final Pattern NON_IDENTIFIER = Pattern.compile("[^a-z0-9_]");
    private static final Pattern REPEATED_UNDERSCORES = Pattern.compile("_+");

    private ToolNames() {
    }

    /**
     * Converts a raw name into a snake_case identifier. A trailing {@code []} marks a list
     * parameter and pluralizes the name: {@code expand[]} becomes {@code expands}.
     */
    static String normalize(String raw) {
        if (raw.endsWith(LIST_SUFFIX)) {
            return identifier(raw.substring(0, raw.length() - LIST_SUFFIX.length())) + "s";
        }
        return identifier(raw);
    }

    /**
     * The key two parameter names collide on: {@code foo} and {@code foo[]} share one.
     */
    static String dedupKey(String raw) {
        String base = raw.endsWith(LIST_SUFFIX) ? raw.substring(0, raw.length() - LIST_SUFFIX.length()) : raw;
        return identifier(base);
    }

    static boolean isListName(String raw) {
        return raw.endsWith(LIST_SUFFIX);
    }

    private static String identifier(String raw) {
        String snake = UPPER_CASE.matcher(raw).replaceAll("_$1").toLowerCase();
        String cleaned = REPEATED_UNDERSCORES.matcher(NON_IDENTIFIER.matcher(snake).replaceAll("_")).replaceAll("_");
        int start = 0;
        int end = cleaned.length();
        while (start < end && cleaned.charAt(start) == '_') {
            start++;
        }
        while (end > start && cleaned.charAt(end - 1) == '_') {
            end--;
        }
        return cleaned.substring(start, end);
    }

    /**
     * Collapses line breaks into spaces and replaces double and typographic quotes with a single quote.
     */
    static String sanitize(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("\r\n", " ")
                .replace('\n', ' ')
                .replace('\r', ' ')
                .replace('"', '\'')
                .replace('“', '\'')
                .replace('”', '\'')
                .replace('‘', '\'')
                .replace('’', '\'')
                .trim();
    }
}
