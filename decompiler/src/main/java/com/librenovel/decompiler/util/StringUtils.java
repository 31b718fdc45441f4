package com.librenovel.decompiler.util;

import java.util.List;

/**
 * Utility methods for emitting string literals and joined clause lists.
 */
public final class StringUtils {

    private StringUtils() {}

    /**
     * Escape a string for use inside a double-quoted script literal.
     * Backslashes, quotes, newlines and tabs become escape sequences, and
     * doubled interpolation markers ([[ and {{) become \[ and \{, which the
     * script lexer reads back as the doubled form.
     *
     * @param s the string to escape (may be null)
     * @return escaped string, or empty string if input is null
     */
    public static String escapeString(String s) {
        if (s == null) return "";
        return s.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\t", "\\t")
                .replace("[[", "\\[")
                .replace("{{", "\\{");
    }

    /**
     * Quote and escape a string.
     */
    public static String quote(String s) {
        return "\"" + escapeString(s) + "\"";
    }

    /**
     * Join items with ", " as used by "at" and "behind" lists.
     */
    public static String joinList(List<String> items) {
        return String.join(", ", items);
    }

    /**
     * Language name of a translation, "None" for the default language.
     */
    public static String languageName(String language) {
        return language != null ? language : "None";
    }
}
