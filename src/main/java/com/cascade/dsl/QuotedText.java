package com.cascade.dsl;

import java.util.ArrayList;
import java.util.List;

import static com.cascade.dsl.DslConfig.Symbols.*;

/**
 * Scanning helpers that ignore text inside double quotes and, where noted,
 * inside parentheses.
 */
public final class QuotedText {

    private QuotedText() {
    }

    /**
     * Split on a separator occurring outside quotes and outside parentheses.
     * Chunks are trimmed; a trailing blank chunk is dropped.
     */
    public static List<String> split(String text, String separator) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuotes = false;
        int depth = 0;
        int i = 0;

        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == QUOTE) {
                inQuotes = !inQuotes;
            } else if (!inQuotes && c == LEFT_PAREN) {
                depth++;
            } else if (!inQuotes && c == RIGHT_PAREN && depth > 0) {
                depth--;
            } else if (!inQuotes && depth == 0 && text.startsWith(separator, i)) {
                parts.add(current.toString().trim());
                current.setLength(0);
                i += separator.length();
                continue;
            }
            current.append(c);
            i++;
        }

        if (!current.toString().isBlank()) {
            parts.add(current.toString().trim());
        }
        return parts;
    }

    /**
     * Index of the first occurrence of a character outside quotes and
     * parentheses, or -1.
     */
    public static int indexOf(String text, char target) {
        boolean inQuotes = false;
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == QUOTE) {
                inQuotes = !inQuotes;
            } else if (!inQuotes && c == LEFT_PAREN) {
                depth++;
            } else if (!inQuotes && c == RIGHT_PAREN && depth > 0) {
                depth--;
            } else if (!inQuotes && depth == 0 && c == target) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Index of a whole word (whitespace before and after) occurring outside
     * quotes and parentheses, or -1.
     */
    public static int indexOfWord(String text, String word) {
        boolean inQuotes = false;
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == QUOTE) {
                inQuotes = !inQuotes;
            } else if (!inQuotes && c == LEFT_PAREN) {
                depth++;
            } else if (!inQuotes && c == RIGHT_PAREN && depth > 0) {
                depth--;
            } else if (!inQuotes && depth == 0 && i > 0
                    && Character.isWhitespace(text.charAt(i - 1))
                    && text.startsWith(word, i)
                    && i + word.length() < text.length()
                    && Character.isWhitespace(text.charAt(i + word.length()))) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Index of the parenthesis closing the one at {@code openIndex}, or -1 if
     * it is never closed.
     */
    public static int findClosingParen(String text, int openIndex) {
        boolean inQuotes = false;
        int depth = 0;
        for (int i = openIndex; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == QUOTE) {
                inQuotes = !inQuotes;
            } else if (!inQuotes && c == LEFT_PAREN) {
                depth++;
            } else if (!inQuotes && c == RIGHT_PAREN) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * Whether the whole text is a single double-quoted literal.
     */
    public static boolean isQuoted(String text) {
        return text.length() >= 2
                && text.charAt(0) == QUOTE
                && text.charAt(text.length() - 1) == QUOTE
                && text.indexOf(QUOTE, 1) == text.length() - 1;
    }

    /**
     * Strip the surrounding quotes of a literal.
     */
    public static String unquote(String text) {
        return text.substring(1, text.length() - 1);
    }
}
