package com.cascade.dsl;

import java.util.ArrayList;
import java.util.List;

import static com.cascade.dsl.DslConfig.Symbols.COMMENT;

/**
 * A trimmed, non-blank, non-comment line of rule text.
 *
 * @param number 1-based line number in the original text
 * @param text   Trimmed content
 */
public record SourceLine(int number, String text) {

    /**
     * Split rule text into significant lines, keeping declaration order.
     */
    public static List<SourceLine> read(String text) {
        List<SourceLine> lines = new ArrayList<>();
        if (text == null) {
            return lines;
        }
        String[] raw = text.split("\\R", -1);
        for (int i = 0; i < raw.length; i++) {
            String trimmed = raw[i].trim();
            if (trimmed.isEmpty() || trimmed.startsWith(COMMENT)) {
                continue;
            }
            lines.add(new SourceLine(i + 1, trimmed));
        }
        return lines;
    }

    /**
     * Whether this line starts with the given keyword as a whole word.
     */
    public boolean startsWithKeyword(String keyword) {
        if (!text.startsWith(keyword)) {
            return false;
        }
        return text.length() == keyword.length()
                || Character.isWhitespace(text.charAt(keyword.length()));
    }

    /**
     * The text after a leading keyword, trimmed.
     */
    public String afterKeyword(String keyword) {
        return text.substring(keyword.length()).trim();
    }
}
