package com.cascade.exception;

/**
 * Exception thrown when rule text cannot be parsed.
 * Aborts parsing of the whole rule book.
 */
public class RuleSyntaxException extends CascadeException {

    private final int line;
    private final String text;

    public RuleSyntaxException(String reason, int line, String text) {
        super("Invalid rule syntax at line " + line + ": " + reason + " in '" + text + "'");
        this.line = line;
        this.text = text;
    }

    /**
     * 1-based line number of the offending text in the rule source.
     */
    public int getLine() {
        return line;
    }

    /**
     * The offending line or chunk.
     */
    public String getText() {
        return text;
    }
}
