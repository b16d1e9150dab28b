package com.cascade.model;

/**
 * Comparison operators of a condition.
 * <p>
 * Declaration order is the order the parser tries tokens in: a token that
 * contains another one (e.g. "not matches" and "matches", "is not" and "is")
 * must come first.
 */
public enum Operator {
    NOT_MATCHES("not matches"),
    STARTS_WITH("starts with"),
    ENDS_WITH("ends with"),
    MATCHES("matches"),
    CONTAINS("contains"),
    IS_NOT("is not"),
    IS("is");

    private final String token;

    Operator(String token) {
        this.token = token;
    }

    /**
     * The operator as written in rule text.
     */
    public String token() {
        return token;
    }

    @Override
    public String toString() {
        return token;
    }
}
