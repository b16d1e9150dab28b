package com.cascade.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Selects which work item(s) an object operand refers to.
 */
public enum Scope {
    /** Unprefixed field: the triggering item, or the candidate under test inside child(...) */
    IMPLICIT(null),
    ME("me"),
    PARENT("parent"),
    CHILD("child"),
    CHILDREN("children");

    private final String keyword;

    Scope(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public static Optional<Scope> fromKeyword(String keyword) {
        return Arrays.stream(values())
                .filter(scope -> scope.keyword != null && scope.keyword.equals(keyword))
                .findFirst();
    }
}
