package com.cascade.model;

/**
 * Kinds of field updates an action can perform.
 */
public enum ActionType {
    SET("set"),
    ADD("add"),
    REMOVE("remove");

    private final String keyword;

    ActionType(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }
}
