package com.cascade.dsl;

import java.util.Set;

/**
 * Keywords and symbols of the rule language.
 */
public final class DslConfig {

    private DslConfig() {
    }

    /**
     * Clause keywords.
     */
    public static final class Keywords {
        public static final String RULE = "rule";
        public static final String WHEN = "when";
        public static final String THEN = "then";
        public static final String WITH = "with";
        public static final String TO = "to";
        public static final String FROM = "from";

        private Keywords() {
        }
    }

    /**
     * Option words accepted after {@code with}.
     */
    public static final class Options {
        /** Send notifications: suppressNotifications=false */
        public static final String NOTIFICATIONS = "notifications";
        /** Explicitly suppress notifications: suppressNotifications=true */
        public static final String SUPPRESS_NOTIFICATIONS = "suppressNotifications";
        /** Bypass work item rules: bypassRules=true */
        public static final String BYPASS_RULES = "bypassRules";

        public static final Set<String> ALL = Set.of(NOTIFICATIONS, SUPPRESS_NOTIFICATIONS, BYPASS_RULES);

        private Options() {
        }
    }

    /**
     * Symbols.
     */
    public static final class Symbols {
        public static final String COMMENT = "#";
        public static final String CONDITION_SEPARATOR = " and ";
        public static final char QUOTE = '"';
        public static final char LEFT_PAREN = '(';
        public static final char RIGHT_PAREN = ')';
        public static final char ASSIGN = '=';
        public static final char DOT = '.';
        public static final char OPTION_SEPARATOR = ',';

        private Symbols() {
        }
    }
}
