package com.cascade.dsl;

/**
 * How the parser treats a condition or action chunk it cannot understand.
 */
public enum ParserMode {
    /** Raise a RuleSyntaxException. */
    STRICT,
    /** Drop the chunk and log a warning, as older rule books expect. */
    LENIENT
}
