package com.cascade.condition.impl;

import com.cascade.condition.Comparison;
import com.cascade.model.Operator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Checks that the right value, compiled as a regular expression, is found
 * anywhere in the left value (or, negated, is not found). Anchor with ^ and $
 * for a full match.
 * <p>
 * An invalid pattern fails the condition in both forms.
 */
public class RegexComparison implements Comparison {

    private static final Logger log = LoggerFactory.getLogger(RegexComparison.class);

    private final boolean negated;

    public RegexComparison() {
        this(false);
    }

    public RegexComparison(boolean negated) {
        this.negated = negated;
    }

    @Override
    public boolean test(String left, String right) {
        Pattern pattern;
        try {
            pattern = Pattern.compile(right);
        } catch (PatternSyntaxException e) {
            log.warn("Invalid regular expression '{}', condition evaluates to false: {}",
                    right, e.getDescription());
            return false;
        }
        return pattern.matcher(left).find() != negated;
    }

    @Override
    public Operator getOperator() {
        return negated ? Operator.NOT_MATCHES : Operator.MATCHES;
    }

    @Override
    public String toString() {
        return getOperator().token();
    }
}
