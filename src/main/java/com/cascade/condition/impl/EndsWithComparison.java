package com.cascade.condition.impl;

import com.cascade.condition.Comparison;
import com.cascade.model.Operator;

/**
 * Checks that the left value ends with the right value.
 */
public class EndsWithComparison implements Comparison {

    @Override
    public boolean test(String left, String right) {
        return left.endsWith(right);
    }

    @Override
    public Operator getOperator() {
        return Operator.ENDS_WITH;
    }

    @Override
    public String toString() {
        return getOperator().token();
    }
}
