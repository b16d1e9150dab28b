package com.cascade.condition.impl;

import com.cascade.condition.Comparison;
import com.cascade.model.Operator;

/**
 * Checks that the left value starts with the right value.
 */
public class StartsWithComparison implements Comparison {

    @Override
    public boolean test(String left, String right) {
        return left.startsWith(right);
    }

    @Override
    public Operator getOperator() {
        return Operator.STARTS_WITH;
    }

    @Override
    public String toString() {
        return getOperator().token();
    }
}
