package com.cascade.condition.impl;

import com.cascade.condition.Comparison;
import com.cascade.model.Operator;

/**
 * Checks that the left value is exactly equal to the right value.
 */
public class EqualsComparison implements Comparison {

    @Override
    public boolean test(String left, String right) {
        return left.equals(right);
    }

    @Override
    public Operator getOperator() {
        return Operator.IS;
    }

    @Override
    public String toString() {
        return getOperator().token();
    }
}
