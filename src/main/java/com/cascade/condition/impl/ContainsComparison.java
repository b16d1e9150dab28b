package com.cascade.condition.impl;

import com.cascade.condition.Comparison;
import com.cascade.model.Operator;

/**
 * Checks that the left value contains the right value.
 */
public class ContainsComparison implements Comparison {

    @Override
    public boolean test(String left, String right) {
        return left.contains(right);
    }

    @Override
    public Operator getOperator() {
        return Operator.CONTAINS;
    }

    @Override
    public String toString() {
        return getOperator().token();
    }
}
