package com.cascade.condition.impl;

import com.cascade.condition.Comparison;
import com.cascade.model.Operator;

/**
 * Negates another comparison.
 */
public class NotComparison implements Comparison {

    private final Comparison comparison;
    private final Operator operator;

    public NotComparison(Comparison comparison, Operator operator) {
        this.comparison = comparison;
        this.operator = operator;
    }

    @Override
    public boolean test(String left, String right) {
        return !comparison.test(left, right);
    }

    @Override
    public Operator getOperator() {
        return operator;
    }

    @Override
    public String toString() {
        return "NOT(" + comparison + ")";
    }
}
