package com.cascade.model;

import java.util.Objects;

/**
 * A single comparison between two operands.
 */
public record Condition(Operand left, Operator operator, Operand right) {

    public Condition {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public String toString() {
        return left + " " + operator.token() + " " + right;
    }
}
