package com.cascade.model;

import java.util.Objects;

/**
 * Quoted literal operand.
 *
 * @param value Literal text without the surrounding quotes
 */
public record ConstOperand(String value) implements Operand {

    public ConstOperand {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public String toString() {
        return "\"" + value + "\"";
    }
}
