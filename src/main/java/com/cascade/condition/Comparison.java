package com.cascade.condition;

import com.cascade.model.Operator;

/**
 * String comparison behind a condition operator.
 */
public interface Comparison {

    /**
     * Compare two resolved operand values.
     *
     * @param left  Left operand as text
     * @param right Right operand as text
     * @return true if the comparison holds
     */
    boolean test(String left, String right);

    /**
     * Get the operator this comparison implements.
     */
    Operator getOperator();
}
