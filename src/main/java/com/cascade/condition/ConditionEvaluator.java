package com.cascade.condition;

import com.cascade.model.Condition;
import com.cascade.variable.EvaluationContext;

import java.util.List;

/**
 * Evaluates conditions against an item graph.
 */
public interface ConditionEvaluator {

    /**
     * Evaluate a single condition. Unresolved operands make it false.
     *
     * @param condition Condition to evaluate
     * @param context   Item graph with the current implicit item
     * @return true if the condition holds
     */
    boolean evaluate(Condition condition, EvaluationContext context);

    /**
     * Logical AND of all conditions, stopping at the first false one.
     * An empty list is true.
     */
    default boolean evaluateAll(List<Condition> conditions, EvaluationContext context) {
        for (Condition condition : conditions) {
            if (!evaluate(condition, context)) {
                return false;
            }
        }
        return true;
    }
}
