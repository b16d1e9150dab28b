package com.cascade.engine;

import com.cascade.model.Rule;
import com.cascade.model.UpdateOperation;

import java.util.List;

/**
 * Result of running a rule book for one trigger event.
 */
public interface EvaluationResult {

    /**
     * Get the rule that fired. Null if no rule matched.
     */
    Rule getMatchedRule();

    /**
     * Get the operations produced by the matched rule. Empty if none matched.
     */
    List<UpdateOperation> getOperations();

    /**
     * Check if a rule fired.
     */
    boolean isMatched();

    /**
     * Get human-readable explanation of the outcome.
     */
    String getExplanation();
}
