package com.cascade.engine;

import com.cascade.model.Rule;
import com.cascade.model.UpdateOperation;

import java.util.List;

/**
 * Default implementation of EvaluationResult.
 */
public class DefaultEvaluationResult implements EvaluationResult {

    private final Rule matchedRule;
    private final List<UpdateOperation> operations;
    private final String explanation;

    private DefaultEvaluationResult(Rule matchedRule, List<UpdateOperation> operations, String explanation) {
        this.matchedRule = matchedRule;
        this.operations = List.copyOf(operations);
        this.explanation = explanation;
    }

    @Override
    public Rule getMatchedRule() {
        return matchedRule;
    }

    @Override
    public List<UpdateOperation> getOperations() {
        return operations;
    }

    @Override
    public boolean isMatched() {
        return matchedRule != null;
    }

    @Override
    public String getExplanation() {
        return explanation;
    }

    @Override
    public String toString() {
        return "EvaluationResult{" +
                "matched=" + isMatched() +
                ", rule=" + (matchedRule != null ? matchedRule.name() : "none") +
                ", operations=" + operations.size() +
                '}';
    }

    /**
     * Create a result for a rule that fired.
     */
    public static EvaluationResult matched(Rule rule, List<UpdateOperation> operations) {
        String explanation = "Matched rule: " + rule.name() + " | Operations: " + operations.size();
        return new DefaultEvaluationResult(rule, operations, explanation);
    }

    /**
     * Create a result for an event no rule applied to.
     */
    public static EvaluationResult unmatched(int evaluated) {
        String explanation = "No rule matched (" + evaluated + " evaluated)";
        return new DefaultEvaluationResult(null, List.of(), explanation);
    }
}
