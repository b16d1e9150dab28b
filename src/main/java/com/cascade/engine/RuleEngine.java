package com.cascade.engine;

import com.cascade.model.Rule;
import com.cascade.model.UpdateOperation;
import com.cascade.model.WorkItem;

import java.util.List;

/**
 * Evaluates rules against a work item hierarchy and produces update operations.
 * Implementations are stateless and may be called concurrently.
 */
public interface RuleEngine {

    /**
     * Check whether all conditions of a rule hold.
     *
     * @param rule       Rule to evaluate
     * @param triggering Item whose change triggered the evaluation
     * @param parent     Its parent, may be null
     * @param children   The parent's children
     * @return true if every condition holds
     */
    boolean evaluateRule(Rule rule, WorkItem triggering, WorkItem parent, List<WorkItem> children);

    /**
     * Execute the actions of a rule, in order, and concatenate their operations.
     * Conditions are not re-checked.
     *
     * @return Update operations in action order
     */
    List<UpdateOperation> executeRule(Rule rule, WorkItem triggering, WorkItem parent, List<WorkItem> children);

    /**
     * Evaluate rules in order and execute only the first one that holds.
     *
     * @param rules Rules in declaration order
     * @return Matched rule and its operations, or an unmatched result
     */
    EvaluationResult run(List<Rule> rules, WorkItem triggering, WorkItem parent, List<WorkItem> children);
}
