package com.cascade.engine;

import com.cascade.action.ActionExecutor;
import com.cascade.action.DefaultActionExecutor;
import com.cascade.condition.ConditionEvaluator;
import com.cascade.condition.DefaultConditionEvaluator;
import com.cascade.model.Action;
import com.cascade.model.Rule;
import com.cascade.model.UpdateOperation;
import com.cascade.model.WorkItem;
import com.cascade.variable.EvaluationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Default implementation of RuleEngine.
 * At most one rule fires per trigger event: the first one, in declaration
 * order, whose conditions all hold.
 */
public class DefaultRuleEngine implements RuleEngine {

    private static final Logger log = LoggerFactory.getLogger(DefaultRuleEngine.class);

    private final ConditionEvaluator conditionEvaluator;
    private final ActionExecutor actionExecutor;

    public DefaultRuleEngine() {
        DefaultConditionEvaluator evaluator = new DefaultConditionEvaluator();
        this.conditionEvaluator = evaluator;
        this.actionExecutor = new DefaultActionExecutor(evaluator.getOperandResolver());
    }

    public DefaultRuleEngine(ConditionEvaluator conditionEvaluator, ActionExecutor actionExecutor) {
        this.conditionEvaluator = conditionEvaluator;
        this.actionExecutor = actionExecutor;
    }

    @Override
    public boolean evaluateRule(Rule rule, WorkItem triggering, WorkItem parent, List<WorkItem> children) {
        EvaluationContext context = EvaluationContext.of(triggering, parent, children);
        return conditionEvaluator.evaluateAll(rule.when(), context);
    }

    @Override
    public List<UpdateOperation> executeRule(Rule rule, WorkItem triggering, WorkItem parent, List<WorkItem> children) {
        EvaluationContext context = EvaluationContext.of(triggering, parent, children);
        List<UpdateOperation> operations = new ArrayList<>();
        for (Action action : rule.then()) {
            operations.addAll(actionExecutor.execute(action, context));
        }
        return operations;
    }

    @Override
    public EvaluationResult run(List<Rule> rules, WorkItem triggering, WorkItem parent, List<WorkItem> children) {
        for (Rule rule : rules) {
            log.debug("Evaluating rule '{}' for work item {}", rule.name(), triggering.id());
            if (evaluateRule(rule, triggering, parent, children)) {
                List<UpdateOperation> operations = executeRule(rule, triggering, parent, children);
                log.debug("Rule '{}' matched work item {}, {} operations",
                        rule.name(), triggering.id(), operations.size());
                return DefaultEvaluationResult.matched(rule, operations);
            }
        }
        log.debug("No rule matched work item {}", triggering.id());
        return DefaultEvaluationResult.unmatched(rules.size());
    }
}
