package com.cascade.condition;

import com.cascade.condition.impl.*;
import com.cascade.model.Condition;
import com.cascade.model.Operator;
import com.cascade.variable.DefaultOperandResolver;
import com.cascade.variable.EvaluationContext;
import com.cascade.variable.OperandResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Default implementation of ConditionEvaluator.
 * Owns the operand resolver it uses, since resolving child(...) operands
 * needs to evaluate conditions in turn.
 */
public class DefaultConditionEvaluator implements ConditionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(DefaultConditionEvaluator.class);

    private final OperandResolver operandResolver;
    private final Map<Operator, Comparison> comparisons;

    public DefaultConditionEvaluator() {
        this.operandResolver = new DefaultOperandResolver(this);
        this.comparisons = createComparisons();
    }

    @Override
    public boolean evaluate(Condition condition, EvaluationContext context) {
        Optional<String> left = operandResolver.resolveAsString(condition.left(), context);
        if (left.isEmpty()) {
            log.debug("Condition [{}] is false: left operand unresolved", condition);
            return false;
        }
        Optional<String> right = operandResolver.resolveAsString(condition.right(), context);
        if (right.isEmpty()) {
            log.debug("Condition [{}] is false: right operand unresolved", condition);
            return false;
        }

        boolean result = comparisons.get(condition.operator()).test(left.get(), right.get());
        log.trace("Condition [{}] on '{}' / '{}' -> {}", condition, left.get(), right.get(), result);
        return result;
    }

    /**
     * Get the operand resolver bound to this evaluator.
     */
    public OperandResolver getOperandResolver() {
        return operandResolver;
    }

    private static Map<Operator, Comparison> createComparisons() {
        Map<Operator, Comparison> map = new EnumMap<>(Operator.class);
        for (Operator operator : Operator.values()) {
            map.put(operator, switch (operator) {
                case MATCHES -> new RegexComparison();
                case NOT_MATCHES -> new RegexComparison(true);
                case CONTAINS -> new ContainsComparison();
                case STARTS_WITH -> new StartsWithComparison();
                case ENDS_WITH -> new EndsWithComparison();
                case IS -> new EqualsComparison();
                case IS_NOT -> new NotComparison(new EqualsComparison(), Operator.IS_NOT);
            });
        }
        return map;
    }
}
