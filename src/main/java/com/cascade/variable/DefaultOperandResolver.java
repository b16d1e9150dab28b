package com.cascade.variable;

import com.cascade.condition.ConditionEvaluator;
import com.cascade.model.Condition;
import com.cascade.model.ConstOperand;
import com.cascade.model.ObjectOperand;
import com.cascade.model.Operand;
import com.cascade.model.WorkItem;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Default implementation of OperandResolver.
 * <p>
 * Candidate filters of child/children are evaluated with the candidate as the
 * implicit item, so unprefixed fields inside {@code child(...)} bind to the
 * child being tested.
 */
public class DefaultOperandResolver implements OperandResolver {

    private final ConditionEvaluator conditionEvaluator;

    public DefaultOperandResolver(ConditionEvaluator conditionEvaluator) {
        this.conditionEvaluator = conditionEvaluator;
    }

    @Override
    public Optional<Object> resolve(Operand operand, EvaluationContext context) {
        if (operand instanceof ConstOperand constant) {
            return Optional.of(constant.value());
        }
        if (operand instanceof ObjectOperand reference) {
            return resolveItem(reference, context)
                    .flatMap(item -> readField(item, reference.field()));
        }
        throw new IllegalArgumentException("Unsupported operand: " + operand);
    }

    @Override
    public Optional<WorkItem> resolveItem(ObjectOperand operand, EvaluationContext context) {
        return switch (operand.scope()) {
            case IMPLICIT -> Optional.of(context.implicitItem());
            case ME -> Optional.of(context.triggering());
            case PARENT -> context.findParent();
            case CHILD, CHILDREN -> findFirstMatch(operand.conditions(), context);
        };
    }

    @Override
    public List<WorkItem> resolveTargets(ObjectOperand operand, EvaluationContext context) {
        return switch (operand.scope()) {
            case IMPLICIT -> List.of(context.implicitItem());
            case ME -> List.of(context.triggering());
            case PARENT -> context.findParent().map(List::of).orElse(List.of());
            case CHILD -> findFirstMatch(operand.conditions(), context).map(List::of).orElse(List.of());
            case CHILDREN -> findAllMatches(operand.conditions(), context);
        };
    }

    /**
     * Read a field, mapping aliases. Id reads the item identity.
     */
    static Optional<Object> readField(WorkItem item, String field) {
        if (FieldAliases.isId(field)) {
            return Optional.of(item.id());
        }
        return item.field(FieldAliases.canonical(field));
    }

    private Optional<WorkItem> findFirstMatch(List<Condition> conditions, EvaluationContext context) {
        if (conditions.isEmpty()) {
            return context.children().stream().findFirst();
        }
        return context.children().stream()
                .filter(candidate -> accepts(candidate, conditions, context))
                .findFirst();
    }

    private List<WorkItem> findAllMatches(List<Condition> conditions, EvaluationContext context) {
        if (conditions.isEmpty()) {
            return context.children();
        }
        List<WorkItem> matches = new ArrayList<>();
        for (WorkItem candidate : context.children()) {
            if (accepts(candidate, conditions, context)) {
                matches.add(candidate);
            }
        }
        return matches;
    }

    private boolean accepts(WorkItem candidate, List<Condition> conditions, EvaluationContext context) {
        return conditionEvaluator.evaluateAll(conditions, context.withImplicit(candidate));
    }
}
