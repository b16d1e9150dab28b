package com.cascade.variable;

import com.cascade.model.ObjectOperand;
import com.cascade.model.Operand;
import com.cascade.model.WorkItem;

import java.util.List;
import java.util.Optional;

/**
 * Resolves operands against an evaluation context.
 */
public interface OperandResolver {

    /**
     * Resolve an operand to a value.
     *
     * @param operand Literal or field reference
     * @param context Item graph and current implicit item
     * @return Resolved value, or empty if the item or field is missing
     */
    Optional<Object> resolve(Operand operand, EvaluationContext context);

    /**
     * Resolve the item an object operand reads from. For child and children
     * this is the first candidate passing the filter.
     *
     * @return The item, or empty if there is none
     */
    Optional<WorkItem> resolveItem(ObjectOperand operand, EvaluationContext context);

    /**
     * Resolve the items an action writes to. {@code children} selects every
     * candidate passing the filter (all of them without a filter); {@code child}
     * selects the first one.
     *
     * @return Target items, possibly empty
     */
    List<WorkItem> resolveTargets(ObjectOperand operand, EvaluationContext context);

    /**
     * Resolve an operand and coerce it to a string.
     */
    default Optional<String> resolveAsString(Operand operand, EvaluationContext context) {
        return resolve(operand, context).map(Values::asString);
    }
}
