package com.cascade.variable;

import com.cascade.model.WorkItem;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The item graph a rule is evaluated against.
 * <p>
 * The implicit item is what an unprefixed field binds to: the triggering item
 * at top level, the candidate under test inside a child(...) filter. Immutable;
 * rebinding produces a new context.
 *
 * @param implicitItem Item unprefixed fields resolve against
 * @param triggering   Item whose change caused the evaluation
 * @param parent       Parent of the triggering item, may be null
 * @param children     Children of the parent (candidates for child/children)
 */
public record EvaluationContext(
        WorkItem implicitItem,
        WorkItem triggering,
        WorkItem parent,
        List<WorkItem> children
) {
    public EvaluationContext {
        Objects.requireNonNull(triggering, "triggering");
        implicitItem = implicitItem == null ? triggering : implicitItem;
        children = children == null ? List.of() : List.copyOf(children);
    }

    /**
     * Create a top-level context where the implicit item is the triggering item.
     */
    public static EvaluationContext of(WorkItem triggering, WorkItem parent, List<WorkItem> children) {
        return new EvaluationContext(triggering, triggering, parent, children);
    }

    /**
     * Same graph, with unprefixed fields bound to the given candidate.
     */
    public EvaluationContext withImplicit(WorkItem candidate) {
        return new EvaluationContext(candidate, triggering, parent, children);
    }

    public Optional<WorkItem> findParent() {
        return Optional.ofNullable(parent);
    }
}
