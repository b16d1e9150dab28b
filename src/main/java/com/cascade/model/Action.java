package com.cascade.model;

import java.util.Objects;

/**
 * One update step of a rule's then-clause.
 *
 * @param type    set, add or remove
 * @param options Notification / rule bypass flags
 * @param target  Assignable field reference
 * @param value   Value to assign, add or remove
 */
public record Action(ActionType type, AlterOptions options, ObjectOperand target, Operand value) {

    public Action {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(value, "value");
        options = options == null ? AlterOptions.defaults() : options;
    }

    @Override
    public String toString() {
        return switch (type) {
            case SET -> "set " + target + " = " + value;
            case ADD -> "add " + value + " to " + target;
            case REMOVE -> "remove " + value + " from " + target;
        };
    }
}
