package com.cascade.model;

import java.util.List;
import java.util.Objects;

/**
 * A named AND-of-conditions guard paired with an ordered list of actions.
 * Immutable once parsed.
 *
 * @param name Rule name from the header
 * @param when Conditions, implicitly AND-ed
 * @param then Actions, executed in order; never empty
 */
public record Rule(String name, List<Condition> when, List<Action> then) {

    public Rule {
        Objects.requireNonNull(name, "name");
        when = when == null ? List.of() : List.copyOf(when);
        then = then == null ? List.of() : List.copyOf(then);
        if (then.isEmpty()) {
            throw new IllegalArgumentException("Rule '" + name + "' must have at least one action");
        }
    }
}
