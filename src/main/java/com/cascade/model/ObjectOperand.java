package com.cascade.model;

import java.util.List;
import java.util.Objects;

/**
 * Reference to a field of one or more work items.
 *
 * @param scope      Which item(s) the field is read from or written to
 * @param field      Field name as written (alias or raw attribute key)
 * @param conditions Candidate filter for child/children scopes; empty when absent
 */
public record ObjectOperand(Scope scope, String field, List<Condition> conditions) implements Operand {

    public ObjectOperand {
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(field, "field");
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    public ObjectOperand(Scope scope, String field) {
        this(scope, field, List.of());
    }

    public boolean hasConditions() {
        return !conditions.isEmpty();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (scope != Scope.IMPLICIT) {
            sb.append(scope.keyword());
            if (hasConditions()) {
                sb.append('(').append(conditions).append(')');
            }
            sb.append('.');
        }
        return sb.append(field).toString();
    }
}
