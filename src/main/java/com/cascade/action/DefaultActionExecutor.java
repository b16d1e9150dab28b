package com.cascade.action;

import com.cascade.model.Action;
import com.cascade.model.UpdateOperation;
import com.cascade.model.WorkItem;
import com.cascade.variable.EvaluationContext;
import com.cascade.variable.FieldAliases;
import com.cascade.variable.OperandResolver;
import com.cascade.variable.Values;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Default implementation of ActionExecutor.
 * <ul>
 *   <li>set: replace the field with the value</li>
 *   <li>add: on Tags, append the value unless already present; elsewhere same as set</li>
 *   <li>remove: on Tags, replace with the list minus the value (always emitted);
 *       elsewhere nothing</li>
 * </ul>
 */
public class DefaultActionExecutor implements ActionExecutor {

    private static final Logger log = LoggerFactory.getLogger(DefaultActionExecutor.class);

    private final OperandResolver operandResolver;

    public DefaultActionExecutor(OperandResolver operandResolver) {
        this.operandResolver = operandResolver;
    }

    @Override
    public List<UpdateOperation> execute(Action action, EvaluationContext context) {
        List<WorkItem> targets = operandResolver.resolveTargets(action.target(), context);
        Optional<String> resolved = operandResolver.resolveAsString(action.value(), context);
        if (resolved.isEmpty()) {
            log.debug("Action [{}] skipped: value unresolved", action);
            return List.of();
        }

        String value = resolved.get();
        String field = action.target().field();
        String path = FieldAliases.patchPath(field);
        boolean tags = FieldAliases.isTags(field);

        List<UpdateOperation> operations = new ArrayList<>();
        for (WorkItem target : targets) {
            Optional<String> newValue = switch (action.type()) {
                case SET -> Optional.of(value);
                case ADD -> tags ? addTag(target, value) : Optional.of(value);
                case REMOVE -> tags ? removeTag(target, value) : Optional.empty();
            };
            newValue.ifPresent(v -> operations.add(
                    UpdateOperation.replace(target.url(), action.options(), path, v)));
        }

        log.debug("Action [{}] produced {} operations for {} targets", action, operations.size(), targets.size());
        return operations;
    }

    private Optional<String> addTag(WorkItem target, String tag) {
        List<String> current = currentTags(target);
        if (current.contains(tag)) {
            return Optional.empty();
        }
        current.add(tag);
        return Optional.of(TagList.join(current));
    }

    private Optional<String> removeTag(WorkItem target, String tag) {
        List<String> current = currentTags(target);
        current.removeIf(tag::equals);
        return Optional.of(TagList.join(current));
    }

    private List<String> currentTags(WorkItem target) {
        return TagList.parse(target.field(FieldAliases.TAGS).map(Values::asString).orElse(null));
    }
}
