package com.cascade.action;

import com.cascade.model.Action;
import com.cascade.model.UpdateOperation;
import com.cascade.variable.EvaluationContext;

import java.util.List;

/**
 * Turns an action into the update operations it implies.
 */
public interface ActionExecutor {

    /**
     * Execute an action. Does not modify any work item.
     *
     * @param action  Action to execute
     * @param context Item graph
     * @return Zero or one operation per target item, in target order
     */
    List<UpdateOperation> execute(Action action, EvaluationContext context);
}
