package com.cascade.core;

import com.cascade.dispatch.PatchRequest;
import com.cascade.dispatch.UpdateDispatcher;
import com.cascade.dispatch.WorkItemGateway;
import com.cascade.engine.EvaluationResult;
import com.cascade.engine.RuleEngine;
import com.cascade.model.Rule;
import com.cascade.model.WorkItem;
import com.cascade.variable.FieldAliases;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Handles a work item change: loads the hierarchy around the item, runs the
 * rule book and sends the resulting updates.
 */
public class TriggerProcessor {

    private static final Logger log = LoggerFactory.getLogger(TriggerProcessor.class);

    private final List<Rule> rules;
    private final Set<String> parentTypes;
    private final RuleEngine ruleEngine;
    private final WorkItemGateway gateway;
    private final UpdateDispatcher dispatcher;

    /**
     * @param rules       Rule book in declaration order
     * @param parentTypes Parent work item types to act on; empty means any
     * @param ruleEngine  Engine evaluating the rules
     * @param gateway     Source of items
     * @param dispatcher  Sender of updates
     */
    public TriggerProcessor(List<Rule> rules, Set<String> parentTypes, RuleEngine ruleEngine,
                            WorkItemGateway gateway, UpdateDispatcher dispatcher) {
        this.rules = List.copyOf(rules);
        this.parentTypes = Set.copyOf(parentTypes);
        this.ruleEngine = ruleEngine;
        this.gateway = gateway;
        this.dispatcher = dispatcher;
    }

    /**
     * Process a change of the item at the given URL.
     */
    public TriggerResult process(String triggeringUrl) {
        Optional<WorkItem> triggering = gateway.getWorkItem(triggeringUrl);
        if (triggering.isEmpty()) {
            log.info("Triggering work item {} not found", triggeringUrl);
            return TriggerResult.skipped("Triggering work item " + triggeringUrl + " not found");
        }
        return process(triggering.get());
    }

    /**
     * Process a change of the given item.
     *
     * @param triggering Changed item, with relations
     * @return What was done
     */
    public TriggerResult process(WorkItem triggering) {
        Optional<WorkItem> parent = gateway.getParent(triggering);
        if (parent.isEmpty()) {
            log.info("No parent found for work item {}", triggering.id());
            return TriggerResult.skipped("Parent for work item " + triggering.id() + " not found");
        }

        String parentType = parent.get().field(FieldAliases.WORK_ITEM_TYPE).map(Object::toString).orElse(null);
        if (!parentTypes.isEmpty() && !parentTypes.contains(parentType)) {
            log.info("Parent work item {} is a '{}', nothing to do", parent.get().id(), parentType);
            return TriggerResult.skipped("Parent work item type '" + parentType + "' is not handled");
        }

        List<WorkItem> children = gateway.getChildren(parent.get());
        log.info("Triggered work item is {}, parent {} with {} child(ren)",
                triggering.id(), parent.get().id(), children.size());

        EvaluationResult result = ruleEngine.run(rules, triggering, parent.get(), children);
        if (!result.isMatched()) {
            log.info("No rule is applicable to work item {}", triggering.id());
            return TriggerResult.noMatch();
        }

        log.info("{}", result.getExplanation());
        List<PatchRequest> patches = dispatcher.dispatch(result.getOperations());
        return TriggerResult.applied(result.getMatchedRule().name(), patches);
    }
}
