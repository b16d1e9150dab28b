package com.cascade.core;

import com.cascade.dispatch.PatchRequest;

import java.util.List;

/**
 * Outcome of processing one trigger event.
 *
 * @param status   What happened
 * @param ruleName Name of the rule that fired, or null
 * @param patches  Patches sent
 * @param message  Human-readable summary
 */
public record TriggerResult(Status status, String ruleName, List<PatchRequest> patches, String message) {

    public enum Status {
        /** A rule fired and its updates were sent. */
        APPLIED,
        /** No rule matched; nothing was updated. */
        NO_MATCH,
        /** The event was not processed (missing item, no parent, unsupported parent type). */
        SKIPPED
    }

    public TriggerResult {
        patches = patches == null ? List.of() : List.copyOf(patches);
    }

    public static TriggerResult applied(String ruleName, List<PatchRequest> patches) {
        return new TriggerResult(Status.APPLIED, ruleName, patches,
                "Rule '" + ruleName + "' applied to " + patches.size() + " work items");
    }

    public static TriggerResult noMatch() {
        return new TriggerResult(Status.NO_MATCH, null, List.of(), "No rule matched");
    }

    public static TriggerResult skipped(String reason) {
        return new TriggerResult(Status.SKIPPED, null, List.of(), reason);
    }
}
