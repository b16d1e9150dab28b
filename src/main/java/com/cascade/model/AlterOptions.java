package com.cascade.model;

/**
 * Side-effect flags attached to an action and carried by the operations it emits.
 * A null flag means "not specified" and falls back to the dispatch default
 * (notifications suppressed, rules enforced).
 *
 * @param suppressNotifications false when the action asked for notifications
 * @param bypassRules           true when the action asked to bypass work item rules
 */
public record AlterOptions(Boolean suppressNotifications, Boolean bypassRules) {

    private static final AlterOptions DEFAULTS = new AlterOptions(null, null);

    public static AlterOptions defaults() {
        return DEFAULTS;
    }
}
