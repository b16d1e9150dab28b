package com.cascade.variable;

import java.util.Locale;
import java.util.Map;

/**
 * Maps rule field names to work item reference names.
 * Lookup ignores case; unknown names are used verbatim.
 */
public final class FieldAliases {

    public static final String ID = "System.Id";
    public static final String TITLE = "System.Title";
    public static final String STATE = "System.State";
    public static final String ASSIGNED_TO = "System.AssignedTo";
    public static final String TAGS = "System.Tags";
    public static final String REASON = "System.Reason";
    public static final String WORK_ITEM_TYPE = "System.WorkItemType";
    public static final String AREA_PATH = "System.AreaPath";
    public static final String TEAM_PROJECT = "System.TeamProject";
    public static final String ITERATION_PATH = "System.IterationPath";

    private static final String FIELDS_PATH = "/fields/";

    private static final Map<String, String> ALIASES = Map.of(
            "id", ID,
            "title", TITLE,
            "state", STATE,
            "assignedto", ASSIGNED_TO,
            "tags", TAGS,
            "reason", REASON,
            "workitemtype", WORK_ITEM_TYPE,
            "areapath", AREA_PATH,
            "teamproject", TEAM_PROJECT,
            "iterationpath", ITERATION_PATH
    );

    private FieldAliases() {
    }

    /**
     * Reference name for a rule field name.
     */
    public static String canonical(String field) {
        return ALIASES.getOrDefault(field.toLowerCase(Locale.ROOT), field);
    }

    /**
     * Whether the field is the work item identity rather than an attribute.
     */
    public static boolean isId(String field) {
        return ID.equals(canonical(field));
    }

    /**
     * Whether the field is the "; "-separated tag list.
     */
    public static boolean isTags(String field) {
        return TAGS.equals(canonical(field));
    }

    /**
     * JSON patch path for a field.
     */
    public static String patchPath(String field) {
        return FIELDS_PATH + canonical(field);
    }
}
