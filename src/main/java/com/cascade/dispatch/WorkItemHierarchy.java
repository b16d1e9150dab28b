package com.cascade.dispatch;

import com.cascade.model.Relation;
import com.cascade.model.WorkItem;

import java.util.List;
import java.util.Optional;

/**
 * Reads parent/child links from a work item's relations.
 */
public final class WorkItemHierarchy {

    public static final String PARENT_REL = "System.LinkTypes.Hierarchy-Reverse";
    public static final String CHILD_REL = "System.LinkTypes.Hierarchy-Forward";
    public static final String PARENT_NAME = "Parent";
    public static final String CHILD_NAME = "Child";

    private WorkItemHierarchy() {
    }

    /**
     * URL of the parent item, if linked.
     */
    public static Optional<String> parentUrl(WorkItem item) {
        return item.relations().stream()
                .filter(relation -> PARENT_REL.equals(relation.rel()) && PARENT_NAME.equals(relation.name()))
                .map(Relation::url)
                .findFirst();
    }

    /**
     * URLs of the child items, in link order.
     */
    public static List<String> childUrls(WorkItem item) {
        return item.relations().stream()
                .filter(relation -> CHILD_REL.equals(relation.rel()) && CHILD_NAME.equals(relation.name()))
                .map(Relation::url)
                .toList();
    }
}
