package com.cascade.dispatch;

import com.cascade.model.WorkItem;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Access to the remote work tracking system. Transport, authentication and
 * retries belong to the implementation.
 */
public interface WorkItemGateway {

    /**
     * Fetch a work item with its relations.
     *
     * @param url Work item URL
     * @return The item, or empty if it does not exist or could not be read
     */
    Optional<WorkItem> getWorkItem(String url);

    /**
     * Send one patch for one work item.
     *
     * @param request Operations and merged flags
     * @throws com.cascade.exception.DispatchException if the patch was not applied
     */
    void patch(PatchRequest request);

    /**
     * Fetch the parent of an item through its hierarchy link.
     */
    default Optional<WorkItem> getParent(WorkItem item) {
        return WorkItemHierarchy.parentUrl(item).flatMap(this::getWorkItem);
    }

    /**
     * Fetch the declared children of a parent item, skipping unreadable ones.
     */
    default List<WorkItem> getChildren(WorkItem parent) {
        List<WorkItem> children = new ArrayList<>();
        for (String url : WorkItemHierarchy.childUrls(parent)) {
            getWorkItem(url).ifPresent(children::add);
        }
        return children;
    }
}
