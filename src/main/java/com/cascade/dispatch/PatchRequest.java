package com.cascade.dispatch;

import com.cascade.model.UpdateOperation;

import java.util.List;
import java.util.Objects;

/**
 * All operations for one work item, sent as a single patch.
 *
 * @param url                   Work item URL
 * @param suppressNotifications Merged notification flag
 * @param bypassRules           Merged rule bypass flag
 * @param operations            Operations in production order
 */
public record PatchRequest(
        String url,
        boolean suppressNotifications,
        boolean bypassRules,
        List<UpdateOperation> operations
) {
    public PatchRequest {
        Objects.requireNonNull(url, "url");
        operations = List.copyOf(operations);
    }
}
