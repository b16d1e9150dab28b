package com.cascade.dispatch;

import com.cascade.model.UpdateOperation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups operations by destination item and merges their flags.
 * <p>
 * Per item: notifications are sent if any operation explicitly asked for them
 * (suppressNotifications=false), otherwise suppressed; rules are bypassed if
 * any operation asked for it, otherwise enforced.
 */
public class DispatchBatcher {

    /**
     * Batch operations, one request per URL in first-seen order.
     *
     * @param operations Operations from the engine
     * @return One patch request per destination item
     */
    public List<PatchRequest> batch(List<UpdateOperation> operations) {
        Map<String, List<UpdateOperation>> grouped = new LinkedHashMap<>();
        for (UpdateOperation operation : operations) {
            grouped.computeIfAbsent(operation.url(), url -> new ArrayList<>()).add(operation);
        }

        List<PatchRequest> requests = new ArrayList<>(grouped.size());
        for (Map.Entry<String, List<UpdateOperation>> entry : grouped.entrySet()) {
            List<UpdateOperation> group = entry.getValue();
            boolean notify = group.stream()
                    .anyMatch(op -> Boolean.FALSE.equals(op.suppressNotifications()));
            boolean bypassRules = group.stream()
                    .anyMatch(op -> Boolean.TRUE.equals(op.bypassRules()));
            requests.add(new PatchRequest(entry.getKey(), !notify, bypassRules, group));
        }
        return requests;
    }
}
