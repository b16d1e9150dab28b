package com.cascade.dispatch;

import com.cascade.exception.DispatchException;
import com.cascade.model.UpdateOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Batches operations per work item and sends one patch per item.
 */
public class UpdateDispatcher {

    private static final Logger log = LoggerFactory.getLogger(UpdateDispatcher.class);

    private final WorkItemGateway gateway;
    private final DispatchBatcher batcher;

    public UpdateDispatcher(WorkItemGateway gateway, DispatchBatcher batcher) {
        this.gateway = gateway;
        this.batcher = batcher;
    }

    /**
     * Send the operations. Every item is attempted even if an earlier one fails.
     *
     * @param operations Operations from the engine
     * @return The requests that were sent
     * @throws DispatchException if any patch failed; failures are suppressed on it
     */
    public List<PatchRequest> dispatch(List<UpdateOperation> operations) {
        if (operations.isEmpty()) {
            log.info("There are no operations to perform");
            return List.of();
        }

        List<PatchRequest> requests = batcher.batch(operations);
        List<PatchRequest> sent = new ArrayList<>();
        List<RuntimeException> failures = new ArrayList<>();

        for (PatchRequest request : requests) {
            log.info("Sending {} operations to {} (suppressNotifications={}, bypassRules={})",
                    request.operations().size(), request.url(),
                    request.suppressNotifications(), request.bypassRules());
            try {
                gateway.patch(request);
                sent.add(request);
            } catch (RuntimeException e) {
                log.warn("Failed to update {}: {}", request.url(), e.getMessage());
                failures.add(e);
            }
        }

        if (!failures.isEmpty()) {
            DispatchException exception = new DispatchException(
                    failures.size() + " of " + requests.size() + " work item updates failed");
            failures.forEach(exception::addSuppressed);
            throw exception;
        }
        return sent;
    }
}
