package com.cascade.dispatch;

import com.cascade.exception.DispatchException;
import com.cascade.model.UpdateOperation;
import com.cascade.model.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Gateway over an in-process item store. Patches replace the stored snapshot.
 * Used for local runs and tests.
 */
public class InMemoryWorkItemGateway implements WorkItemGateway {

    private static final Logger log = LoggerFactory.getLogger(InMemoryWorkItemGateway.class);

    private static final String FIELDS_PREFIX = "/fields/";

    private final Map<String, WorkItem> items = new ConcurrentHashMap<>();
    private final List<PatchRequest> patches = new CopyOnWriteArrayList<>();

    public InMemoryWorkItemGateway save(WorkItem item) {
        items.put(item.url(), item);
        return this;
    }

    @Override
    public Optional<WorkItem> getWorkItem(String url) {
        return Optional.ofNullable(items.get(url));
    }

    @Override
    public void patch(PatchRequest request) {
        WorkItem current = items.get(request.url());
        if (current == null) {
            throw new DispatchException("Work item not found: " + request.url());
        }
        log.debug("PATCH {} {} {}", request.url(), JsonPatchWriter.queryParameters(request),
                JsonPatchWriter.writeBody(request));

        Map<String, Object> fields = new LinkedHashMap<>(current.fields());
        for (UpdateOperation operation : request.operations()) {
            if (!operation.path().startsWith(FIELDS_PREFIX)) {
                throw new DispatchException("Unsupported patch path: " + operation.path());
            }
            fields.put(operation.path().substring(FIELDS_PREFIX.length()), operation.value());
        }
        items.put(request.url(), new WorkItem(current.id(), current.url(), fields, current.relations()));
        patches.add(request);
    }

    /**
     * Get the patches applied so far, in order.
     */
    public List<PatchRequest> getPatches() {
        return new ArrayList<>(patches);
    }
}
