package com.cascade.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Snapshot of a work item. Never mutated by the engine; changes are only
 * described through {@link UpdateOperation}s.
 *
 * @param id        Numeric identity
 * @param url       API URL, the destination of patches
 * @param fields    Attribute map keyed by reference name (e.g. "System.State")
 * @param relations Outgoing links
 */
public record WorkItem(long id, String url, Map<String, Object> fields, List<Relation> relations) {

    public WorkItem {
        Objects.requireNonNull(url, "url");
        fields = fields == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        relations = relations == null ? List.of() : List.copyOf(relations);
    }

    public WorkItem(long id, String url, Map<String, Object> fields) {
        this(id, url, fields, List.of());
    }

    /**
     * Get a field value by reference name.
     */
    public Optional<Object> field(String key) {
        return Optional.ofNullable(fields.get(key));
    }
}
