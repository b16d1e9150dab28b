package com.cascade.core;

import com.cascade.model.IdentityRef;
import com.cascade.model.Relation;
import com.cascade.model.WorkItem;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Factory for creating WorkItem snapshots from work item JSON.
 * <p>
 * Expected shape:
 * <pre>
 * {"id": 123, "url": "...",
 *  "fields": {"System.Title": "...", "System.AssignedTo": {"displayName": "...", "uniqueName": "..."}},
 *  "relations": [{"rel": "System.LinkTypes.Hierarchy-Reverse", "url": "...", "attributes": {"name": "Parent"}}]}
 * </pre>
 * Identity objects (anything with a uniqueName) become {@link IdentityRef}s.
 */
public class WorkItemFactory {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private WorkItemFactory() {
    }

    /**
     * Create a WorkItem from a JSON document.
     *
     * @param json Work item JSON
     * @return Snapshot of the item
     */
    public static WorkItem fromJson(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("Work item JSON is empty");
        }
        try {
            return fromMap(objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {}));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid work item JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Create a WorkItem from already parsed JSON.
     */
    @SuppressWarnings("unchecked")
    public static WorkItem fromMap(Map<String, Object> map) {
        Object id = map.get("id");
        if (!(id instanceof Number number)) {
            throw new IllegalArgumentException("Work item JSON requires a numeric 'id'");
        }
        Object url = map.get("url");
        if (url == null) {
            throw new IllegalArgumentException("Work item JSON requires a 'url'");
        }

        Map<String, Object> fields = new LinkedHashMap<>();
        Object rawFields = map.get("fields");
        if (rawFields instanceof Map<?, ?> fieldMap) {
            for (Map.Entry<?, ?> entry : fieldMap.entrySet()) {
                fields.put(String.valueOf(entry.getKey()), convertValue(entry.getValue()));
            }
        }

        List<Relation> relations = new ArrayList<>();
        Object rawRelations = map.get("relations");
        if (rawRelations instanceof List<?> relationList) {
            for (Object raw : relationList) {
                if (raw instanceof Map<?, ?> relation) {
                    relations.add(new Relation(
                            (String) relation.get("rel"),
                            (String) relation.get("url"),
                            (Map<String, Object>) relation.get("attributes")));
                }
            }
        }

        return new WorkItem(number.longValue(), url.toString(), fields, relations);
    }

    private static Object convertValue(Object value) {
        if (value instanceof Map<?, ?> map && map.containsKey("uniqueName")) {
            Object displayName = map.get("displayName");
            return new IdentityRef(
                    displayName == null ? null : displayName.toString(),
                    String.valueOf(map.get("uniqueName")));
        }
        return value;
    }
}
