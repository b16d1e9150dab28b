package com.cascade.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outgoing link of a work item.
 *
 * @param rel        Link type reference name
 * @param url        Target item URL
 * @param attributes Link attributes (e.g. "name" -> "Parent")
 */
public record Relation(String rel, String url, Map<String, Object> attributes) {

    public Relation {
        attributes = attributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public Relation(String rel, String url, String name) {
        this(rel, url, name == null ? Map.of() : Map.of("name", name));
    }

    /**
     * Value of the "name" attribute, or null.
     */
    public String name() {
        Object name = attributes.get("name");
        return name == null ? null : name.toString();
    }
}
