package com.cascade.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * A single field-replace instruction for one work item.
 *
 * @param url                   Destination work item URL
 * @param suppressNotifications Requested notification flag, null when unspecified
 * @param bypassRules           Requested rule bypass flag, null when unspecified
 * @param op                    Patch operation, always "replace"
 * @param path                  Patch path, "/fields/&lt;reference name&gt;"
 * @param value                 New field value
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UpdateOperation(
        String url,
        Boolean suppressNotifications,
        Boolean bypassRules,
        String op,
        String path,
        String value
) {
    public static final String REPLACE = "replace";

    public UpdateOperation {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(op, "op");
        Objects.requireNonNull(path, "path");
    }

    /**
     * Create a replace operation carrying the given action options.
     */
    public static UpdateOperation replace(String url, AlterOptions options, String path, String value) {
        return new UpdateOperation(url, options.suppressNotifications(), options.bypassRules(),
                REPLACE, path, value);
    }
}
