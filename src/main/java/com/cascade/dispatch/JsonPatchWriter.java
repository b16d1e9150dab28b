package com.cascade.dispatch;

import com.cascade.exception.DispatchException;
import com.cascade.model.UpdateOperation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders a patch request as a JSON Patch document plus query flags.
 */
public final class JsonPatchWriter {

    public static final String CONTENT_TYPE = "application/json-patch+json";

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private JsonPatchWriter() {
    }

    /**
     * JSON Patch body: [{"op":"replace","path":"/fields/...","value":"..."}, ...]
     */
    public static String writeBody(PatchRequest request) {
        ArrayNode body = objectMapper.createArrayNode();
        for (UpdateOperation operation : request.operations()) {
            body.addObject()
                    .put("op", operation.op())
                    .put("path", operation.path())
                    .put("value", operation.value());
        }
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new DispatchException("Failed to render patch for " + request.url(), e);
        }
    }

    /**
     * Query parameters carrying the merged flags.
     */
    public static Map<String, String> queryParameters(PatchRequest request) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("suppressNotifications", String.valueOf(request.suppressNotifications()));
        params.put("bypassRules", String.valueOf(request.bypassRules()));
        return params;
    }
}
