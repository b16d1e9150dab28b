package com.cascade.dispatch;

import com.cascade.model.UpdateOperation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.cascade.WorkItemFixtures.url;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DispatchBatcher and JsonPatchWriter.
 */
class DispatchBatcherTest {

    private DispatchBatcher batcher;

    @BeforeEach
    void setUp() {
        batcher = new DispatchBatcher();
    }

    private static UpdateOperation op(long id, Boolean suppress, Boolean bypass, String field, String value) {
        return new UpdateOperation(url(id), suppress, bypass, "replace", "/fields/" + field, value);
    }

    @Test
    @DisplayName("Should group operations per item in first-seen order")
    void shouldGroupByUrl() {
        UpdateOperation a1 = op(1, null, null, "System.State", "Active");
        UpdateOperation b1 = op(2, null, null, "System.State", "Active");
        UpdateOperation a2 = op(1, null, null, "System.Reason", "Started");

        List<PatchRequest> requests = batcher.batch(List.of(a1, b1, a2));

        assertEquals(2, requests.size());
        assertEquals(url(1), requests.get(0).url());
        assertEquals(List.of(a1, a2), requests.get(0).operations());
        assertEquals(url(2), requests.get(1).url());
        assertEquals(List.of(b1), requests.get(1).operations());
    }

    @Test
    @DisplayName("Should suppress notifications and enforce rules by default")
    void shouldUseDefaultFlags() {
        PatchRequest request = batcher.batch(List.of(op(1, null, null, "System.State", "Active"))).get(0);

        assertTrue(request.suppressNotifications());
        assertFalse(request.bypassRules());
    }

    @Test
    @DisplayName("Should notify if any operation asks for notifications")
    void shouldMergeNotifications() {
        PatchRequest request = batcher.batch(List.of(
                op(1, true, null, "System.State", "Active"),
                op(1, false, null, "System.Reason", "Started"))).get(0);

        assertFalse(request.suppressNotifications());
    }

    @Test
    @DisplayName("Should bypass rules if any operation asks for it")
    void shouldMergeBypassRules() {
        List<PatchRequest> requests = batcher.batch(List.of(
                op(1, null, false, "System.State", "Active"),
                op(1, null, true, "System.Reason", "Started"),
                op(2, null, false, "System.State", "Active")));

        assertTrue(requests.get(0).bypassRules());
        assertFalse(requests.get(1).bypassRules());
    }

    @Test
    @DisplayName("Should return no requests for no operations")
    void shouldHandleEmptyInput() {
        assertTrue(batcher.batch(List.of()).isEmpty());
    }

    @Test
    @DisplayName("Should render the JSON patch body and query flags")
    void shouldRenderPatch() {
        PatchRequest request = batcher.batch(List.of(
                op(1, false, true, "System.State", "Active"),
                op(1, null, null, "System.Tags", "A; B"))).get(0);

        assertEquals("[{\"op\":\"replace\",\"path\":\"/fields/System.State\",\"value\":\"Active\"},"
                + "{\"op\":\"replace\",\"path\":\"/fields/System.Tags\",\"value\":\"A; B\"}]",
                JsonPatchWriter.writeBody(request));
        assertEquals(Map.of("suppressNotifications", "false", "bypassRules", "true"),
                JsonPatchWriter.queryParameters(request));
    }
}
