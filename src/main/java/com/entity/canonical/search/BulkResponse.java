package com.entity.canonical.search;

import java.util.List;

/**
 * Per-document outcome of a bulk upsert. A failed document never fails the
 * rest of the batch.
 */
public record BulkResponse(List<ItemResult> items) {

    public BulkResponse {
        items = items != null ? List.copyOf(items) : List.of();
    }

    public long successCount() {
        return items.stream().filter(ItemResult::success).count();
    }

    public List<ItemResult> failures() {
        return items.stream().filter(item -> !item.success()).toList();
    }

    public boolean hasFailures() {
        return items.stream().anyMatch(item -> !item.success());
    }

    /**
     * @param documentId id of the document
     * @param success    whether the document was stored
     * @param error      failure reason, null on success
     */
    public record ItemResult(String documentId, boolean success, String error) {

        public static ItemResult ok(String documentId) {
            return new ItemResult(documentId, true, null);
        }

        public static ItemResult failed(String documentId, String error) {
            return new ItemResult(documentId, false, error);
        }
    }
}
