package com.entity.canonical.bulk;

import java.util.List;

/**
 * Result of pushing documents to a search backend.
 *
 * @param totalDocuments number of documents submitted for indexing
 * @param indexed        number of documents the backend accepted
 * @param failures       documents the backend rejected, in submission order
 * @param aborted        whether indexing stopped early on an abort request
 */
public record IndexingResult(
        long totalDocuments,
        long indexed,
        List<IndexingFailure> failures,
        boolean aborted
) {
    public IndexingResult {
        failures = failures != null ? List.copyOf(failures) : List.of();
    }

    public static IndexingResult empty() {
        return new IndexingResult(0, 0, List.of(), false);
    }

    public long failureCount() {
        return failures.size();
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    /**
     * A single rejected document.
     *
     * @param documentId the document id
     * @param message    the backend's reason
     */
    public record IndexingFailure(String documentId, String message) {}

    @Override
    public String toString() {
        return "IndexingResult{total=" + totalDocuments +
                ", indexed=" + indexed +
                ", failed=" + failures.size() +
                ", aborted=" + aborted + '}';
    }
}
