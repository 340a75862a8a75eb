package com.entity.canonical.bulk;

/**
 * Notified by {@link BulkIndexer} each time a batch of synonym documents has
 * been written. Invoked from indexer worker threads.
 */
@FunctionalInterface
public interface ProgressCallback {

    ProgressCallback NOOP = (indexName, batchNumber, batchCount, documentsDone) -> {};

    void onBatchIndexed(String indexName, int batchNumber, int batchCount, long documentsDone);
}
