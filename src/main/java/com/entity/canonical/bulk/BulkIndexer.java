package com.entity.canonical.bulk;

import com.entity.canonical.search.BulkResponse;
import com.entity.canonical.search.SearchBackend;
import com.entity.canonical.search.SynonymDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Streams documents into a {@link SearchBackend} in fixed-size batches with a
 * bounded number of batches in flight.
 *
 * <p>Rejected documents are logged and reported in the result; the remaining
 * documents are still indexed. Exceptions thrown by the backend itself
 * (unreachable, missing index) stop the push and propagate once in-flight
 * batches have finished.</p>
 *
 * <p>{@link #abort()} is cooperative: it is checked before each batch is
 * submitted, never interrupts a running batch, and stays set for the lifetime
 * of the indexer.</p>
 */
public class BulkIndexer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BulkIndexer.class);

    public static final int DEFAULT_BATCH_SIZE = 50;
    public static final int DEFAULT_MAX_IN_FLIGHT = 2;

    private final int batchSize;
    private final int maxInFlight;
    private final ExecutorService executor;
    private final AtomicBoolean aborted = new AtomicBoolean(false);

    public BulkIndexer() {
        this(DEFAULT_BATCH_SIZE, DEFAULT_MAX_IN_FLIGHT);
    }

    public BulkIndexer(int batchSize, int maxInFlight) {
        if (batchSize <= 0) throw new IllegalArgumentException("batchSize must be > 0");
        if (maxInFlight <= 0) throw new IllegalArgumentException("maxInFlight must be > 0");
        this.batchSize = batchSize;
        this.maxInFlight = maxInFlight;
        this.executor = Executors.newFixedThreadPool(maxInFlight, new IndexerThreadFactory());
    }

    public IndexingResult push(SearchBackend backend, String indexName, List<SynonymDocument> documents) {
        return push(backend, indexName, documents, ProgressCallback.NOOP);
    }

    /**
     * Indexes the documents and blocks until every submitted batch has completed.
     */
    public IndexingResult push(SearchBackend backend, String indexName, List<SynonymDocument> documents,
                               ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        int batchCount = (documents.size() + batchSize - 1) / batchSize;

        Semaphore inFlight = new Semaphore(maxInFlight);
        AtomicBoolean failed = new AtomicBoolean(false);
        AtomicLong processed = new AtomicLong(0);
        List<Future<BulkResponse>> futures = new ArrayList<>(batchCount);
        boolean stoppedEarly = false;

        for (int batch = 0; batch < batchCount; batch++) {
            if (aborted.get() || failed.get()) {
                stoppedEarly = aborted.get();
                break;
            }
            try {
                inFlight.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("bulk.interrupted index={} submittedBatches={}", indexName, batch);
                stoppedEarly = true;
                break;
            }
            if (aborted.get() || failed.get()) {
                inFlight.release();
                stoppedEarly = aborted.get();
                break;
            }

            int from = batch * batchSize;
            List<SynonymDocument> slice = List.copyOf(documents.subList(from, Math.min(from + batchSize, documents.size())));
            int batchNumber = batch + 1;
            futures.add(executor.submit(() -> {
                try {
                    BulkResponse response = backend.bulkUpsert(indexName, slice);
                    cb.onBatchIndexed(indexName, batchNumber, batchCount, processed.addAndGet(slice.size()));
                    return response;
                } catch (RuntimeException e) {
                    failed.set(true);
                    throw e;
                } finally {
                    inFlight.release();
                }
            }));
        }

        long indexed = 0;
        List<IndexingResult.IndexingFailure> failures = new ArrayList<>();
        RuntimeException fatal = null;
        for (Future<BulkResponse> future : futures) {
            try {
                BulkResponse response = future.get();
                indexed += response.successCount();
                for (BulkResponse.ItemResult item : response.failures()) {
                    log.warn("bulk.item.failed index={} id={} error={}", indexName, item.documentId(), item.error());
                    failures.add(new IndexingResult.IndexingFailure(item.documentId(), item.error()));
                }
            } catch (ExecutionException e) {
                if (fatal == null) {
                    fatal = e.getCause() instanceof RuntimeException runtime
                            ? runtime
                            : new IllegalStateException("Bulk indexing failed", e.getCause());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fatal = new IllegalStateException("Interrupted while waiting for bulk indexing", e);
                break;
            }
        }

        if (fatal != null) {
            log.error("bulk.failed index={} indexed={} error={}", indexName, indexed, fatal.getMessage());
            throw fatal;
        }

        IndexingResult result = new IndexingResult(documents.size(), indexed, failures, stoppedEarly);
        if (stoppedEarly) {
            log.warn("bulk.aborted index={} result={}", indexName, result);
        } else {
            log.info("bulk.completed index={} result={}", indexName, result);
        }
        return result;
    }

    /**
     * Requests that running and future pushes stop submitting batches.
     */
    public void abort() {
        if (aborted.compareAndSet(false, true)) {
            log.info("bulk.abort.requested");
        }
    }

    public boolean isAborted() {
        return aborted.get();
    }

    public int getBatchSize() {
        return batchSize;
    }

    public int getMaxInFlight() {
        return maxInFlight;
    }

    /**
     * Aborts, then waits briefly for in-flight batches before stopping the workers.
     */
    @Override
    public void close() {
        abort();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("bulk.shutdown.timeout pending batches cancelled");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class IndexerThreadFactory implements ThreadFactory {
        private static final AtomicInteger POOL_COUNTER = new AtomicInteger(0);
        private final int pool = POOL_COUNTER.incrementAndGet();
        private final AtomicInteger counter = new AtomicInteger(0);

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "bulk-indexer-" + pool + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
