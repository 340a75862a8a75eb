package com.entity.canonical.graph;

import com.entity.canonical.search.BackendUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Connection pool for one FalkorDB graph. A fair {@link Semaphore} caps the
 * borrowed connections at {@code maxTotal}; released ones wait in a deque
 * until {@code maxIdle} is reached and are closed beyond that.
 *
 * <p>JFalkorDB's {@code Graph} is not thread-safe, so every pooled entry is a
 * {@link FalkorDBConnection} of its own.</p>
 */
public class SimpleGraphConnectionPool implements GraphConnectionPool {
    private static final Logger log = LoggerFactory.getLogger(SimpleGraphConnectionPool.class);

    private final PoolConfig config;
    private final Supplier<GraphConnection> opener;
    private final Semaphore permits;
    private final ConcurrentLinkedDeque<GraphConnection> idle = new ConcurrentLinkedDeque<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public SimpleGraphConnectionPool(PoolConfig config) {
        this(config, () -> new FalkorDBConnection(config.host(), config.port(), config.graphName()));
    }

    public SimpleGraphConnectionPool(PoolConfig config, Supplier<GraphConnection> opener) {
        this.config = config;
        this.opener = opener;
        this.permits = new Semaphore(config.maxTotal(), true);

        for (int i = 0; i < config.minIdle(); i++) {
            try {
                idle.addLast(opener.get());
            } catch (RuntimeException e) {
                // borrow() opens the missing ones on demand
                log.warn("pool.warmup.failed graph={} attempt={}/{} error={}",
                        config.graphName(), i + 1, config.minIdle(), e.getMessage());
            }
        }
        log.info("pool.started graph={} endpoint={}:{} maxTotal={} warm={}",
                config.graphName(), config.host(), config.port(), config.maxTotal(), idle.size());
    }

    @Override
    public GraphConnection borrow() {
        if (closed.get()) {
            throw new BackendUnavailableException("Connection pool for graph '" + config.graphName() + "' is closed");
        }
        acquirePermit();

        try {
            GraphConnection connection = idle.pollFirst();
            while (connection != null && config.validateOnBorrow() && !connection.isConnected()) {
                log.debug("pool.evict graph={} reason=validation", config.graphName());
                closeQuietly(connection);
                connection = idle.pollFirst();
            }
            return connection != null ? connection : opener.get();
        } catch (RuntimeException e) {
            permits.release();
            throw e;
        }
    }

    @Override
    public void release(GraphConnection connection) {
        if (connection == null) {
            return;
        }
        if (closed.get() || idle.size() >= config.maxIdle()) {
            closeQuietly(connection);
        } else {
            idle.addLast(connection);
        }
        permits.release();
    }

    @Override
    public int activeCount() {
        return config.maxTotal() - permits.availablePermits();
    }

    @Override
    public int idleCount() {
        return idle.size();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        int active = activeCount();
        GraphConnection connection;
        while ((connection = idle.pollFirst()) != null) {
            closeQuietly(connection);
        }
        log.info("pool.closed graph={} stillBorrowed={}", config.graphName(), active);
    }

    private void acquirePermit() {
        long waitMillis = config.maxWait().toMillis();
        try {
            if (!permits.tryAcquire(waitMillis, TimeUnit.MILLISECONDS)) {
                throw new BackendUnavailableException("No FalkorDB connection free for graph '"
                        + config.graphName() + "' after " + waitMillis + "ms");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendUnavailableException("Interrupted while waiting for a FalkorDB connection", e);
        }
    }

    private void closeQuietly(GraphConnection connection) {
        try {
            connection.close();
        } catch (RuntimeException e) {
            log.warn("pool.close.failed graph={} error={}", config.graphName(), e.getMessage());
        }
    }
}
