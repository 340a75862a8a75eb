package com.entity.canonical.graph;

import java.time.Duration;
import java.util.Objects;

/**
 * Endpoint and sizing of the FalkorDB connection pool behind one search backend.
 *
 * @param host             FalkorDB host
 * @param port             FalkorDB port
 * @param graphName        graph holding the synonym indexes
 * @param maxTotal         upper bound of connections borrowed at once
 * @param maxIdle          idle connections kept for reuse
 * @param minIdle          connections opened eagerly when the pool starts
 * @param maxWait          how long {@code borrow} waits for a free connection
 * @param validateOnBorrow whether an idle connection is pinged before being handed out
 */
public record PoolConfig(
        String host,
        int port,
        String graphName,
        int maxTotal,
        int maxIdle,
        int minIdle,
        Duration maxWait,
        boolean validateOnBorrow
) {

    public PoolConfig {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("host is required");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        if (graphName == null || graphName.isBlank()) {
            throw new IllegalArgumentException("graphName is required");
        }
        if (maxTotal <= 0) {
            throw new IllegalArgumentException("maxTotal must be > 0");
        }
        if (minIdle < 0 || minIdle > maxIdle || maxIdle > maxTotal) {
            throw new IllegalArgumentException("expected 0 <= minIdle <= maxIdle <= maxTotal, got "
                    + minIdle + "/" + maxIdle + "/" + maxTotal);
        }
        Objects.requireNonNull(maxWait, "maxWait is required");
        if (maxWait.isNegative() || maxWait.isZero()) {
            throw new IllegalArgumentException("maxWait must be positive");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String host = "localhost";
        private int port = 6379;
        private String graphName = "synonyms";
        private int maxTotal = 8;
        private int maxIdle = 4;
        private int minIdle = 0;
        private Duration maxWait = Duration.ofSeconds(5);
        private boolean validateOnBorrow = true;

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder graphName(String graphName) {
            this.graphName = graphName;
            return this;
        }

        public Builder maxTotal(int maxTotal) {
            this.maxTotal = maxTotal;
            return this;
        }

        public Builder maxIdle(int maxIdle) {
            this.maxIdle = maxIdle;
            return this;
        }

        public Builder minIdle(int minIdle) {
            this.minIdle = minIdle;
            return this;
        }

        public Builder maxWait(Duration maxWait) {
            this.maxWait = maxWait;
            return this;
        }

        public Builder validateOnBorrow(boolean validateOnBorrow) {
            this.validateOnBorrow = validateOnBorrow;
            return this;
        }

        public PoolConfig build() {
            return new PoolConfig(host, port, graphName, maxTotal, maxIdle, minIdle, maxWait, validateOnBorrow);
        }
    }
}
