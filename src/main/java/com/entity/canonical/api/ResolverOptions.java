package com.entity.canonical.api;

import com.entity.canonical.bulk.BulkIndexer;
import com.entity.canonical.lifecycle.IndexLifecycleManager;

/**
 * Tuning of an {@link EntityResolver}: fuzzy ranking, bulk ingestion and index naming.
 */
public class ResolverOptions {

    private static final int DEFAULT_TOP_K = 10;
    private static final int DEFAULT_SAMPLE_SIZE = 20;
    private static final int DEFAULT_MAX_GROUPS = 100;
    private static final double DEFAULT_KEYWORD_BOOST = 10.0;
    private static final double DEFAULT_FULL_TEXT_BOOST = 2.0;
    private static final double DEFAULT_NGRAM_BOOST = 1.0;

    private final int topK;
    private final int sampleSize;
    private final int maxGroups;
    private final double keywordBoost;
    private final double fullTextBoost;
    private final double ngramBoost;
    private final int batchSize;
    private final int maxInFlightBatches;
    private final String indexPrefix;

    private ResolverOptions(Builder builder) {
        this.topK = builder.topK;
        this.sampleSize = builder.sampleSize;
        this.maxGroups = builder.maxGroups;
        this.keywordBoost = builder.keywordBoost;
        this.fullTextBoost = builder.fullTextBoost;
        this.ngramBoost = builder.ngramBoost;
        this.batchSize = builder.batchSize;
        this.maxInFlightBatches = builder.maxInFlightBatches;
        this.indexPrefix = builder.indexPrefix;
    }

    /**
     * Number of fuzzy candidates returned when the caller does not ask for a specific count.
     */
    public int getTopK() {
        return topK;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public int getMaxGroups() {
        return maxGroups;
    }

    public double getKeywordBoost() {
        return keywordBoost;
    }

    public double getFullTextBoost() {
        return fullTextBoost;
    }

    public double getNgramBoost() {
        return ngramBoost;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public int getMaxInFlightBatches() {
        return maxInFlightBatches;
    }

    public String getIndexPrefix() {
        return indexPrefix;
    }

    public static ResolverOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "ResolverOptions{topK=" + topK +
                ", sampleSize=" + sampleSize +
                ", maxGroups=" + maxGroups +
                ", boosts=" + keywordBoost + "/" + fullTextBoost + "/" + ngramBoost +
                ", batchSize=" + batchSize +
                ", maxInFlightBatches=" + maxInFlightBatches +
                ", indexPrefix='" + indexPrefix + '\'' + '}';
    }

    public static class Builder {
        private int topK = DEFAULT_TOP_K;
        private int sampleSize = DEFAULT_SAMPLE_SIZE;
        private int maxGroups = DEFAULT_MAX_GROUPS;
        private double keywordBoost = DEFAULT_KEYWORD_BOOST;
        private double fullTextBoost = DEFAULT_FULL_TEXT_BOOST;
        private double ngramBoost = DEFAULT_NGRAM_BOOST;
        private int batchSize = BulkIndexer.DEFAULT_BATCH_SIZE;
        private int maxInFlightBatches = BulkIndexer.DEFAULT_MAX_IN_FLIGHT;
        private String indexPrefix = IndexLifecycleManager.DEFAULT_INDEX_PREFIX;

        public Builder topK(int topK) {
            requirePositive(topK, "topK");
            this.topK = topK;
            return this;
        }

        public Builder sampleSize(int sampleSize) {
            requirePositive(sampleSize, "sampleSize");
            this.sampleSize = sampleSize;
            return this;
        }

        public Builder maxGroups(int maxGroups) {
            requirePositive(maxGroups, "maxGroups");
            this.maxGroups = maxGroups;
            return this;
        }

        /**
         * Boosts of the keyword, full-text and n-gram clauses.
         */
        public Builder boosts(double keyword, double fullText, double ngram) {
            if (keyword <= 0 || fullText <= 0 || ngram <= 0) {
                throw new IllegalArgumentException("boosts must be > 0");
            }
            this.keywordBoost = keyword;
            this.fullTextBoost = fullText;
            this.ngramBoost = ngram;
            return this;
        }

        public Builder batchSize(int batchSize) {
            requirePositive(batchSize, "batchSize");
            this.batchSize = batchSize;
            return this;
        }

        public Builder maxInFlightBatches(int maxInFlightBatches) {
            requirePositive(maxInFlightBatches, "maxInFlightBatches");
            this.maxInFlightBatches = maxInFlightBatches;
            return this;
        }

        public Builder indexPrefix(String indexPrefix) {
            this.indexPrefix = indexPrefix;
            return this;
        }

        public ResolverOptions build() {
            if (keywordBoost < fullTextBoost || fullTextBoost < ngramBoost) {
                throw new IllegalArgumentException(
                        "boosts must satisfy keyword >= fullText >= ngram");
            }
            if (indexPrefix == null || indexPrefix.isBlank()) {
                throw new IllegalArgumentException("indexPrefix is required");
            }
            return new ResolverOptions(this);
        }

        private static void requirePositive(int value, String name) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be positive");
            }
        }
    }
}
