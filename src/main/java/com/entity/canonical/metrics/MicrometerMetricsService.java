package com.entity.canonical.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code entity.canonical.resolution.duration}: Timer (tags: entityType, path)</li>
 *   <li>{@code entity.canonical.resolution.miss}: Counter (tag: entityType)</li>
 *   <li>{@code entity.canonical.resolution.ambiguous}: Counter (tag: entityType)</li>
 *   <li>{@code entity.canonical.candidates}: DistributionSummary (tag: entityType)</li>
 *   <li>{@code entity.canonical.fit.duration}: Timer (tag: entityType)</li>
 *   <li>{@code entity.canonical.documents.indexed}: Counter (tags: entityType, outcome)</li>
 *   <li>{@code entity.canonical.cache.lookups}: Counter (tags: entityType, outcome hit or miss)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Map<String, DistributionSummary> summaryCache = new ConcurrentHashMap<>();

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void recordResolutionDuration(String entityType, String path, Duration duration) {
        timerCache.computeIfAbsent("resolve:" + entityType + ":" + path, k ->
                Timer.builder("entity.canonical.resolution.duration")
                        .description("Duration of mention resolution")
                        .tag("entityType", entityType)
                        .tag("path", path)
                        .register(registry))
                .record(duration);
    }

    @Override
    public void incrementResolutionMiss(String entityType) {
        counter("miss:" + entityType, "entity.canonical.resolution.miss",
                "Mentions with no synonym entry", entityType, null).increment();
    }

    @Override
    public void incrementAmbiguousMatch(String entityType) {
        counter("ambiguous:" + entityType, "entity.canonical.resolution.ambiguous",
                "Mentions matching several canonical names", entityType, null).increment();
    }

    @Override
    public void recordCandidateCount(String entityType, int count) {
        summaryCache.computeIfAbsent(entityType, k ->
                DistributionSummary.builder("entity.canonical.candidates")
                        .description("Number of candidates returned per resolution")
                        .tag("entityType", entityType)
                        .register(registry))
                .record(count);
    }

    @Override
    public void recordFitDuration(String entityType, Duration duration) {
        timerCache.computeIfAbsent("fit:" + entityType, k ->
                Timer.builder("entity.canonical.fit.duration")
                        .description("Duration of index rebuilds")
                        .tag("entityType", entityType)
                        .register(registry))
                .record(duration);
    }

    @Override
    public void recordDocumentsIndexed(String entityType, long indexed, long failed) {
        counter("indexed:" + entityType, "entity.canonical.documents.indexed",
                "Documents written to the search backend", entityType, "success").increment(indexed);
        if (failed > 0) {
            counter("failed:" + entityType, "entity.canonical.documents.indexed",
                    "Documents written to the search backend", entityType, "failure").increment(failed);
        }
    }

    @Override
    public void recordCacheLookup(String entityType, boolean hit) {
        String outcome = hit ? "hit" : "miss";
        counter("cache:" + outcome + ":" + entityType, "entity.canonical.cache.lookups",
                "Fuzzy resolution cache lookups", entityType, outcome).increment();
    }

    private Counter counter(String key, String name, String description, String entityType, String outcome) {
        return counterCache.computeIfAbsent(key, k -> {
            Counter.Builder builder = Counter.builder(name)
                    .description(description)
                    .tag("entityType", entityType);
            if (outcome != null) {
                builder.tag("outcome", outcome);
            }
            return builder.register(registry);
        });
    }
}
