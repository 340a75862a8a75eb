package com.entity.canonical.engine;

import com.entity.canonical.api.ResolverOptions;
import com.entity.canonical.cache.ResolutionCache;
import com.entity.canonical.core.model.EntityMention;
import com.entity.canonical.core.model.ResolutionResult;
import com.entity.canonical.core.model.ResolvedCandidate;
import com.entity.canonical.metrics.MetricsService;
import com.entity.canonical.rules.Normalizer;
import com.entity.canonical.search.CandidateGroup;
import com.entity.canonical.search.ClauseType;
import com.entity.canonical.search.SearchBackend;
import com.entity.canonical.search.SearchField;
import com.entity.canonical.search.SearchResponse;
import com.entity.canonical.search.SynonymQuery;
import com.entity.canonical.tracing.Span;
import com.entity.canonical.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Ranks canonical names for a mention with a boosted disjunctive search.
 *
 * <p>The query scores exact normalized matches highest, then token and shingle
 * matches, then edge n-gram matches, each against both aliases and cnames. Groups
 * come back one per cname and are ordered by their best hit; ties keep the
 * backend's order. Backend failures propagate unchanged.</p>
 *
 * <p>Ranked lists are cached per normalized text. A search that overlaps an
 * {@link #invalidate(String) invalidation} never leaves its result in the cache.</p>
 */
public class FuzzyMatchResolver {
    private static final Logger log = LoggerFactory.getLogger(FuzzyMatchResolver.class);

    private static final Comparator<ResolvedCandidate> BY_SCORE_DESC =
            Comparator.comparingDouble(ResolvedCandidate::relevanceScore).reversed();

    private final Normalizer normalizer;
    private final ResolverOptions options;
    private final ResolutionCache cache;
    private final MetricsService metrics;
    private final TracingService tracing;
    private final AtomicLong generation = new AtomicLong();

    public FuzzyMatchResolver(Normalizer normalizer, ResolverOptions options, ResolutionCache cache,
                              MetricsService metrics, TracingService tracing) {
        this.normalizer = normalizer;
        this.options = options;
        this.cache = cache;
        this.metrics = metrics;
        this.tracing = tracing;
    }

    public SynonymQuery buildQuery(String normalizedText) {
        return SynonymQuery.builder()
                .text(normalizedText)
                .clause(ClauseType.KEYWORD, SearchField.WHITELIST, options.getKeywordBoost())
                .clause(ClauseType.KEYWORD, SearchField.CNAME, options.getKeywordBoost())
                .clause(ClauseType.FULL_TEXT, SearchField.WHITELIST, options.getFullTextBoost())
                .clause(ClauseType.FULL_TEXT, SearchField.CNAME, options.getFullTextBoost())
                .clause(ClauseType.NGRAM, SearchField.CNAME, options.getNgramBoost())
                .clause(ClauseType.NGRAM, SearchField.WHITELIST, options.getNgramBoost())
                .sampleSize(options.getSampleSize())
                .maxGroups(options.getMaxGroups())
                .build();
    }

    /**
     * Returns at most {@code topK} candidates, best first, with unique cnames.
     *
     * @throws com.entity.canonical.search.IndexNotFoundException     if the index does not exist
     * @throws com.entity.canonical.search.BackendUnavailableException if the backend cannot be reached
     */
    public ResolutionResult.RankedCandidates resolve(EntityMention mention, SearchBackend backend,
                                                     String indexName, int topK) {
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be positive");
        }
        String normalized = normalizer.normalize(mention.text());

        Optional<List<ResolvedCandidate>> cached = cache.get(mention.type(), normalized);
        metrics.recordCacheLookup(mention.type(), cached.isPresent());
        List<ResolvedCandidate> ranked;
        if (cached.isPresent()) {
            ranked = cached.get();
        } else {
            long observed = generation.get();
            ranked = search(mention.type(), normalized, backend, indexName);
            if (generation.get() == observed) {
                cache.put(mention.type(), normalized, ranked);
                // an invalidation may have slipped in between the check and the put
                if (generation.get() != observed) {
                    cache.invalidateType(mention.type());
                }
            } else {
                log.debug("resolve.cache.skipped type={} text='{}' reason=index-changed", mention.type(), normalized);
            }
        }

        List<ResolvedCandidate> top = ranked.size() > topK ? ranked.subList(0, topK) : ranked;
        return new ResolutionResult.RankedCandidates(top);
    }

    /**
     * Drops the cached lists of the type and discards the results of searches
     * still running against the previous index.
     */
    public void invalidate(String entityType) {
        generation.incrementAndGet();
        cache.invalidateType(entityType);
    }

    private List<ResolvedCandidate> search(String entityType, String normalized,
                                           SearchBackend backend, String indexName) {
        try (Span span = tracing.startSpan(TracingService.FUZZY_SEARCH, Map.of(
                "entityType", entityType,
                "index", indexName))) {
            try {
                SearchResponse response = backend.search(indexName, buildQuery(normalized));

                List<ResolvedCandidate> candidates = new ArrayList<>(response.groups().size());
                for (CandidateGroup group : response.groups()) {
                    candidates.add(new ResolvedCandidate(group.cname(), group.topScore(), group.hitCount()));
                }
                // List.sort is stable, so equal scores keep the backend's order
                candidates.sort(BY_SCORE_DESC);

                span.attribute("groups", candidates.size())
                        .attribute("totalHits", response.totalHits())
                        .succeeded();
                log.debug("resolve.fuzzy type={} text='{}' groups={} hits={} tookMs={}",
                        entityType, normalized, candidates.size(), response.totalHits(), response.tookMillis());
                return List.copyOf(candidates);
            } catch (RuntimeException e) {
                span.failed(e);
                throw e;
            }
        }
    }
}
