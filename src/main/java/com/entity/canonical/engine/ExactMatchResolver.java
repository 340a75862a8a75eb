package com.entity.canonical.engine;

import com.entity.canonical.core.model.CanonicalItem;
import com.entity.canonical.core.model.EntityMention;
import com.entity.canonical.core.model.ResolutionResult;
import com.entity.canonical.index.SynonymIndex;
import com.entity.canonical.metrics.MetricsService;
import com.entity.canonical.rules.Normalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resolves mentions through the synonym table of a {@link SynonymIndex}.
 *
 * <p>A miss never throws: it is logged and the mention text comes back as
 * {@link ResolutionResult.Unresolved}. An alias shared by several cnames
 * returns the items of all of them, cnames in discovery order and items in
 * insertion order.</p>
 */
public class ExactMatchResolver {
    private static final Logger log = LoggerFactory.getLogger(ExactMatchResolver.class);

    private final Normalizer normalizer;
    private final MetricsService metrics;

    public ExactMatchResolver(Normalizer normalizer, MetricsService metrics) {
        this.normalizer = normalizer;
        this.metrics = metrics;
    }

    public ResolutionResult resolve(EntityMention mention, SynonymIndex index) {
        if (mention.isSystemEntity()) {
            return new ResolutionResult.PreResolved(mention.value());
        }

        String normalized = normalizer.normalize(mention.text());
        Set<String> cnames = index.lookup(normalized);
        if (cnames.isEmpty()) {
            log.warn("resolve.miss type={} text='{}'", mention.type(), mention.text());
            metrics.incrementResolutionMiss(mention.type());
            return new ResolutionResult.Unresolved(mention.text());
        }

        if (cnames.size() > 1) {
            log.info("resolve.ambiguous type={} text='{}' cnames={}", mention.type(), mention.text(), cnames);
            metrics.incrementAmbiguousMatch(mention.type());
        }

        List<Map<String, Object>> values = new ArrayList<>();
        for (String cname : cnames) {
            for (CanonicalItem item : index.itemsFor(cname)) {
                values.add(item.toProjection());
            }
        }
        return new ResolutionResult.ExactMatches(values);
    }
}
