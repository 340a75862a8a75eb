package com.entity.canonical.index;

import com.entity.canonical.core.DuplicateIdentifierException;
import com.entity.canonical.core.MappingLoadException;
import com.entity.canonical.core.model.CanonicalItem;
import com.entity.canonical.rules.Normalizer;
import com.entity.canonical.search.SynonymDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Builds the {@link SynonymIndex} of an entity type from its mapping records and
 * turns the resulting items into search documents.
 *
 * <p>Each record registers its cname under the normalized form of the cname and
 * of every alias. A normalized alias claimed by several cnames is kept with all
 * of them; only a repeated item id is rejected.</p>
 */
public class SynonymIndexBuilder {
    private static final Logger log = LoggerFactory.getLogger(SynonymIndexBuilder.class);

    static final String DERIVED_ID_SEPARATOR = "#";

    private final Normalizer normalizer;

    public SynonymIndexBuilder(Normalizer normalizer) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer is required");
    }

    /**
     * Converts raw records and builds the index.
     *
     * @throws MappingLoadException         if a record cannot be converted
     * @throws DuplicateIdentifierException if two records share an id
     */
    public SynonymIndex build(String entityType, List<? extends Map<String, ?>> records) {
        List<CanonicalItem> items = new ArrayList<>(records.size());
        int position = 0;
        for (Map<String, ?> record : records) {
            try {
                items.add(CanonicalItem.fromRecord(record));
            } catch (IllegalArgumentException e) {
                throw new MappingLoadException("Invalid record #" + position + " in '"
                        + entityType + "' mapping: " + e.getMessage(), e);
            }
            position++;
        }
        return buildFromItems(entityType, items);
    }

    /**
     * Builds the index from already converted items.
     *
     * @throws DuplicateIdentifierException if two items share an id
     */
    public SynonymIndex buildFromItems(String entityType, List<CanonicalItem> items) {
        Map<String, List<CanonicalItem>> itemTable = new LinkedHashMap<>();
        Map<String, Set<String>> synonymTable = new LinkedHashMap<>();
        Set<String> seenIds = new HashSet<>();

        for (CanonicalItem item : items) {
            if (item.hasId() && !seenIds.add(item.getId())) {
                throw new DuplicateIdentifierException(entityType, item.getId());
            }

            String cname = item.getCname();
            List<CanonicalItem> sameName = itemTable.computeIfAbsent(cname, key -> new ArrayList<>());
            if (!sameName.isEmpty()) {
                log.debug("index.duplicate.cname type={} cname={} count={}", entityType, cname, sameName.size() + 1);
            }
            sameName.add(item);

            for (String alias : item.getSurfaceForms()) {
                String normalized = normalizer.normalize(alias);
                if (normalized == null || normalized.isEmpty()) {
                    log.debug("index.alias.empty type={} cname={} alias={}", entityType, cname, alias);
                    continue;
                }
                Set<String> claimants = synonymTable.computeIfAbsent(normalized, key -> new LinkedHashSet<>());
                if (claimants.add(cname) && claimants.size() > 1) {
                    log.debug("index.alias.ambiguous type={} alias={} cnames={}", entityType, normalized, claimants);
                }
            }
        }

        SynonymIndex index = new SynonymIndex(entityType, itemTable, synonymTable);
        log.info("index.built type={} items={} cnames={} aliases={}",
                entityType, index.itemCount(), itemTable.size(), synonymTable.size());
        return index;
    }

    /**
     * Produces one search document per item, in index order. Items without an id
     * get {@code <cname>#<ordinal>}, the ordinal counting id-less items of the
     * same cname, so repeated fits upsert the same documents.
     */
    public List<SynonymDocument> toDocuments(SynonymIndex index) {
        List<SynonymDocument> documents = new ArrayList<>(index.itemCount());
        Map<String, Integer> ordinals = new HashMap<>();

        for (CanonicalItem item : index.allItems()) {
            String id = item.hasId()
                    ? item.getId()
                    : item.getCname() + DERIVED_ID_SEPARATOR + ordinals.merge(item.getCname(), 1, Integer::sum);
            documents.add(new SynonymDocument(id, item.getCname(), item.getAliases(), attributesOf(item)));
        }
        return documents;
    }

    private static Map<String, Object> attributesOf(CanonicalItem item) {
        Map<String, Object> attributes = new LinkedHashMap<>(item.toProjection());
        attributes.remove(CanonicalItem.ID_FIELD);
        attributes.remove(CanonicalItem.CNAME_FIELD);
        return attributes;
    }
}
