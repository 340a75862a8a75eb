package com.entity.canonical.index;

import com.entity.canonical.core.model.CanonicalItem;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable snapshot of the in-memory tables of one entity type.
 *
 * <ul>
 *   <li>item table: cname to the items sharing that name, in insertion order</li>
 *   <li>synonym table: normalized alias to the cnames claiming it, in discovery order</li>
 * </ul>
 *
 * <p>Every cname in the synonym table is a key of the item table. Instances are
 * published whole after a fit, so readers never observe a partial build.</p>
 */
public final class SynonymIndex {

    private final String entityType;
    private final Map<String, List<CanonicalItem>> itemTable;
    private final Map<String, Set<String>> synonymTable;

    SynonymIndex(String entityType,
                 Map<String, List<CanonicalItem>> itemTable,
                 Map<String, Set<String>> synonymTable) {
        this.entityType = Objects.requireNonNull(entityType, "entityType is required");

        Map<String, List<CanonicalItem>> items = new LinkedHashMap<>();
        itemTable.forEach((cname, list) -> items.put(cname, List.copyOf(list)));
        this.itemTable = Collections.unmodifiableMap(items);

        Map<String, Set<String>> synonyms = new LinkedHashMap<>();
        synonymTable.forEach((alias, cnames) ->
                synonyms.put(alias, Collections.unmodifiableSet(new LinkedHashSet<>(cnames))));
        this.synonymTable = Collections.unmodifiableMap(synonyms);
    }

    /**
     * An index with no entries, published before the first fit.
     */
    public static SynonymIndex empty(String entityType) {
        return new SynonymIndex(entityType, Map.of(), Map.of());
    }

    public String getEntityType() {
        return entityType;
    }

    /**
     * Returns the cnames registered under a normalized alias, or an empty set.
     */
    public Set<String> lookup(String normalizedAlias) {
        Set<String> cnames = synonymTable.get(normalizedAlias);
        return cnames != null ? cnames : Set.of();
    }

    public List<CanonicalItem> itemsFor(String cname) {
        List<CanonicalItem> items = itemTable.get(cname);
        return items != null ? items : List.of();
    }

    /**
     * Every item, grouped by cname in first-seen order.
     */
    public List<CanonicalItem> allItems() {
        List<CanonicalItem> all = new ArrayList<>();
        itemTable.values().forEach(all::addAll);
        return all;
    }

    public Map<String, List<CanonicalItem>> getItemTable() {
        return itemTable;
    }

    public Map<String, Set<String>> getSynonymTable() {
        return synonymTable;
    }

    public int itemCount() {
        return itemTable.values().stream().mapToInt(List::size).sum();
    }

    public int aliasCount() {
        return synonymTable.size();
    }

    public boolean isEmpty() {
        return itemTable.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SynonymIndex that = (SynonymIndex) o;
        return entityType.equals(that.entityType)
                && itemTable.equals(that.itemTable)
                && synonymTable.equals(that.synonymTable);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityType, itemTable, synonymTable);
    }

    @Override
    public String toString() {
        return "SynonymIndex{entityType='" + entityType + "', items=" + itemCount() +
                ", aliases=" + aliasCount() + '}';
    }
}
