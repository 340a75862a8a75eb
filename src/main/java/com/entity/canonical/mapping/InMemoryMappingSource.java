package com.entity.canonical.mapping;

import com.entity.canonical.core.MappingLoadException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Mapping source holding records in memory, for embedding and tests.
 * Records can be replaced at any time; the next fit picks them up.
 */
public class InMemoryMappingSource implements MappingSource {

    private final Map<String, List<Map<String, Object>>> mappings = new ConcurrentHashMap<>();

    public InMemoryMappingSource put(String entityType, List<? extends Map<String, ?>> records) {
        List<Map<String, Object>> copy = new ArrayList<>(records.size());
        for (Map<String, ?> record : records) {
            copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(record)));
        }
        mappings.put(entityType, List.copyOf(copy));
        return this;
    }

    public void remove(String entityType) {
        mappings.remove(entityType);
    }

    @Override
    public List<Map<String, Object>> load(String entityType) {
        List<Map<String, Object>> records = mappings.get(entityType);
        if (records == null) {
            throw new MappingLoadException("No mapping registered for entity type '" + entityType + "'");
        }
        return records;
    }

    @Override
    public Set<String> entityTypes() {
        return Collections.unmodifiableSet(new TreeSet<>(mappings.keySet()));
    }
}
