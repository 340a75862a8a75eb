package com.entity.canonical.mapping;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Supplies the knowledge-base records of each entity type.
 *
 * <p>Each record carries at least {@code cname}; {@code id}, {@code whitelist}
 * and any other fields are optional and preserved.</p>
 */
public interface MappingSource {

    /**
     * Loads the records of one entity type, in source order.
     *
     * @throws com.entity.canonical.core.MappingLoadException if the records cannot be read
     */
    List<Map<String, Object>> load(String entityType);

    /**
     * Entity types this source has records for.
     */
    Set<String> entityTypes();
}
