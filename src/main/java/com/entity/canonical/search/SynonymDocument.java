package com.entity.canonical.search;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A document stored in a synonym index: one knowledge-base record with its
 * canonical name, aliases and the remaining attributes.
 *
 * @param id         document id, unique within the index
 * @param cname      canonical name, the grouping key of fuzzy search
 * @param whitelist  aliases of the record
 * @param attributes other record fields, kept verbatim
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SynonymDocument(
        @JsonProperty("id") String id,
        @JsonProperty("cname") String cname,
        @JsonProperty("whitelist") List<String> whitelist,
        @JsonProperty("attributes") Map<String, Object> attributes
) {
    public SynonymDocument {
        Objects.requireNonNull(id, "id is required");
        whitelist = whitelist != null ? List.copyOf(whitelist) : List.of();
        attributes = attributes != null ? new LinkedHashMap<>(attributes) : Map.of();
    }

    public Object getAttribute(String name) {
        return attributes.get(name);
    }
}
