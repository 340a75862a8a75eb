package com.entity.canonical.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One knowledge-base record for an entity type.
 *
 * <p>The canonical name is required but not unique; the identifier is optional.
 * Every other field of the source record is carried verbatim into the
 * {@link #toProjection() projection} returned to callers. Aliases are kept apart
 * from the projection: they only exist to feed the synonym table.</p>
 */
public final class CanonicalItem {

    public static final String ID_FIELD = "id";
    public static final String CNAME_FIELD = "cname";
    public static final String WHITELIST_FIELD = "whitelist";

    private final String id;
    private final String cname;
    private final Map<String, Object> fields;
    private final List<String> aliases;

    private CanonicalItem(Builder builder) {
        this.id = builder.id;
        this.cname = builder.cname;
        this.aliases = List.copyOf(builder.aliases);

        Map<String, Object> ordered = new LinkedHashMap<>();
        if (id != null) {
            ordered.put(ID_FIELD, id);
        }
        ordered.put(CNAME_FIELD, cname);
        builder.attributes.forEach((key, value) -> {
            if (!ID_FIELD.equals(key) && !CNAME_FIELD.equals(key) && !WHITELIST_FIELD.equals(key)) {
                ordered.put(key, value);
            }
        });
        this.fields = Collections.unmodifiableMap(ordered);
    }

    /**
     * Converts a raw mapping record into an item. The record must carry a
     * {@code cname}; {@code id} and {@code whitelist} are optional.
     */
    public static CanonicalItem fromRecord(Map<String, ?> record) {
        Objects.requireNonNull(record, "record is required");
        Object cname = record.get(CNAME_FIELD);
        if (cname == null || cname.toString().isBlank()) {
            throw new IllegalArgumentException("Mapping record is missing 'cname': " + record);
        }

        Builder builder = builder().cname(cname.toString());
        Object id = record.get(ID_FIELD);
        if (id != null) {
            builder.id(id.toString());
        }

        Object whitelist = record.get(WHITELIST_FIELD);
        if (whitelist instanceof Collection<?> values) {
            for (Object alias : values) {
                if (alias != null) {
                    builder.alias(alias.toString());
                }
            }
        } else if (whitelist != null) {
            throw new IllegalArgumentException(
                    "'whitelist' must be a list of strings for cname '" + cname + "'");
        }

        record.forEach((key, value) -> builder.attribute(key, value));
        return builder.build();
    }

    public String getId() {
        return id;
    }

    public boolean hasId() {
        return id != null;
    }

    public String getCname() {
        return cname;
    }

    /**
     * Ordered aliases from the record's whitelist, not including the cname.
     */
    public List<String> getAliases() {
        return aliases;
    }

    /**
     * The cname followed by every alias, in record order.
     */
    public List<String> getSurfaceForms() {
        List<String> forms = new ArrayList<>(aliases.size() + 1);
        forms.add(cname);
        forms.addAll(aliases);
        return forms;
    }

    /**
     * Returns the record as seen by callers: every field except the alias list.
     */
    public Map<String, Object> toProjection() {
        return fields;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CanonicalItem that = (CanonicalItem) o;
        return Objects.equals(fields, that.fields) && Objects.equals(aliases, that.aliases);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields, aliases);
    }

    @Override
    public String toString() {
        return "CanonicalItem{" +
                "id='" + id + '\'' +
                ", cname='" + cname + '\'' +
                ", aliases=" + aliases +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String cname;
        private final List<String> aliases = new ArrayList<>();
        private final Map<String, Object> attributes = new LinkedHashMap<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder cname(String cname) {
            this.cname = cname;
            return this;
        }

        public Builder alias(String alias) {
            this.aliases.add(alias);
            return this;
        }

        public Builder aliases(List<String> aliases) {
            this.aliases.addAll(aliases);
            return this;
        }

        public Builder attribute(String key, Object value) {
            this.attributes.put(key, value);
            return this;
        }

        public CanonicalItem build() {
            Objects.requireNonNull(cname, "cname is required");
            return new CanonicalItem(this);
        }
    }
}
