package com.entity.canonical.core.model;

import java.util.Objects;

/**
 * A text span extracted from user input and tagged with an entity type.
 *
 * <p>System entities (types prefixed with {@code sys_}, e.g. {@code sys_time} or
 * {@code sys_number}) arrive already resolved by the NLU layer; their resolved
 * form travels in {@link #value()}.</p>
 *
 * @param text  the surface text of the mention
 * @param type  the entity type name
 * @param value the pre-resolved value for system entities, otherwise usually null
 */
public record EntityMention(String text, String type, Object value) {

    public static final String SYSTEM_ENTITY_PREFIX = "sys_";

    public EntityMention {
        Objects.requireNonNull(text, "text is required");
        Objects.requireNonNull(type, "type is required");
    }

    public static EntityMention of(String text, String type) {
        return new EntityMention(text, type, null);
    }

    public static boolean isSystemEntity(String entityType) {
        return entityType != null && entityType.startsWith(SYSTEM_ENTITY_PREFIX);
    }

    public boolean isSystemEntity() {
        return isSystemEntity(type);
    }
}
