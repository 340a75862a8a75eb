package com.entity.canonical.core;

/**
 * Thrown when two records of one entity mapping share an identifier.
 * Identifiers must be unique per entity type; canonical names need not be.
 */
public class DuplicateIdentifierException extends CanonicalizationException {

    private final String entityType;
    private final String itemId;

    public DuplicateIdentifierException(String entityType, String itemId) {
        super("Item id '" + itemId + "' specified in '" + entityType + "' entity map multiple times");
        this.entityType = entityType;
        this.itemId = itemId;
    }

    public String getEntityType() {
        return entityType;
    }

    public String getItemId() {
        return itemId;
    }
}
