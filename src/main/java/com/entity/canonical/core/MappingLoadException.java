package com.entity.canonical.core;

/**
 * Thrown when the mapping records for an entity type cannot be read.
 */
public class MappingLoadException extends CanonicalizationException {

    public MappingLoadException(String message) {
        super(message);
    }

    public MappingLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
