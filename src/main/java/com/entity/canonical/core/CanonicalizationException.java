package com.entity.canonical.core;

/**
 * Base class for failures that must halt the operation that raised them.
 * Resolution misses are never reported through this hierarchy.
 */
public class CanonicalizationException extends RuntimeException {

    public CanonicalizationException(String message) {
        super(message);
    }

    public CanonicalizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
