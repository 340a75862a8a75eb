package com.entity.canonical.lock;

import com.entity.canonical.core.CanonicalizationException;

/**
 * A fit gave up waiting for another fit of the same entity type.
 */
public class LockAcquisitionException extends CanonicalizationException {

    private final String key;

    public LockAcquisitionException(String key, String message) {
        super(message);
        this.key = key;
    }

    public LockAcquisitionException(String key, String message, Throwable cause) {
        super(message, cause);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
