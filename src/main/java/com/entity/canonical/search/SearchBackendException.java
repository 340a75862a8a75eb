package com.entity.canonical.search;

import com.entity.canonical.core.CanonicalizationException;

/**
 * Failure reported by a {@link SearchBackend}. Always fatal for the calling
 * operation, so that an outage is never mistaken for "no match".
 */
public class SearchBackendException extends CanonicalizationException {

    public SearchBackendException(String message) {
        super(message);
    }

    public SearchBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
