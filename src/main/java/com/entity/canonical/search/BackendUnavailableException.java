package com.entity.canonical.search;

/**
 * The search backend could not be reached or has been shut down.
 */
public class BackendUnavailableException extends SearchBackendException {

    public BackendUnavailableException(String message) {
        super(message);
    }

    public BackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
