package com.entity.canonical.search;

/**
 * Opens a new backend connection. Called at most once per lifecycle manager.
 */
@FunctionalInterface
public interface SearchBackendFactory {

    SearchBackend create();
}
