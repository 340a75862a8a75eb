package com.entity.canonical.search;

/**
 * The requested index does not exist in the search backend.
 */
public class IndexNotFoundException extends SearchBackendException {

    private final String indexName;

    public IndexNotFoundException(String indexName) {
        super("Index '" + indexName + "' does not exist");
        this.indexName = indexName;
    }

    public String getIndexName() {
        return indexName;
    }
}
