package com.entity.canonical.search;

/**
 * Document fields a query clause can target.
 */
public enum SearchField {
    CNAME("cname"),
    WHITELIST("whitelist");

    private final String fieldName;

    SearchField(String fieldName) {
        this.fieldName = fieldName;
    }

    public String getFieldName() {
        return fieldName;
    }
}
