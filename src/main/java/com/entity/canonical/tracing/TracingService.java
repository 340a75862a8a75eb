package com.entity.canonical.tracing;

import java.util.Map;

/**
 * Opens spans around index rebuilds and fuzzy searches.
 */
public interface TracingService {

    String FIT = "entity.fit";
    String FUZZY_SEARCH = "entity.fuzzy_search";

    Span startSpan(String operation, Map<String, String> attributes);

    default Span startSpan(String operation) {
        return startSpan(operation, Map.of());
    }
}
