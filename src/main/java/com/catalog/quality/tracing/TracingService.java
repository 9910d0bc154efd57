package com.catalog.quality.tracing;

import java.util.Map;

/**
 * Starts spans around normalization runs, analysis passes and aggregations.
 */
public interface TracingService {

    default Span startSpan(String operationName) {
        return startSpan(operationName, Map.of());
    }

    Span startSpan(String operationName, Map<String, String> attributes);
}
