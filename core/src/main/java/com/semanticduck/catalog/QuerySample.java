package com.semanticduck.catalog;

import com.semanticduck.model.QueryRequest;
import com.semanticduck.model.SemanticLayer;

import java.util.Objects;

/**
 * A labelled request together with the semantic layer it is compiled against.
 */
public final class QuerySample {

    private final String label;
    private final QueryRequest request;
    private final SemanticLayer semanticLayer;

    public QuerySample(String label, QueryRequest request, SemanticLayer semanticLayer) {
        this.label = Objects.requireNonNull(label, "label must not be null");
        this.request = Objects.requireNonNull(request, "request must not be null");
        this.semanticLayer = Objects.requireNonNull(semanticLayer, "semanticLayer must not be null");
    }

    public String label() {
        return label;
    }

    public QueryRequest request() {
        return request;
    }

    public SemanticLayer semanticLayer() {
        return semanticLayer;
    }

    @Override
    public String toString() {
        return String.format("QuerySample(%s)", label);
    }
}
