package com.semanticduck.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.semanticduck.exception.CatalogException;
import com.semanticduck.model.DimensionDefinition;
import com.semanticduck.model.FilterPredicate;
import com.semanticduck.model.JoinEdge;
import com.semanticduck.model.MetricDefinition;
import com.semanticduck.model.QueryRequest;
import com.semanticduck.model.SemanticLayer;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads request and semantic layer documents from JSON.
 *
 * <p>Request document:
 * <pre>
 *   {"metrics": ["total_revenue"],
 *    "dimensions": ["status"],
 *    "filters": [{"field": "status", "operator": "=", "value": "Complete"}]}
 * </pre>
 *
 * <p>Semantic layer document ({@code sql} is the metric expression or the
 * dimension's raw column; a join's {@code one} side is the parent table and
 * its {@code many} side the child table):
 * <pre>
 *   {"metrics":    [{"name": "total_revenue", "sql": "SUM(sale_price)", "table": "order_items"}],
 *    "dimensions": [{"name": "status", "sql": "status", "table": "orders"}],
 *    "joins":      [{"one": "orders", "many": "order_items",
 *                    "join": "order_items.order_id = orders.order_id"}]}
 * </pre>
 *
 * <p>Only {@code metrics} is required in either document. Filter values must be
 * JSON numbers or strings.
 */
public final class SemanticDocumentReader {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private SemanticDocumentReader() {}

    /**
     * Parses a request document.
     *
     * @param json the JSON text
     * @return the request
     * @throws CatalogException if the document is malformed
     */
    public static QueryRequest readRequest(String json) {
        return readRequest(parse(json));
    }

    /**
     * Parses a semantic layer document.
     *
     * @param json the JSON text
     * @return the semantic layer
     * @throws CatalogException if the document is malformed
     */
    public static SemanticLayer readSemanticLayer(String json) {
        return readSemanticLayer(parse(json));
    }

    /**
     * Reads an array of {@code {"request": .., "semanticLayer": ..}} pairs.
     * Samples are labelled {@code Query#1}, {@code Query#2}, ... in file order.
     *
     * @param in the JSON stream; not closed by this method
     * @return the samples in file order
     * @throws CatalogException if the stream cannot be read or is malformed
     */
    public static List<QuerySample> readSamples(InputStream in) {
        JsonNode root;
        try {
            root = objectMapper.readTree(in);
        } catch (IOException e) {
            throw new CatalogException("Failed to read sample document: " + e.getMessage(), e);
        }
        if (root == null || !root.isArray()) {
            throw new CatalogException("Sample document must be a JSON array");
        }

        List<QuerySample> samples = new ArrayList<>();
        int index = 1;
        for (JsonNode node : root) {
            String label = "Query#" + index++;
            try {
                samples.add(new QuerySample(label,
                    readRequest(required(node, "request")),
                    readSemanticLayer(required(node, "semanticLayer"))));
            } catch (IllegalArgumentException e) {
                throw new CatalogException(label + ": " + e.getMessage(), e);
            }
        }
        return samples;
    }

    static QueryRequest readRequest(JsonNode node) {
        requireObject(node, "request");
        try {
            List<String> metrics = textArray(required(node, "metrics"), "metrics");
            List<String> dimensions = node.has("dimensions")
                ? textArray(node.get("dimensions"), "dimensions")
                : null;

            List<FilterPredicate> filters = new ArrayList<>();
            if (node.has("filters")) {
                for (JsonNode filter : array(node.get("filters"), "filters")) {
                    filters.add(new FilterPredicate(
                        text(filter, "field"),
                        text(filter, "operator"),
                        value(required(filter, "value"))));
                }
            }
            return new QueryRequest(metrics, dimensions, filters);
        } catch (IllegalArgumentException e) {
            throw new CatalogException("Invalid request document: " + e.getMessage(), e);
        }
    }

    static SemanticLayer readSemanticLayer(JsonNode node) {
        requireObject(node, "semantic layer");
        try {
            SemanticLayer.Builder builder = SemanticLayer.builder();
            for (JsonNode metric : array(required(node, "metrics"), "metrics")) {
                builder.metric(new MetricDefinition(
                    text(metric, "name"), text(metric, "sql"), text(metric, "table")));
            }
            if (node.has("dimensions")) {
                for (JsonNode dimension : array(node.get("dimensions"), "dimensions")) {
                    builder.dimension(new DimensionDefinition(
                        text(dimension, "name"), text(dimension, "sql"), text(dimension, "table")));
                }
            }
            if (node.has("joins")) {
                for (JsonNode join : array(node.get("joins"), "joins")) {
                    builder.join(new JoinEdge(
                        text(join, "one"), text(join, "many"), text(join, "join")));
                }
            }
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new CatalogException("Invalid semantic layer document: " + e.getMessage(), e);
        }
    }

    private static JsonNode parse(String json) {
        if (json == null || json.isEmpty()) {
            throw new CatalogException("Document cannot be null or empty");
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new CatalogException("Malformed JSON document: " + e.getOriginalMessage(), e);
        }
    }

    private static void requireObject(JsonNode node, String what) {
        if (node == null || !node.isObject()) {
            throw new CatalogException("The " + what + " document must be a JSON object");
        }
    }

    private static JsonNode required(JsonNode node, String key) {
        JsonNode child = node.get(key);
        if (child == null || child.isNull()) {
            throw new CatalogException("Missing required key '" + key + "'");
        }
        return child;
    }

    private static JsonNode array(JsonNode node, String key) {
        if (!node.isArray()) {
            throw new CatalogException("'" + key + "' must be a JSON array");
        }
        return node;
    }

    private static String text(JsonNode node, String key) {
        JsonNode child = required(node, key);
        if (!child.isTextual()) {
            throw new CatalogException("'" + key + "' must be a string");
        }
        return child.textValue();
    }

    private static List<String> textArray(JsonNode node, String key) {
        List<String> values = new ArrayList<>();
        for (JsonNode item : array(node, key)) {
            if (!item.isTextual()) {
                throw new CatalogException("'" + key + "' must contain only strings");
            }
            values.add(item.textValue());
        }
        return values;
    }

    private static Object value(JsonNode node) {
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        throw new CatalogException("Filter value must be a number or a string, got: " + node.getNodeType());
    }
}
