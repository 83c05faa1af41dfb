package com.semanticduck.model;

import com.semanticduck.test.TestBase;
import com.semanticduck.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Construction rules of the request and semantic layer types.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Model Validation Tests")
public class ModelValidationTest extends TestBase {

    @Nested
    @DisplayName("Filter Predicates")
    class FilterPredicates {

        @ParameterizedTest
        @ValueSource(strings = {"=", ">", "<", ">=", "<=", "!="})
        @DisplayName("Every supported operator symbol round-trips")
        void testOperatorSymbols(String symbol) {
            assertThat(ComparisonOperator.fromSymbol(symbol).symbol()).isEqualTo(symbol);
        }

        @Test
        @DisplayName("Operator symbol is trimmed")
        void testOperatorTrimmed() {
            assertThat(new FilterPredicate("status", " != ", "x").operator()).isEqualTo(ComparisonOperator.NOT_EQUAL);
        }

        @ParameterizedTest
        @ValueSource(strings = {"<>", "==", "LIKE", "IN", ""})
        @DisplayName("Unsupported operators are rejected")
        void testUnsupportedOperators(String symbol) {
            assertThatThrownBy(() -> new FilterPredicate("status", symbol, "x"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown comparison operator");
        }

        @Test
        @DisplayName("Boolean values are rejected")
        void testBooleanRejected() {
            assertThatThrownBy(() -> new FilterPredicate("is_gift", ComparisonOperator.EQUAL, Boolean.TRUE))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Boolean");
        }

        @Test
        @DisplayName("NaN and infinite values are rejected")
        void testNonFiniteRejected() {
            for (Object value : List.of(Double.NaN, Double.POSITIVE_INFINITY, Float.NEGATIVE_INFINITY)) {
                assertThatThrownBy(() -> new FilterPredicate("total_revenue", ComparisonOperator.GREATER_THAN, value))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("finite");
            }
            assertThat(new FilterPredicate("total_revenue", ">", 1.5d).isNumeric()).isTrue();
        }

        @Test
        @DisplayName("Null value is rejected")
        void testNullRejected() {
            assertThatThrownBy(() -> new FilterPredicate("status", ComparisonOperator.EQUAL, null))
                .isInstanceOf(NullPointerException.class);
        }

        @Test
        @DisplayName("Blank field is rejected")
        void testBlankField() {
            assertThatThrownBy(() -> new FilterPredicate("  ", "=", 1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("field must not be blank");
        }
    }

    @Nested
    @DisplayName("Query Requests")
    class QueryRequests {

        @Test
        @DisplayName("Repeated names are dropped, first occurrence wins")
        void testNamesDeduplicated() {
            QueryRequest request = new QueryRequest(
                Arrays.asList("total_revenue", "count_of_orders", "total_revenue"),
                Arrays.asList("status", "gender", "status"),
                null);

            assertThat(request.metricNames()).containsExactly("total_revenue", "count_of_orders");
            assertThat(request.dimensionNames()).containsExactly("status", "gender");
            assertThat(request.filters()).isEmpty();
        }

        @Test
        @DisplayName("Copies are independent of the caller's lists")
        void testCallerListsCopied() {
            List<String> metrics = new ArrayList<>(List.of("total_revenue"));
            QueryRequest request = new QueryRequest(metrics, null, null);

            metrics.add("count_of_orders");

            assertThat(request.metricNames()).containsExactly("total_revenue");
            assertThatThrownBy(() -> request.metricNames().add("x"))
                .isInstanceOf(UnsupportedOperationException.class);
        }

        @Test
        @DisplayName("withFilter returns a new request")
        void testWithFilterImmutable() {
            QueryRequest base = QueryRequest.ofMetrics("total_revenue");

            QueryRequest filtered = base.withFilter(filter("status", "=", "Complete"));

            assertThat(base.filters()).isEmpty();
            assertThat(filtered.filters()).hasSize(1);
        }
    }

    @Nested
    @DisplayName("Semantic Layers")
    class SemanticLayers {

        @Test
        @DisplayName("Duplicate metric names are rejected")
        void testDuplicateMetric() {
            assertThatThrownBy(() -> SemanticLayer.builder()
                    .metric("total_revenue", "SUM(sale_price)", "order_items")
                    .metric("total_revenue", "SUM(price)", "orders")
                    .build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Duplicate metric name: total_revenue");
        }

        @Test
        @DisplayName("A dimension may share a name with a metric")
        void testDimensionMetricNameOverlap() {
            SemanticLayer layer = SemanticLayer.builder()
                .metric("status", "COUNT(status)", "orders")
                .dimension("status", "status", "orders")
                .build();

            assertThat(layer.metricNames()).containsExactly("status");
            assertThat(layer.dimensionAliases()).containsExactly("status");
        }

        @Test
        @DisplayName("Name sets keep definition order")
        void testNameOrder() {
            SemanticLayer layer = SemanticLayer.builder()
                .metric("b", "SUM(b)", "t")
                .metric("a", "SUM(a)", "t")
                .dimension("z", "z", "t")
                .dimension("y", "y", "t")
                .build();

            assertThat(layer.metricNames()).containsExactly("b", "a");
            assertThat(layer.dimensionAliases()).containsExactly("z", "y");
        }
    }

    @Nested
    @DisplayName("Definitions")
    class Definitions {

        @Test
        @DisplayName("Dimension is aliased only when its name differs from its column")
        void testAliasing() {
            DimensionDefinition plain = new DimensionDefinition("status", "status", "orders");
            DimensionDefinition renamed = new DimensionDefinition("ordered_date", "created_at", "orders");

            assertThat(plain.isAliased()).isFalse();
            assertThat(renamed.isAliased()).isTrue();
            assertThat(renamed.qualifiedColumn()).isEqualTo("orders.created_at");
        }

        @Test
        @DisplayName("Join edge renders parent JOIN child ON condition")
        void testJoinSql() {
            assertThat(ORDERS_TO_ITEMS.toSQL())
                .isEqualTo("orders JOIN order_items ON order_items.order_id = orders.order_id");
        }

        @Test
        @DisplayName("Metric requires a table")
        void testMetricWithoutTable() {
            assertThatThrownBy(() -> new MetricDefinition("total_revenue", "SUM(sale_price)", null))
                .isInstanceOf(NullPointerException.class)
                .hasMessage("table must not be null");
        }
    }
}
