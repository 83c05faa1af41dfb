package com.semanticduck.catalog;

import com.semanticduck.compiler.SemanticQueryCompiler;
import com.semanticduck.test.TestBase;
import com.semanticduck.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

/**
 * Compiles every bundled sample and checks the exact SQL produced.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("SampleCatalog Tests")
public class SampleCatalogTest extends TestBase {

    private static final String JOIN =
        "FROM orders JOIN order_items ON order_items.order_id = orders.order_id";

    static Stream<Arguments> expectedSql() {
        return Stream.of(
            Arguments.of(1,
                "SELECT SUM(sale_price) AS total_revenue FROM order_items"),
            Arguments.of(2,
                "SELECT SUM(sale_price) AS total_revenue, order_items.status FROM order_items " +
                "GROUP BY order_items.status"),
            Arguments.of(3,
                "SELECT SUM(sale_price) AS total_revenue, order_items.status FROM order_items " +
                "WHERE status = 'Complete' GROUP BY order_items.status"),
            Arguments.of(4,
                "SELECT COUNT(order_id) AS count_of_orders, orders.num_of_item FROM orders " +
                "WHERE num_of_item > 1 GROUP BY orders.num_of_item"),
            Arguments.of(5,
                "SELECT COUNT(order_id) AS count_of_orders, orders.num_of_item, orders.gender, orders.status " +
                "FROM orders WHERE status = 'Complete' AND gender = 'F' " +
                "GROUP BY orders.num_of_item, orders.gender, orders.status"),
            Arguments.of(6,
                "SELECT SUM(sale_price) AS total_revenue, order_items.order_id FROM order_items " +
                "GROUP BY order_items.order_id HAVING total_revenue > 1000"),
            Arguments.of(7,
                "SELECT SUM(sale_price) AS total_revenue, order_items.order_id, orders.gender, orders.status " +
                JOIN + " GROUP BY order_items.order_id, orders.gender, orders.status " +
                "HAVING total_revenue > 1000"),
            Arguments.of(8,
                "SELECT SUM(sale_price) AS total_revenue, orders.created_at AS ordered_date " +
                JOIN + " GROUP BY orders.created_at"));
    }

    @Test
    @DisplayName("Loads eight labelled samples")
    void testLoad() {
        List<QuerySample> samples = SampleCatalog.load();

        assertThat(samples).hasSize(8);
        assertThat(samples.get(0).label()).isEqualTo("Query#1");
        assertThat(samples.get(7).label()).isEqualTo("Query#8");
    }

    @ParameterizedTest(name = "Query#{0}")
    @MethodSource("expectedSql")
    @DisplayName("Each sample compiles to its expected SQL")
    void testSampleSql(int number, String expected) {
        QuerySample sample = SampleCatalog.load().get(number - 1);

        String sql = new SemanticQueryCompiler().compile(sample.request(), sample.semanticLayer());

        logData(sample.label(), sql);
        assertThat(sql).isEqualTo(expected);
    }

    @Test
    @DisplayName("Sample list is read-only")
    void testUnmodifiable() {
        List<QuerySample> samples = SampleCatalog.load();

        assertThatThrownBy(samples::clear).isInstanceOf(UnsupportedOperationException.class);
    }
}
