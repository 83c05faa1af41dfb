package com.semanticduck.runtime;

import com.semanticduck.catalog.SemanticCatalog;
import com.semanticduck.compiler.CompiledQuery;
import com.semanticduck.compiler.CompilerOptions;
import com.semanticduck.compiler.LiteralMode;
import com.semanticduck.compiler.SemanticQueryCompiler;
import com.semanticduck.exception.QueryExecutionException;
import com.semanticduck.logging.QueryLogger;
import com.semanticduck.model.QueryRequest;
import com.semanticduck.model.SemanticLayer;
import com.semanticduck.test.TestBase;
import com.semanticduck.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.sql.Statement;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

/**
 * Runs compiled statements against an in-memory DuckDB holding the order fixtures.
 */
@TestCategories.Tier2
@TestCategories.Integration
@DisplayName("QueryExecutor Tests")
public class QueryExecutorTest extends TestBase {

    private DuckDBRuntime runtime;
    private QueryExecutor executor;
    private SemanticQueryCompiler compiler;

    @Override
    protected void doSetUp() throws Exception {
        runtime = DuckDBRuntime.create(ExecutionConfig.DEFAULT_JDBC_URL);
        createShopTables(runtime.getConnection(), null);
        executor = new QueryExecutor(runtime);
        compiler = new SemanticQueryCompiler();
    }

    @Override
    protected void doTearDown() {
        if (runtime != null) {
            runtime.close();
        }
    }

    private static List<Object> column(QueryResult result, int index) {
        return result.rows().stream().map(row -> row.get(index)).collect(Collectors.toList());
    }

    @Nested
    @DisplayName("Compiled Statements")
    class CompiledStatements {

        @Test
        @DisplayName("Metric-only statement returns one aggregate row")
        void testSingleMetric() {
            String sql = compiler.compile(QueryRequest.ofMetrics("total_revenue"), revenueLayer());

            QueryResult result = executor.execute(sql);

            assertThat(result.columns()).containsExactly("total_revenue");
            assertThat(result.totalRows()).isEqualTo(1);
            assertThat((BigDecimal) result.rows().get(0).get(0)).isEqualByComparingTo("2470.00");
        }

        @Test
        @DisplayName("Metric filter over a join keeps only qualifying groups")
        void testHavingAcrossJoin() {
            QueryRequest request = QueryRequest.ofMetrics("total_revenue")
                .withDimensions("order_id", "gender")
                .withFilter(filter("total_revenue", ">", 1000));

            String sql = compiler.compile(request, revenueAcrossTablesLayer());
            logData("Generated SQL", sql);
            QueryResult result = executor.execute(sql);

            assertThat(result.columns()).containsExactly("total_revenue", "order_id", "gender");
            assertThat(column(result, 1)).containsExactlyInAnyOrder(1, 4);
            assertThat(column(result, 2)).containsOnly("F");
        }

        @Test
        @DisplayName("Dimension filter resolved through the catalog applies before aggregation")
        void testWhereThroughCatalog() {
            QueryRequest request = QueryRequest.ofMetrics("count_of_orders")
                .withDimensions("status")
                .withFilter(filter("gender", "=", "F"));
            SemanticLayer layer = SemanticCatalog.of(orderCountLayer()).resolve(request);

            QueryResult result = executor.execute(compiler.compile(request, layer));

            assertThat(result.totalRows()).isEqualTo(3);
            assertThat(column(result, 1)).containsExactlyInAnyOrder("Complete", "Cancelled", "Shipped");
            assertThat(column(result, 0)).containsOnly(1L);
        }

        @Test
        @DisplayName("Parameterized statement binds WHERE and HAVING values")
        void testParameterized() {
            SemanticQueryCompiler parameterized = new SemanticQueryCompiler(
                CompilerOptions.builder().literalMode(LiteralMode.PARAMETERIZED).build());
            QueryRequest request = QueryRequest.ofMetrics("total_revenue")
                .withDimensions("order_id", "gender")
                .withFilter(filter("gender", "=", "F"))
                .withFilter(filter("total_revenue", "<", 100));

            CompiledQuery query = parameterized.compileQuery(request, revenueAcrossTablesLayer());
            QueryResult result = executor.execute(query);

            assertThat(query.parameters()).containsExactly("F", 100);
            assertThat(column(result, 1)).containsExactly(3);
        }

        @Test
        @DisplayName("Filter on an unknown field fails at execution, not compilation")
        void testUnknownFieldFailsInWarehouse() {
            QueryRequest request = QueryRequest.ofMetrics("total_revenue")
                .withFilter(filter("revenu", ">", 1));
            String sql = compiler.compile(request, revenueLayer());

            assertThatThrownBy(() -> executor.execute(sql))
                .isInstanceOf(QueryExecutionException.class)
                .satisfies(e -> {
                    QueryExecutionException ex = (QueryExecutionException) e;
                    assertThat(ex.getFailedSQL()).isEqualTo(sql);
                    assertThat(ex.getUserMessage()).contains("revenu");
                });
        }
    }

    @Nested
    @DisplayName("Row Limits")
    class RowLimits {

        @Test
        @DisplayName("Rows beyond the limit are counted but not kept")
        void testRowCap() {
            QueryExecutor capped = new QueryExecutor(runtime, 2);

            QueryResult result = capped.execute("SELECT * FROM order_items ORDER BY id");

            assertThat(result.rows()).hasSize(2);
            assertThat(result.totalRows()).isEqualTo(7);
            assertThat(result.isTruncated()).isTrue();
            assertThat(column(result, 0)).containsExactly(1, 2);
        }

        @Test
        @DisplayName("Empty result is reported as empty")
        void testEmptyResult() {
            QueryResult result = executor.execute("SELECT * FROM orders WHERE status = 'Returned'");

            assertThat(result.isEmpty()).isTrue();
            assertThat(result.columns()).hasSize(4);
        }

        @Test
        @DisplayName("Non-positive limit is rejected")
        void testInvalidLimit() {
            assertThatThrownBy(() -> new QueryExecutor(runtime, 0))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Runtime Lifecycle")
    class RuntimeLifecycle {

        @Test
        @DisplayName("Unqualified tables resolve in the bound schema")
        void testSchemaBinding() throws Exception {
            createShopTables(runtime.getConnection(), "shop");
            try (Statement stmt = runtime.getConnection().createStatement()) {
                stmt.execute("DELETE FROM shop.order_items WHERE order_id <> 4");
            }

            runtime.useSchema("shop");
            QueryResult result = executor.execute(
                compiler.compile(QueryRequest.ofMetrics("total_revenue"), revenueLayer()));

            assertThat(runtime.getSchema()).isEqualTo("shop");
            assertThat((BigDecimal) result.rows().get(0).get(0)).isEqualByComparingTo("1200.00");
        }

        @Test
        @DisplayName("Catalog-qualified schema binds both parts")
        void testQualifiedSchemaBinding() throws Exception {
            createShopTables(runtime.getConnection(), "shop");
            try (Statement stmt = runtime.getConnection().createStatement()) {
                stmt.execute("DELETE FROM shop.order_items WHERE order_id <> 2");
            }

            runtime.useSchema("memory.shop");
            QueryResult result = executor.execute(
                compiler.compile(QueryRequest.ofMetrics("total_revenue"), revenueLayer()));

            assertThat(runtime.getSchema()).isEqualTo("memory.shop");
            assertThat((BigDecimal) result.rows().get(0).get(0)).isEqualByComparingTo("50.00");
        }

        @Test
        @DisplayName("Schema name must be a plain or catalog-qualified identifier")
        void testInvalidSchemaName() {
            assertThatThrownBy(() -> runtime.useSchema("shop; DROP TABLE orders"))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> runtime.useSchema("memory.shop.orders"))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Closed runtime refuses work and close is idempotent")
        void testClose() {
            runtime.close();
            runtime.close();

            assertThat(runtime.isClosed()).isTrue();
            assertThatThrownBy(() -> executor.execute("SELECT 1"))
                .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("Logging context is cleared after each query")
        void testLoggingContextCleared() {
            executor.execute("SELECT 1");

            assertThat(QueryLogger.currentQueryId()).isNull();
        }
    }
}
