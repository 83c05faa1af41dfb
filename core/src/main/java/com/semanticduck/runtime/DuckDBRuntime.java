package com.semanticduck.runtime;

import com.semanticduck.generator.SQLQuoting;
import org.duckdb.DuckDBConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Objects;

/**
 * DuckDB runtime - owns a single DuckDB connection.
 *
 * <p>The runtime opens the connection, binds the default schema that
 * unqualified table names in compiled SQL resolve against, and closes the
 * connection when it is closed itself.
 *
 * <p>Test usage:
 * <pre>{@code
 * @BeforeEach
 * void setup() {
 *     runtime = DuckDBRuntime.create("jdbc:duckdb:");
 * }
 *
 * @AfterEach
 * void teardown() {
 *     runtime.close();
 * }
 * }</pre>
 */
public class DuckDBRuntime implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(DuckDBRuntime.class);

    private final String jdbcUrl;
    private final DuckDBConnection connection;
    private volatile String schema;
    private volatile boolean closed = false;

    private DuckDBRuntime(String jdbcUrl) throws SQLException {
        this.jdbcUrl = jdbcUrl;

        logger.info("Creating DuckDB runtime with URL: {}", jdbcUrl);

        Connection rawConn = DriverManager.getConnection(jdbcUrl);
        this.connection = rawConn.unwrap(DuckDBConnection.class);

        try (Statement stmt = connection.createStatement()) {
            stmt.execute("SET preserve_insertion_order=true");
        }
    }

    /**
     * Create a runtime for the JDBC URL, without binding a schema.
     *
     * @param jdbcUrl JDBC URL (e.g., "jdbc:duckdb:" for a private in-memory database)
     * @return new DuckDBRuntime instance
     * @throws IllegalStateException if the connection fails
     */
    public static DuckDBRuntime create(String jdbcUrl) {
        Objects.requireNonNull(jdbcUrl, "jdbcUrl must not be null");
        try {
            return new DuckDBRuntime(jdbcUrl);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to create DuckDB runtime: " + jdbcUrl, e);
        }
    }

    /**
     * Create a runtime from an execution config, binding its default schema if set.
     *
     * @param config the execution settings
     * @return new DuckDBRuntime instance
     * @throws IllegalStateException if the connection fails or the schema cannot be bound
     */
    public static DuckDBRuntime create(ExecutionConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        DuckDBRuntime runtime = create(config.jdbcUrl());
        if (config.defaultSchema() != null) {
            try {
                runtime.useSchema(config.defaultSchema());
            } catch (IllegalStateException e) {
                runtime.close();
                throw e;
            }
        }
        return runtime;
    }

    /**
     * Makes unqualified table names resolve in the given schema.
     *
     * <p>A {@code catalog.schema} name switches the current catalog as well.
     *
     * @param schemaName a plain or catalog-qualified identifier naming an existing schema
     * @throws IllegalArgumentException if the name is not a plain or qualified identifier
     * @throws IllegalStateException if DuckDB rejects the schema
     */
    public void useSchema(String schemaName) {
        SQLQuoting.validateQualifiedIdentifier(schemaName);
        checkOpen();
        String sql = schemaName.indexOf('.') >= 0
            ? "USE " + schemaName
            : "SET schema = " + SQLQuoting.quoteLiteral(schemaName);
        try (Statement stmt = connection.createStatement()) {
            stmt.execute(sql);
            this.schema = schemaName;
            logger.info("Default schema set to {}", schemaName);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to set default schema: " + schemaName, e);
        }
    }

    /**
     * Get the DuckDB connection owned by this runtime.
     *
     * @return the connection
     * @throws IllegalStateException if the runtime has been closed
     */
    public DuckDBConnection getConnection() {
        checkOpen();
        return connection;
    }

    public String getJdbcUrl() {
        return jdbcUrl;
    }

    /**
     * @return the bound schema, or null if none was set
     */
    public String getSchema() {
        return schema;
    }

    public boolean isClosed() {
        return closed;
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("DuckDB runtime is closed: " + jdbcUrl);
        }
    }

    /**
     * Close the runtime and its connection. Calling close more than once has no effect.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            connection.close();
            logger.info("DuckDB runtime closed: {}", jdbcUrl);
        } catch (SQLException e) {
            logger.warn("Error closing DuckDB connection: {}", jdbcUrl, e);
        }
    }
}
