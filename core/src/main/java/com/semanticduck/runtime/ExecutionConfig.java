package com.semanticduck.runtime;

import com.semanticduck.generator.SQLQuoting;
import io.github.cdimascio.dotenv.Dotenv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Function;

/**
 * Settings for running compiled statements.
 *
 * <p>{@link #fromEnvironment()} reads each setting from a system property,
 * falling back to an environment variable or a {@code .env} entry in the
 * working directory, then to the default. A process environment variable
 * wins over the same key in {@code .env}:
 * <table>
 *   <caption>Execution settings</caption>
 *   <tr><th>Property</th><th>Environment</th><th>Default</th></tr>
 *   <tr><td>semanticduck.jdbcUrl</td><td>SEMANTICDUCK_JDBC_URL</td><td>jdbc:duckdb:</td></tr>
 *   <tr><td>semanticduck.defaultSchema</td><td>DEFAULT_DATASET</td><td>(none)</td></tr>
 *   <tr><td>semanticduck.maxResults</td><td>MAX_RESULTS</td><td>10</td></tr>
 * </table>
 *
 * <p>A max-results value that is not a positive integer falls back to the default.
 * The default schema is either {@code schema} or {@code catalog.schema}.
 */
public final class ExecutionConfig {

    private static final Logger logger = LoggerFactory.getLogger(ExecutionConfig.class);

    public static final String DEFAULT_JDBC_URL = "jdbc:duckdb:";
    public static final int DEFAULT_MAX_RESULTS = 10;

    static final String PROP_JDBC_URL = "semanticduck.jdbcUrl";
    static final String PROP_DEFAULT_SCHEMA = "semanticduck.defaultSchema";
    static final String PROP_MAX_RESULTS = "semanticduck.maxResults";

    static final String ENV_JDBC_URL = "SEMANTICDUCK_JDBC_URL";
    static final String ENV_DEFAULT_SCHEMA = "DEFAULT_DATASET";
    static final String ENV_MAX_RESULTS = "MAX_RESULTS";

    private final String jdbcUrl;
    private final String defaultSchema;
    private final int maxResults;

    /**
     * Creates an execution config.
     *
     * @param jdbcUrl the DuckDB JDBC URL
     * @param defaultSchema the schema unqualified table names resolve in, or null
     * @param maxResults the maximum number of rows kept per result
     * @throws IllegalArgumentException if the schema is not a plain or
     *         catalog-qualified identifier, or maxResults is not positive
     */
    public ExecutionConfig(String jdbcUrl, String defaultSchema, int maxResults) {
        this.jdbcUrl = Objects.requireNonNull(jdbcUrl, "jdbcUrl must not be null");
        if (defaultSchema != null) {
            SQLQuoting.validateQualifiedIdentifier(defaultSchema);
        }
        if (maxResults <= 0) {
            throw new IllegalArgumentException("maxResults must be positive: " + maxResults);
        }
        this.defaultSchema = defaultSchema;
        this.maxResults = maxResults;
    }

    /**
     * In-memory DuckDB, no default schema, default row cap.
     *
     * @return the config
     */
    public static ExecutionConfig inMemory() {
        return new ExecutionConfig(DEFAULT_JDBC_URL, null, DEFAULT_MAX_RESULTS);
    }

    /**
     * Reads the config from system properties, the process environment and
     * the {@code .env} file in the working directory, if there is one.
     *
     * @return the config
     */
    public static ExecutionConfig fromEnvironment() {
        return fromEnvironment(Dotenv.configure().ignoreIfMissing().load());
    }

    /**
     * Reads the config from system properties, the process environment and
     * the {@code .env} file in the given directory, if there is one.
     *
     * @param directory the directory holding the {@code .env} file
     * @return the config
     */
    public static ExecutionConfig fromEnvironment(Path directory) {
        Objects.requireNonNull(directory, "directory must not be null");
        return fromEnvironment(Dotenv.configure()
            .directory(directory.toAbsolutePath().toString())
            .filename(".env")
            .ignoreIfMissing()
            .load());
    }

    private static ExecutionConfig fromEnvironment(Dotenv dotenv) {
        return from(System::getProperty, dotenv::get);
    }

    /**
     * Reads the config from the given lookups.
     *
     * @param properties property lookup, consulted first
     * @param environment environment lookup, consulted second
     * @return the config
     */
    public static ExecutionConfig from(Function<String, String> properties,
                                       Function<String, String> environment) {
        String jdbcUrl = lookup(properties, environment, PROP_JDBC_URL, ENV_JDBC_URL);
        String schema = lookup(properties, environment, PROP_DEFAULT_SCHEMA, ENV_DEFAULT_SCHEMA);
        String maxResults = lookup(properties, environment, PROP_MAX_RESULTS, ENV_MAX_RESULTS);

        return new ExecutionConfig(
            jdbcUrl != null ? jdbcUrl : DEFAULT_JDBC_URL,
            schema,
            parseMaxResults(maxResults));
    }

    public String jdbcUrl() {
        return jdbcUrl;
    }

    /**
     * Returns the default schema.
     *
     * @return the schema name, or null when none is configured
     */
    public String defaultSchema() {
        return defaultSchema;
    }

    public int maxResults() {
        return maxResults;
    }

    private static String lookup(Function<String, String> properties,
                                 Function<String, String> environment,
                                 String property, String variable) {
        String value = properties.apply(property);
        if (value == null || value.isBlank()) {
            value = environment.apply(variable);
        }
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static int parseMaxResults(String value) {
        if (value != null) {
            try {
                int parsed = Integer.parseInt(value);
                if (parsed > 0) {
                    return parsed;
                }
                logger.warn("Ignoring non-positive max results {}, using {}", parsed, DEFAULT_MAX_RESULTS);
            } catch (NumberFormatException e) {
                logger.warn("Ignoring invalid max results '{}', using {}", value, DEFAULT_MAX_RESULTS);
            }
        }
        return DEFAULT_MAX_RESULTS;
    }

    @Override
    public String toString() {
        return String.format("ExecutionConfig(jdbcUrl=%s, defaultSchema=%s, maxResults=%d)",
            jdbcUrl, defaultSchema, maxResults);
    }
}
