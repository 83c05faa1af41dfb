package com.semanticduck.cli;

import com.semanticduck.catalog.QuerySample;
import com.semanticduck.compiler.CompiledQuery;
import com.semanticduck.compiler.CompilerOptions;
import com.semanticduck.compiler.SemanticQueryCompiler;
import com.semanticduck.runtime.DuckDBRuntime;
import com.semanticduck.runtime.ExecutionConfig;
import com.semanticduck.runtime.QueryExecutor;
import com.semanticduck.runtime.QueryResult;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Programmatic client for compiling and running query samples.
 *
 * <p>The execution settings are resolved and the DuckDB connection is opened
 * on the first {@link #execute} call, so a client used only for compilation
 * never reads them or touches the database.
 *
 * <p>Usage example:
 * <pre>
 * try (SemanticQueryClient client = new SemanticQueryClient(CompilerOptions.defaults(),
 *                                                           ExecutionConfig::fromEnvironment)) {
 *     CompiledQuery sql = client.compile(sample);
 *     QueryResult result = client.execute(sql);
 * }
 * </pre>
 */
public class SemanticQueryClient implements AutoCloseable {

    private final SemanticQueryCompiler compiler;
    private final Supplier<ExecutionConfig> configSource;
    private ExecutionConfig config;
    private DuckDBRuntime runtime;
    private QueryExecutor executor;

    public SemanticQueryClient(CompilerOptions options, ExecutionConfig config) {
        this(options, supplierOf(Objects.requireNonNull(config, "config must not be null")));
    }

    /**
     * Creates a client whose execution settings are read on first use.
     *
     * @param options compiler options
     * @param configSource supplies the execution settings
     */
    public SemanticQueryClient(CompilerOptions options, Supplier<ExecutionConfig> configSource) {
        this.compiler = new SemanticQueryCompiler(Objects.requireNonNull(options, "options must not be null"));
        this.configSource = Objects.requireNonNull(configSource, "configSource must not be null");
    }

    private static Supplier<ExecutionConfig> supplierOf(ExecutionConfig config) {
        return () -> config;
    }

    /**
     * Compiles a sample's request against its semantic layer.
     *
     * @param sample the sample
     * @return the compiled statement
     * @throws com.semanticduck.exception.SemanticCompilationException if compilation fails
     */
    public CompiledQuery compile(QuerySample sample) {
        return compiler.compileQuery(sample.request(), sample.semanticLayer());
    }

    /**
     * Runs a compiled statement, opening the runtime on first use.
     *
     * @param query the compiled statement
     * @return the capped result
     * @throws com.semanticduck.exception.QueryExecutionException if execution fails
     */
    public QueryResult execute(CompiledQuery query) {
        if (executor == null) {
            ExecutionConfig settings = getConfig();
            runtime = DuckDBRuntime.create(settings);
            executor = new QueryExecutor(runtime, settings.maxResults());
        }
        return executor.execute(query);
    }

    /**
     * Returns the execution settings, reading them on first call.
     *
     * @return the settings
     * @throws IllegalArgumentException if the configured settings are invalid
     */
    public ExecutionConfig getConfig() {
        if (config == null) {
            config = Objects.requireNonNull(configSource.get(), "configSource returned null");
        }
        return config;
    }

    @Override
    public void close() {
        if (runtime != null) {
            runtime.close();
        }
    }
}
