package com.semanticduck.compiler;

import com.semanticduck.exception.SemanticCompilationException;
import com.semanticduck.model.QueryRequest;
import com.semanticduck.model.SemanticLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Compiles a {@link QueryRequest} against a {@link SemanticLayer} into a
 * single SQL statement.
 *
 * <p>Compilation runs four stages:
 * <ol>
 *   <li>context resolution and validation ({@link ContextResolver})</li>
 *   <li>table and grouping-column resolution</li>
 *   <li>filter classification into WHERE and HAVING ({@link PredicateClassifier})</li>
 *   <li>clause emission ({@link ClauseEmitter}) and assembly in the fixed
 *       order SELECT, FROM, WHERE, GROUP BY, HAVING</li>
 * </ol>
 *
 * <p>The compiler keeps no state between calls and never mutates its inputs;
 * one instance can serve any number of threads. Identical inputs always yield
 * identical SQL.
 *
 * <p>Example usage:
 * <pre>
 *   SemanticLayer layer = SemanticLayer.builder()
 *       .metric("total_revenue", "SUM(sale_price)", "order_items")
 *       .build();
 *   String sql = new SemanticQueryCompiler().compile(QueryRequest.ofMetrics("total_revenue"), layer);
 *   // SELECT SUM(sale_price) AS total_revenue FROM order_items
 * </pre>
 *
 * @see CompilerOptions
 */
public class SemanticQueryCompiler {

    private static final Logger logger = LoggerFactory.getLogger(SemanticQueryCompiler.class);

    private final CompilerOptions options;
    private final ContextResolver resolver;
    private final ClauseEmitter emitter;

    /**
     * Creates a compiler with default options.
     */
    public SemanticQueryCompiler() {
        this(CompilerOptions.defaults());
    }

    /**
     * Creates a compiler with the given options.
     *
     * @param options literal rendering and filter validation settings
     */
    public SemanticQueryCompiler(CompilerOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.resolver = new ContextResolver(new PredicateClassifier(options.strictFilterFields()));
        this.emitter = new ClauseEmitter(options.literalMode());
    }

    /**
     * Compiles a request to SQL.
     *
     * @param request the query request
     * @param semanticLayer the resolved semantic layer
     * @return the SQL statement
     * @throws SemanticCompilationException if the request cannot be compiled
     */
    public String compile(QueryRequest request, SemanticLayer semanticLayer) {
        return compileQuery(request, semanticLayer).sql();
    }

    /**
     * Compiles a request to SQL plus the values bound to its parameter markers.
     *
     * @param request the query request
     * @param semanticLayer the resolved semantic layer
     * @return the compiled query
     * @throws SemanticCompilationException if the request cannot be compiled
     */
    public CompiledQuery compileQuery(QueryRequest request, SemanticLayer semanticLayer) {
        CompilationContext context = resolver.resolve(request, semanticLayer);
        logger.debug("Resolved {}", context);

        List<Object> parameters = new ArrayList<>();
        List<String> clauses = new ArrayList<>();
        clauses.add(emitter.select(context));
        clauses.add(emitter.from(context));
        emitter.where(context, parameters).ifPresent(clauses::add);
        emitter.groupBy(context).ifPresent(clauses::add);
        emitter.having(context, parameters).ifPresent(clauses::add);

        String sql = String.join(" ", clauses);
        logger.debug("Compiled {} clause(s): {}", clauses.size(), sql);
        return new CompiledQuery(sql, parameters);
    }

    public CompilerOptions options() {
        return options;
    }
}
