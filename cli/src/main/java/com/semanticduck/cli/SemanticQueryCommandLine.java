package com.semanticduck.cli;

import com.semanticduck.catalog.QuerySample;
import com.semanticduck.catalog.SampleCatalog;
import com.semanticduck.compiler.CompiledQuery;
import com.semanticduck.compiler.CompilerOptions;
import com.semanticduck.compiler.LiteralMode;
import com.semanticduck.exception.QueryExecutionException;
import com.semanticduck.exception.SemanticCompilationException;
import com.semanticduck.runtime.ExecutionConfig;
import com.semanticduck.runtime.QueryResult;
import com.semanticduck.runtime.ResultTableRenderer;

import java.io.PrintStream;
import java.util.List;

/**
 * Command-line interface for compiling and running the bundled query samples.
 *
 * <p>Usage examples:
 * <pre>
 * # Show the SQL generated for sample 3
 * java -jar semanticduck-cli.jar --sample 3
 *
 * # Compile every sample with escaped literals
 * java -jar semanticduck-cli.jar --sample all --literal-mode escaped
 *
 * # Execute sample 7 against a DuckDB file
 * java -Dsemanticduck.jdbcUrl=jdbc:duckdb:shop.db -jar semanticduck-cli.jar \
 *   --sample 7 --mode execute
 * </pre>
 */
public class SemanticQueryCommandLine {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private static final String RULE = "============================================================";

    private static final String USAGE =
        "Semantic Query Command Line Tool\n\n" +
        "Usage: java -jar semanticduck-cli.jar [OPTIONS]\n\n" +
        "Options:\n" +
        "  --sample NUM          Sample number (1-N) or 'all' for every sample (default: all)\n" +
        "  --mode MODE           compile or execute (default: compile)\n" +
        "  --literal-mode MODE   inline, escaped or parameterized (default: inline)\n" +
        "  --strict              Reject filters on fields the semantic layer does not define\n" +
        "  --help                Show this help message\n\n" +
        "Execution settings (system property / environment variable or .env entry):\n" +
        "  semanticduck.jdbcUrl / SEMANTICDUCK_JDBC_URL       DuckDB JDBC URL (default: jdbc:duckdb:)\n" +
        "  semanticduck.defaultSchema / DEFAULT_DATASET       Schema or catalog.schema for unqualified table names\n" +
        "  semanticduck.maxResults / MAX_RESULTS              Rows shown per query (default: 10)\n";

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Runs the tool.
     *
     * @param args command-line arguments
     * @param out standard output
     * @param err error output
     * @return the process exit code
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        CommandLineArgs parsedArgs;
        try {
            parsedArgs = parseArguments(args);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage() + "\n");
            err.println(USAGE);
            return EXIT_FAILURE;
        }

        if (parsedArgs.help) {
            out.println(USAGE);
            return EXIT_OK;
        }

        List<QuerySample> samples = SampleCatalog.load();
        List<QuerySample> selected;
        try {
            selected = select(samples, parsedArgs.sample);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }

        CompilerOptions options = CompilerOptions.builder()
            .literalMode(parsedArgs.literalMode)
            .strictFilterFields(parsedArgs.strict)
            .build();

        boolean failed = false;
        try (SemanticQueryClient client = new SemanticQueryClient(options, ExecutionConfig::fromEnvironment)) {
            for (QuerySample sample : selected) {
                if (!runSample(client, sample, parsedArgs.mode, out, err)) {
                    failed = true;
                }
                out.println();
            }
        } catch (RuntimeException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }
        return failed ? EXIT_FAILURE : EXIT_OK;
    }

    /**
     * Compiles and optionally executes one sample.
     *
     * @return false if the sample failed to compile
     */
    private static boolean runSample(SemanticQueryClient client, QuerySample sample, Mode mode,
                                     PrintStream out, PrintStream err) {
        out.println(RULE);
        out.println(sample.label());
        out.println(RULE);
        out.println("Query:          " + sample.request());
        out.println("Semantic Layer: " + sample.semanticLayer());
        out.println();

        CompiledQuery compiled;
        try {
            compiled = client.compile(sample);
        } catch (SemanticCompilationException e) {
            err.println("Error compiling " + sample.label() + ": " + e.getUserMessage());
            return false;
        }

        out.println("SQL Statement:");
        out.println(compiled.sql());
        if (compiled.isParameterized()) {
            out.println("Parameters: " + compiled.parameters());
        }

        if (mode == Mode.EXECUTE) {
            out.println();
            out.println("Results:");
            long startTime = System.currentTimeMillis();
            try {
                QueryResult result = client.execute(compiled);
                if (!result.isEmpty()) {
                    out.println("Total Rows: " + result.totalRows());
                    out.println("First " + client.getConfig().maxResults() + " Rows:");
                }
                out.println(ResultTableRenderer.render(result));
                out.println("Execution time: " + (System.currentTimeMillis() - startTime) + " ms");
            } catch (QueryExecutionException e) {
                out.println("An error occurred: " + e.getUserMessage());
            }
        }
        return true;
    }

    static List<QuerySample> select(List<QuerySample> samples, String sample) {
        if ("all".equalsIgnoreCase(sample)) {
            return samples;
        }
        int number;
        try {
            number = Integer.parseInt(sample);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid sample number: " + sample, e);
        }
        if (number < 1 || number > samples.size()) {
            throw new IllegalArgumentException(
                "Sample number must be between 1 and %d: %d".formatted(samples.size(), number));
        }
        return List.of(samples.get(number - 1));
    }

    /**
     * Parses command-line arguments.
     *
     * @throws IllegalArgumentException on an unknown option, a missing value or an invalid mode
     */
    static CommandLineArgs parseArguments(String[] args) {
        CommandLineArgs result = new CommandLineArgs();

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--sample" -> result.sample = valueOf(args, ++i, "--sample");
                case "--mode" -> result.mode = Mode.parse(valueOf(args, ++i, "--mode"));
                case "--literal-mode" -> result.literalMode = LiteralMode.parse(valueOf(args, ++i, "--literal-mode"));
                case "--strict" -> result.strict = true;
                case "--help", "-h" -> result.help = true;
                default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        return result;
    }

    private static String valueOf(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for " + option);
        }
        return args[index];
    }

    enum Mode {
        COMPILE,
        EXECUTE;

        static Mode parse(String value) {
            return switch (value.toLowerCase()) {
                case "compile" -> COMPILE;
                case "execute" -> EXECUTE;
                default -> throw new IllegalArgumentException(
                    "Invalid mode: " + value + ". Must be 'compile' or 'execute'");
            };
        }
    }

    /**
     * Container for parsed command-line arguments.
     */
    static class CommandLineArgs {
        String sample = "all";
        Mode mode = Mode.COMPILE;
        LiteralMode literalMode = LiteralMode.INLINE;
        boolean strict = false;
        boolean help = false;
    }
}
