package com.semanticduck.exception;

/**
 * Base class for validation failures raised while compiling a query request.
 *
 * <p>Every subclass is raised before any clause is rendered, so a caller that
 * catches this exception never sees partially built SQL.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       String sql = compiler.compile(request, semanticLayer);
 *   } catch (SemanticCompilationException e) {
 *       System.err.println(e.getUserMessage());
 *       System.err.println("Error kind: " + e.kind());
 *   }
 * </pre>
 *
 * @see com.semanticduck.compiler.SemanticQueryCompiler
 */
public abstract class SemanticCompilationException extends RuntimeException {

    /**
     * Classifies compilation failures.
     */
    public enum ErrorKind {
        EMPTY_METRIC_SET,
        NO_TABLES_RESOLVED,
        MISSING_JOIN_PATH,
        UNKNOWN_FILTER_FIELD
    }

    private final ErrorKind kind;

    protected SemanticCompilationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    /**
     * Returns the kind of failure.
     *
     * @return the error kind
     */
    public ErrorKind kind() {
        return kind;
    }

    /**
     * Returns a short, actionable message for the person who wrote the request
     * or the semantic layer.
     *
     * @return user-friendly error message
     */
    public abstract String getUserMessage();

    /**
     * Returns a detailed technical message for debugging.
     *
     * @return technical error message with full context
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("Semantic Query Compilation Failed\n");
        sb.append("Kind: ").append(kind).append("\n");
        sb.append("Error: ").append(getMessage()).append("\n");
        return sb.toString();
    }
}
