package com.semanticduck.compiler;

import java.util.Objects;

/**
 * Immutable settings for {@link SemanticQueryCompiler}.
 *
 * <p>The defaults reproduce the compatibility behavior: inline, unescaped
 * string literals and heuristic routing of unknown filter fields to HAVING.
 *
 * <pre>
 *   CompilerOptions strict = CompilerOptions.builder()
 *       .literalMode(LiteralMode.PARAMETERIZED)
 *       .strictFilterFields(true)
 *       .build();
 * </pre>
 */
public final class CompilerOptions {

    private static final CompilerOptions DEFAULTS = builder().build();

    private final LiteralMode literalMode;
    private final boolean strictFilterFields;

    private CompilerOptions(Builder builder) {
        this.literalMode = builder.literalMode;
        this.strictFilterFields = builder.strictFilterFields;
    }

    public static CompilerOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public LiteralMode literalMode() {
        return literalMode;
    }

    /**
     * When true, a filter whose field is neither a resolved dimension alias nor
     * a resolved metric name fails the compilation instead of going to HAVING.
     *
     * @return whether filter fields are validated
     */
    public boolean strictFilterFields() {
        return strictFilterFields;
    }

    @Override
    public String toString() {
        return String.format("CompilerOptions(literalMode=%s, strictFilterFields=%s)",
            literalMode, strictFilterFields);
    }

    public static final class Builder {
        private LiteralMode literalMode = LiteralMode.INLINE;
        private boolean strictFilterFields = false;

        private Builder() {}

        public Builder literalMode(LiteralMode literalMode) {
            this.literalMode = Objects.requireNonNull(literalMode, "literalMode must not be null");
            return this;
        }

        public Builder strictFilterFields(boolean strictFilterFields) {
            this.strictFilterFields = strictFilterFields;
            return this;
        }

        public CompilerOptions build() {
            return new CompilerOptions(this);
        }
    }
}
