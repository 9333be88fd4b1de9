package com.sqlshaper.parser;

/**
 * Limits applied while parsing.
 *
 * <p>Immutable; create with {@link #defaults()} or {@link #builder()}.
 */
public final class ParserConfig {

    /** Default maximum nesting of expressions and subqueries. */
    public static final int DEFAULT_MAX_NESTING_DEPTH = 128;

    private static final ParserConfig DEFAULTS = builder().build();

    private final int maxNestingDepth;

    private ParserConfig(Builder builder) {
        this.maxNestingDepth = builder.maxNestingDepth;
    }

    public static ParserConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns how deeply expressions and queries may nest before parsing fails.
     */
    public int maxNestingDepth() {
        return maxNestingDepth;
    }

    @Override
    public String toString() {
        return "ParserConfig(maxNestingDepth=" + maxNestingDepth + ")";
    }

    public static final class Builder {

        private int maxNestingDepth = DEFAULT_MAX_NESTING_DEPTH;

        private Builder() {
        }

        /**
         * @throws IllegalArgumentException if {@code depth} is not positive
         */
        public Builder maxNestingDepth(int depth) {
            if (depth <= 0) {
                throw new IllegalArgumentException("maxNestingDepth must be positive: " + depth);
            }
            this.maxNestingDepth = depth;
            return this;
        }

        public ParserConfig build() {
            return new ParserConfig(this);
        }
    }
}
