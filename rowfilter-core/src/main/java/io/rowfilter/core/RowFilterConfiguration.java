package io.rowfilter.core;

/**
 * Immutable configuration for row selection.
 * <p>
 * Use the builder pattern to create custom configurations:
 * <pre>
 * RowFilterConfiguration config = RowFilterConfiguration.builder()
 *     .codegenEnabled(false)
 *     .filterChunkSize(4096)
 *     .build();
 * </pre>
 * <p>
 * All configuration is immutable once built.
 */
public final class RowFilterConfiguration {

    /**
     * System property consulted for the default of {@link Builder#codegenEnabled(boolean)}.
     */
    public static final String CODEGEN_ENABLED_PROPERTY = "rowfilter.codegen.enabled";

    private static final RowFilterConfiguration DEFAULTS = builder().build();

    // Code generation configuration
    private final boolean codegenEnabled;
    private final int filterChunkSize;

    // Sorting configuration
    private final boolean enableParallelSorting;
    private final int parallelSortThreshold;

    private RowFilterConfiguration(Builder builder) {
        this.codegenEnabled = builder.codegenEnabled;
        this.filterChunkSize = builder.filterChunkSize;
        this.enableParallelSorting = builder.enableParallelSorting;
        this.parallelSortThreshold = builder.parallelSortThreshold;
    }

    /**
     * Create a new builder for RowFilterConfiguration.
     *
     * @return a new Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Configuration with every option at its default value.
     */
    public static RowFilterConfiguration defaults() {
        return DEFAULTS;
    }

    /**
     * Check if filter expressions may be compiled into generated loops.
     *
     * @return true if code generation is enabled
     */
    public boolean codegenEnabled() {
        return codegenEnabled;
    }

    /**
     * Number of rows handed to a compiled filter function per invocation.
     */
    public int filterChunkSize() {
        return filterChunkSize;
    }

    /**
     * Check if parallel sorting is enabled.
     *
     * @return true if parallel sorting is enabled
     */
    public boolean enableParallelSorting() {
        return enableParallelSorting;
    }

    /**
     * Get the threshold for using parallel sorting.
     *
     * @return the threshold in number of rows
     */
    public int parallelSortThreshold() {
        return parallelSortThreshold;
    }

    /**
     * Builder for RowFilterConfiguration.
     * <p>
     * Provides a fluent API for building configuration instances.
     */
    public static class Builder {
        private boolean codegenEnabled =
                !"false".equalsIgnoreCase(System.getProperty(CODEGEN_ENABLED_PROPERTY, "true"));
        private int filterChunkSize = 1024;
        private boolean enableParallelSorting = true;
        private int parallelSortThreshold = 1000;

        private Builder() {
        }

        /**
         * Enable or disable compilation of filter expressions.
         * When disabled, filters are evaluated eagerly into a boolean column.
         *
         * @param codegenEnabled true to enable code generation (default: true)
         * @return this builder for method chaining
         */
        public Builder codegenEnabled(boolean codegenEnabled) {
            this.codegenEnabled = codegenEnabled;
            return this;
        }

        /**
         * Set the number of rows processed per compiled filter call.
         *
         * @param filterChunkSize rows per chunk, must be positive
         * @return this builder for method chaining
         */
        public Builder filterChunkSize(int filterChunkSize) {
            if (filterChunkSize <= 0) {
                throw new IllegalArgumentException("filterChunkSize must be positive");
            }
            this.filterChunkSize = filterChunkSize;
            return this;
        }

        /**
         * Enable or disable parallel sorting.
         *
         * @param enableParallelSorting true to enable parallel sorting
         * @return this builder for method chaining
         */
        public Builder enableParallelSorting(boolean enableParallelSorting) {
            this.enableParallelSorting = enableParallelSorting;
            return this;
        }

        /**
         * Set the threshold for using parallel sorting.
         *
         * @param parallelSortThreshold the threshold in number of rows
         * @return this builder for method chaining
         */
        public Builder parallelSortThreshold(int parallelSortThreshold) {
            this.parallelSortThreshold = parallelSortThreshold;
            return this;
        }

        /**
         * Build the configuration.
         *
         * @return a new immutable RowFilterConfiguration instance
         */
        public RowFilterConfiguration build() {
            return new RowFilterConfiguration(this);
        }
    }
}
