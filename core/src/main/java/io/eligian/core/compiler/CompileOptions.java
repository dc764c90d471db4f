package io.eligian.core.compiler;

/**
 * Options for one compilation.
 *
 * @param optimize run the optimizer stage
 * @param minify emit compact JSON instead of pretty-printed JSON
 * @param sourceUri URI of the source, used to resolve library and asset imports; {@code null} for
 *     in-memory sources
 * @param deterministicIds derive generated ids from a counter instead of random UUIDs
 */
public record CompileOptions(boolean optimize, boolean minify, String sourceUri, boolean deterministicIds) {

    /** Optimize on, minify off, no source URI, random ids. */
    public static CompileOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public CompileOptions withSourceUri(String uri) {
        return new CompileOptions(optimize, minify, uri, deterministicIds);
    }

    /** Builder for {@link CompileOptions}. */
    public static final class Builder {

        private boolean optimize = true;
        private boolean minify;
        private String sourceUri;
        private boolean deterministicIds;

        Builder() {}

        public Builder optimize(boolean value) {
            this.optimize = value;
            return this;
        }

        public Builder minify(boolean value) {
            this.minify = value;
            return this;
        }

        public Builder sourceUri(String value) {
            this.sourceUri = value;
            return this;
        }

        public Builder deterministicIds(boolean value) {
            this.deterministicIds = value;
            return this;
        }

        public CompileOptions build() {
            return new CompileOptions(optimize, minify, sourceUri, deterministicIds);
        }
    }
}
