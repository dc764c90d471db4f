package io.eligian.cli.config;

/**
 * Settings of the command-line compiler.
 *
 * @param optimize run the optimizer stage
 * @param minify write compact JSON
 * @param outputDir directory for generated files, or {@code null} to write next to the source
 * @param loggingFormat {@code text} or {@code json}
 * @param loggingLevel root log level
 */
public record CompilerConfig(
        boolean optimize, boolean minify, String outputDir, String loggingFormat, String loggingLevel) {

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link CompilerConfig}. Defaults: optimize, pretty JSON, text logs at WARN. */
    public static final class Builder {

        private boolean optimize = true;
        private boolean minify;
        private String outputDir;
        private String loggingFormat = "text";
        private String loggingLevel = "WARN";

        Builder() {}

        public Builder optimize(boolean value) {
            this.optimize = value;
            return this;
        }

        public Builder minify(boolean value) {
            this.minify = value;
            return this;
        }

        public Builder outputDir(String value) {
            this.outputDir = value;
            return this;
        }

        public Builder loggingFormat(String value) {
            this.loggingFormat = value;
            return this;
        }

        public Builder loggingLevel(String value) {
            this.loggingLevel = value;
            return this;
        }

        public CompilerConfig build() {
            return new CompilerConfig(optimize, minify, outputDir, loggingFormat, loggingLevel);
        }
    }
}
