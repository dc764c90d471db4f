package io.eligian.core.ir;

/**
 * Result of lowering a program: the configuration to emit, a source map for error reporting, and
 * compiler metadata.
 */
public record EligiusIR(ConfigurationIR config, SourceMap sourceMap, Metadata metadata) {

    /**
     * @param dslVersion language version the program was compiled as
     * @param compilerVersion compiler version
     * @param sourceFile URI of the entry document, or {@code null}
     */
    public record Metadata(String dslVersion, String compilerVersion, String sourceFile) {}

    public EligiusIR withConfig(ConfigurationIR newConfig) {
        return new EligiusIR(newConfig, sourceMap, metadata);
    }
}
