package io.eligian.core.compiler;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.eligian.core.ir.EligiusIR;

/**
 * Output of a successful compilation.
 *
 * @param ir the (optimized) intermediate representation
 * @param config the emitted configuration tree, including {@code $schema}
 * @param json {@code config} serialized as requested by {@link CompileOptions#minify()}
 */
public record CompiledConfiguration(EligiusIR ir, ObjectNode config, String json) {}
