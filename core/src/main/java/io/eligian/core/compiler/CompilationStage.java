package io.eligian.core.compiler;

/** Pipeline stages, in execution order. */
public enum CompilationStage {
    PARSE,
    RESOLVE_LIBRARIES,
    VALIDATE,
    TRANSFORM,
    TYPE_CHECK,
    OPTIMIZE,
    EMIT
}
