package io.eligian.core.ast;

public record BreakStatement(SourceLocation location) implements Statement {}
