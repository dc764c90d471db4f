package io.eligian.core.ast;

public record ContinueStatement(SourceLocation location) implements Statement {}
