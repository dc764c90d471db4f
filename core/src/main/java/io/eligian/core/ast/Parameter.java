package io.eligian.core.ast;

/**
 * Declared action parameter.
 *
 * @param name parameter name
 * @param type optional type annotation ({@code string}, {@code number}, ...), or {@code null}
 * @param location position of the name
 */
public record Parameter(String name, String type, SourceLocation location) implements Node {}
