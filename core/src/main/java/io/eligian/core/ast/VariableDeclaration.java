package io.eligian.core.ast;

import java.util.List;

/** {@code const name = value}, at program level or inside an action body. */
public record VariableDeclaration(String name, Expression value, SourceLocation location) implements Statement {

    @Override
    public List<? extends Node> children() {
        return List.of(value);
    }
}
