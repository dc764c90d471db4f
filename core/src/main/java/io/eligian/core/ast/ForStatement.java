package io.eligian.core.ast;

import java.util.ArrayList;
import java.util.List;

/** {@code for (item in collection) { ... }}. */
public record ForStatement(String itemName, Expression collection, List<Statement> body, SourceLocation location)
        implements Statement {

    public ForStatement {
        body = List.copyOf(body);
    }

    @Override
    public List<? extends Node> children() {
        List<Node> all = new ArrayList<>();
        all.add(collection);
        all.addAll(body);
        return all;
    }
}
