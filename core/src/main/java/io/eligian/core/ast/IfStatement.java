package io.eligian.core.ast;

import java.util.ArrayList;
import java.util.List;

/** {@code if (condition) { ... } else { ... }}; {@code elseBranch} is empty when absent. */
public record IfStatement(
        Expression condition, List<Statement> thenBranch, List<Statement> elseBranch, SourceLocation location)
        implements Statement {

    public IfStatement {
        thenBranch = List.copyOf(thenBranch);
        elseBranch = List.copyOf(elseBranch);
    }

    @Override
    public List<? extends Node> children() {
        List<Node> all = new ArrayList<>();
        all.add(condition);
        all.addAll(thenBranch);
        all.addAll(elseBranch);
        return all;
    }
}
