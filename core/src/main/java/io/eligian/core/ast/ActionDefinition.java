package io.eligian.core.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code [private] [endable] action name(params) [start] [end]}. A regular action has a single
 * body ({@code startBody}); an endable action also runs {@code endBody} when its timeline event
 * ends.
 */
public record ActionDefinition(
        String name,
        List<Parameter> parameters,
        List<Statement> startBody,
        List<Statement> endBody,
        boolean isPrivate,
        boolean endable,
        SourceLocation location)
        implements Node {

    public ActionDefinition {
        parameters = List.copyOf(parameters);
        startBody = List.copyOf(startBody);
        endBody = List.copyOf(endBody);
    }

    /** Returns the parameter with the given name, or {@code null}. */
    public Parameter parameter(String paramName) {
        for (Parameter p : parameters) {
            if (p.name().equals(paramName)) {
                return p;
            }
        }
        return null;
    }

    @Override
    public List<? extends Node> children() {
        List<Node> all = new ArrayList<>(parameters);
        all.addAll(startBody);
        all.addAll(endBody);
        return all;
    }
}
