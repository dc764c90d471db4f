package io.eligian.core.validation;

import io.eligian.core.ast.Node;

/**
 * A semantic check for one kind of syntax node. Checks report through the context and never
 * throw for user errors.
 *
 * @param <T> the node type this check applies to
 */
@FunctionalInterface
public interface NodeCheck<T extends Node> {

    void check(T node, ValidationContext context);
}
