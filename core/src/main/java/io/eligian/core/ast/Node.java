package io.eligian.core.ast;

import java.util.List;

/** Common contract of every syntax tree node. */
public interface Node {

    SourceLocation location();

    /** Direct child nodes in source order. */
    default List<? extends Node> children() {
        return List.of();
    }
}
