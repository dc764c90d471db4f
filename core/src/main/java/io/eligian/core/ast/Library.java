package io.eligian.core.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A reusable set of actions, introduced by {@code library name}. Libraries cannot declare
 * timelines and cannot be compiled on their own.
 */
public record Library(
        String uri,
        String name,
        List<LibraryImport> libraryImports,
        List<ActionDefinition> actions,
        SourceLocation location)
        implements Document {

    public Library {
        libraryImports = List.copyOf(libraryImports);
        actions = List.copyOf(actions);
    }

    @Override
    public List<? extends Node> children() {
        List<Node> all = new ArrayList<>(libraryImports);
        all.addAll(actions);
        return all;
    }
}
