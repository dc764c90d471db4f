package io.eligian.core.ast;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Entry document of a compilation.
 *
 * @param uri source URI, or {@code null}
 * @param assetImports styles, layout, provider and named asset imports
 * @param libraryImports {@code import { a, b } from "./lib.eligian"} declarations
 * @param constants program-level {@code const} declarations, inlined at compile time
 * @param actions action definitions in declaration order
 * @param timelines timeline declarations
 * @param location position of the first token
 */
public record Program(
        String uri,
        List<AssetImport> assetImports,
        List<LibraryImport> libraryImports,
        List<VariableDeclaration> constants,
        List<ActionDefinition> actions,
        List<Timeline> timelines,
        SourceLocation location)
        implements Document {

    public Program {
        assetImports = List.copyOf(assetImports);
        libraryImports = List.copyOf(libraryImports);
        constants = List.copyOf(constants);
        actions = List.copyOf(actions);
        timelines = List.copyOf(timelines);
    }

    @Override
    public List<? extends Node> children() {
        List<Node> all = new ArrayList<>();
        all.addAll(assetImports);
        all.addAll(libraryImports);
        all.addAll(constants);
        all.addAll(actions);
        all.addAll(timelines);
        all.sort(Comparator.comparingInt((Node n) -> n.location().line())
                .thenComparingInt(n -> n.location().column()));
        return all;
    }
}
