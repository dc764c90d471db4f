package io.eligian.core.ast;

import java.util.List;

/**
 * {@code import { fadeIn, fadeOut } from "./animations.eligian"}.
 *
 * @param names imported action names, in source order
 * @param path the library path as written
 * @param location position of the {@code import} keyword
 */
public record LibraryImport(List<String> names, String path, SourceLocation location) implements Node {

    public LibraryImport {
        names = List.copyOf(names);
    }
}
