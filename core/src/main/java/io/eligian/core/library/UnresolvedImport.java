package io.eligian.core.library;

import io.eligian.core.ast.SourceLocation;
import java.util.List;

/**
 * A name in an {@code import { ... }} list that could not be bound.
 *
 * @param name the imported name
 * @param libraryPath library path as written in the import
 * @param reason why the name is not bound
 * @param location position of the import declaration
 * @param candidates public action names of the library, for suggestions
 */
public record UnresolvedImport(
        String name, String libraryPath, Reason reason, SourceLocation location, List<String> candidates) {

    /** Why an import failed to bind. */
    public enum Reason {
        /** The library has no action with this name. */
        NOT_FOUND,
        /** The action exists but is declared {@code private}. */
        PRIVATE,
        /** The library itself was not part of the indexed set. */
        LIBRARY_NOT_INDEXED
    }

    public UnresolvedImport {
        candidates = List.copyOf(candidates);
    }
}
