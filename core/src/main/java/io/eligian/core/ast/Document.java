package io.eligian.core.ast;

import java.util.List;

/** Root of a parsed source file: either a {@link Program} or a {@link Library}. */
public interface Document extends Node {

    /** URI of the file this document was parsed from, or {@code null} for in-memory sources. */
    String uri();

    /** Library imports declared at the top of the document. */
    List<LibraryImport> libraryImports();

    /** Actions defined in this document. */
    List<ActionDefinition> actions();
}
