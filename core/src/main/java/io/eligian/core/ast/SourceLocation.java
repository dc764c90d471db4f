package io.eligian.core.ast;

/**
 * Position of a node in a source document. Lines and columns are 1-indexed; {@code length} is the
 * number of characters the node spans on its first line.
 *
 * @param file the document URI or path, or {@code null} for in-memory sources
 * @param line 1-indexed line
 * @param column 1-indexed column
 * @param length span length, at least 1
 */
public record SourceLocation(String file, int line, int column, int length) {

    /** Location used for synthesized nodes and whole-document errors. */
    public static SourceLocation start(String file) {
        return new SourceLocation(file, 1, 1, 1);
    }

    public SourceLocation {
        if (line < 1) {
            line = 1;
        }
        if (column < 1) {
            column = 1;
        }
        if (length < 1) {
            length = 1;
        }
    }

    /** Returns {@code true} if this location precedes {@code other} in the same document. */
    public boolean isBefore(SourceLocation other) {
        if (line != other.line) {
            return line < other.line;
        }
        return column < other.column;
    }

    @Override
    public String toString() {
        return (file != null ? file : "<source>") + ":" + line + ":" + column;
    }
}
