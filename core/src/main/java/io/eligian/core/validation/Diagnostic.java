package io.eligian.core.validation;

import io.eligian.core.ast.SourceLocation;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * A single finding reported against a source location. This is the shared currency of the batch
 * compiler and the editor session: both render the same list.
 *
 * @param message human-readable description
 * @param severity error, warning or info
 * @param location where the problem was found
 * @param code stable machine-readable identifier, e.g. {@code unknown_operation}
 * @param hint suggested fix, or {@code null}
 */
public record Diagnostic(String message, Severity severity, SourceLocation location, String code, String hint) {

    /** Orders diagnostics of one document by line, then column. */
    public static final Comparator<Diagnostic> DOCUMENT_ORDER =
            Comparator.comparingInt((Diagnostic d) -> d.location().line()).thenComparingInt(d -> d.location().column());

    /**
     * Orders diagnostics spread over several documents: by the position of their file in {@code
     * documents}, then by {@link #DOCUMENT_ORDER}. Files missing from the list sort last.
     *
     * @param documents document URIs in reporting order; may contain {@code null} for an unsaved buffer
     */
    public static Comparator<Diagnostic> acrossDocuments(List<String> documents) {
        List<String> order =
                documents.stream().map(uri -> uri == null ? "" : uri).toList();
        return Comparator.comparingInt((Diagnostic d) -> {
                    String file = d.location().file();
                    int index = order.indexOf(file == null ? "" : file);
                    return index < 0 ? order.size() : index;
                })
                .thenComparing(DOCUMENT_ORDER);
    }

    public Diagnostic {
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(location, "location must not be null");
        Objects.requireNonNull(code, "code must not be null");
    }

    public static Diagnostic error(String code, String message, SourceLocation location, String hint) {
        return new Diagnostic(message, Severity.ERROR, location, code, hint);
    }

    public static Diagnostic warning(String code, String message, SourceLocation location, String hint) {
        return new Diagnostic(message, Severity.WARNING, location, code, hint);
    }

    /** Converts a structured operation error into an error-severity diagnostic. */
    public static Diagnostic of(OperationValidationError error, SourceLocation location) {
        return new Diagnostic(error.message(), Severity.ERROR, location, error.code().id(), error.hint());
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }
}
