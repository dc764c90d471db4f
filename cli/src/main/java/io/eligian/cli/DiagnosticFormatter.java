package io.eligian.cli;

import io.eligian.core.ast.SourceLocation;
import io.eligian.core.validation.Diagnostic;
import java.util.List;
import java.util.Locale;

/**
 * Console rendering of diagnostics, one per block:
 *
 * <pre>
 * main.eligian:4:3: error [parameter_type] Parameter 'selector' expects type 'string' but got 'number'
 *   hint: Provide a string value for parameter 'selector'
 * </pre>
 */
final class DiagnosticFormatter {

    private DiagnosticFormatter() {}

    static String format(Diagnostic diagnostic) {
        StringBuilder sb = new StringBuilder();
        SourceLocation location = diagnostic.location();
        if (location != null) {
            sb.append(location).append(": ");
        }
        sb.append(diagnostic.severity().name().toLowerCase(Locale.ROOT));
        if (diagnostic.code() != null) {
            sb.append(" [").append(diagnostic.code()).append(']');
        }
        sb.append(' ').append(diagnostic.message());
        if (diagnostic.hint() != null) {
            sb.append(System.lineSeparator()).append("  hint: ").append(diagnostic.hint());
        }
        return sb.toString();
    }

    static String formatAll(List<Diagnostic> diagnostics) {
        StringBuilder sb = new StringBuilder();
        for (Diagnostic diagnostic : diagnostics) {
            sb.append(format(diagnostic)).append(System.lineSeparator());
        }
        return sb.toString();
    }
}
