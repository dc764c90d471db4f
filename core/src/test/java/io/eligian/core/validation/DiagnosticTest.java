package io.eligian.core.validation;

import static org.assertj.core.api.Assertions.assertThat;

import io.eligian.core.ast.SourceLocation;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DiagnosticTest {

    private static Diagnostic at(String file, int line, int column) {
        return Diagnostic.error("code", file + ":" + line + ":" + column, new SourceLocation(file, line, column, 1), null);
    }

    private static List<String> order(List<Diagnostic> diagnostics) {
        return diagnostics.stream().map(Diagnostic::message).toList();
    }

    @Test
    @DisplayName("documents are ordered by reporting position, not by file name")
    void acrossDocuments() {
        List<Diagnostic> diagnostics = new ArrayList<>(List.of(
                at("/p/a.eligian", 1, 24),
                at("/p/other.eligian", 1, 1),
                at("/p/main.eligian", 5, 1),
                at("/p/main.eligian", 2, 3)));

        diagnostics.sort(Diagnostic.acrossDocuments(List.of("/p/main.eligian", "/p/a.eligian")));

        assertThat(order(diagnostics))
                .containsExactly("/p/main.eligian:2:3", "/p/main.eligian:5:1", "/p/a.eligian:1:24", "/p/other.eligian:1:1");
    }

    @Test
    @DisplayName("an unsaved buffer without a URI is ranked like any other document")
    void unsavedBuffer() {
        List<Diagnostic> diagnostics = new ArrayList<>(List.of(at("/p/lib.eligian", 1, 1), at(null, 3, 1)));

        diagnostics.sort(Diagnostic.acrossDocuments(Arrays.asList(null, "/p/lib.eligian")));

        assertThat(order(diagnostics)).containsExactly("null:3:1", "/p/lib.eligian:1:1");
    }

    @Test
    @DisplayName("within one document diagnostics follow line, then column")
    void withinDocument() {
        List<Diagnostic> diagnostics =
                new ArrayList<>(List.of(at("/p/x.eligian", 4, 2), at("/p/x.eligian", 1, 9), at("/p/x.eligian", 4, 1)));

        diagnostics.sort(Diagnostic.DOCUMENT_ORDER);

        assertThat(order(diagnostics)).containsExactly("/p/x.eligian:1:9", "/p/x.eligian:4:1", "/p/x.eligian:4:2");
    }
}
