package io.eligian.core.workspace;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.eligian.core.compiler.CompilationPipeline;
import io.eligian.core.compiler.CompileOptions;
import io.eligian.core.compiler.CompileResult;
import io.eligian.core.compiler.CompiledConfiguration;
import io.eligian.core.library.LibraryPathResolver;
import io.eligian.core.validation.Diagnostic;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("DocumentSession")
class DocumentSessionTest {

    private static final String MAIN = """
            import { fadeIn } from "./lib.eligian"
            timeline "main" in "#app" using raf {
              at 0s..1s fadeIn("#title")
            }
            """;

    @TempDir
    Path dir;

    private DocumentSession session;
    private String mainUri;
    private String libUri;

    @BeforeEach
    void setUp() throws IOException {
        session = new DocumentSession();
        Path lib = dir.resolve("lib.eligian");
        Files.writeString(lib, "library lib\naction fadeIn(selector) [ selectElement(selector) ]\n");
        Path main = dir.resolve("main.eligian");
        Files.writeString(main, MAIN);
        mainUri = main.toString();
        libUri = lib.toString();
    }

    @Test
    @DisplayName("documents that are not open are read from disk")
    void fallsBackToDisk() throws IOException {
        assertThat(session.diagnostics(mainUri)).isEmpty();
        assertThat(session.isOpen(mainUri)).isFalse();
    }

    @Test
    @DisplayName("an open buffer wins over the file on disk")
    void bufferOverridesDisk() throws IOException {
        session.open(mainUri, MAIN.replace("fadeIn(\"#title\")", "fadeOut(\"#title\")"));

        List<Diagnostic> diagnostics = session.diagnostics(mainUri);

        assertThat(diagnostics).extracting(Diagnostic::code).containsExactly("unknown_action");
    }

    @Test
    @DisplayName("editing an open library changes the diagnostics of its importers")
    void libraryEditsPropagate() throws IOException {
        assertThat(session.diagnostics(mainUri)).isEmpty();

        session.open(libUri, "library lib\naction fadeInn(selector) [ selectElement(selector) ]\n");
        assertThat(session.diagnostics(mainUri)).extracting(Diagnostic::code).contains("unknown_import");

        session.update(libUri, "library lib\naction fadeIn(selector) [ selectElement(selector) ]\n");
        assertThat(session.diagnostics(mainUri)).isEmpty();

        session.close(libUri);
        assertThat(session.openDocuments()).isEmpty();
    }

    @Test
    @DisplayName("diagnostics match a batch analysis of the same text")
    void parityWithPipeline() throws IOException {
        String broken = MAIN.replace("\"#title\"", "42, 43");
        session.open(mainUri, broken);

        List<Diagnostic> fromSession = session.diagnostics(mainUri);
        List<Diagnostic> fromPipeline =
                CompilationPipeline.builder().build().analyze(broken, LibraryPathResolver.normalize(mainUri));

        assertThat(fromSession).isNotEmpty().isEqualTo(fromPipeline);
    }

    @Test
    @DisplayName("open documents compile with their buffered text")
    void compileBuffer() throws IOException {
        session.open(mainUri, MAIN.replace("1s fadeIn", "3s fadeIn"));

        CompileResult<CompiledConfiguration> result =
                session.compile(mainUri, CompileOptions.builder().deterministicIds(true).build());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.value().ir().config().timelines().get(0).duration()).isEqualTo(3.0);
    }

    @Test
    @DisplayName("updating a document that is not open is rejected")
    void updateRequiresOpen() {
        assertThatThrownBy(() -> session.update(mainUri, "x"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageStartingWith("Document is not open: ");
    }

    @Test
    @DisplayName("open documents are listed by normalized URI")
    void openDocuments() {
        session.open(dir.resolve("sub/../main.eligian").toString(), MAIN);

        assertThat(session.openDocuments()).containsExactly(LibraryPathResolver.normalize(mainUri));
        assertThat(session.isOpen(mainUri)).isTrue();
    }

    @Test
    @DisplayName("a document that is neither open nor on disk is an I/O error")
    void missingDocument() {
        assertThatThrownBy(() -> session.diagnostics(dir.resolve("nope.eligian").toString()))
                .isInstanceOf(NoSuchFileException.class);
    }
}
