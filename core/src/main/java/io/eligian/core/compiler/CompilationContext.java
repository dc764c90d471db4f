package io.eligian.core.compiler;

import io.eligian.core.ast.Document;
import io.eligian.core.ast.Program;
import io.eligian.core.library.ActionScope;
import io.eligian.core.library.DocumentIndex;
import io.eligian.core.library.LibraryDocument;
import io.eligian.core.validation.Diagnostic;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything one compilation knows about its documents: the parsed program, the loaded libraries,
 * the document index, the linked action scopes, asset data and the collected diagnostics.
 *
 * <p>Created fresh for every compilation and never shared, so two compilations cannot observe each
 * other's state. Not thread-safe.
 */
public final class CompilationContext {

    private final String sourceUri;
    private final CompileOptions options;
    private final IdGenerator ids;
    private final DocumentIndex index = new DocumentIndex();
    private final Map<String, ActionScope> scopes = new HashMap<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final List<String> cssFiles = new ArrayList<>();
    private Program program;
    private List<LibraryDocument> libraries = List.of();
    private String layoutTemplate;
    private CompilationStage failedStage;

    CompilationContext(CompileOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.sourceUri = options.sourceUri();
        this.ids = options.deterministicIds() ? IdGenerator.deterministic() : IdGenerator.random();
    }

    public String sourceUri() {
        return sourceUri;
    }

    public CompileOptions options() {
        return options;
    }

    IdGenerator ids() {
        return ids;
    }

    public Program program() {
        return program;
    }

    void program(Program parsed) {
        this.program = parsed;
    }

    public List<LibraryDocument> libraries() {
        return libraries;
    }

    void libraries(List<LibraryDocument> loaded) {
        this.libraries = List.copyOf(loaded);
    }

    public DocumentIndex index() {
        return index;
    }

    /** Records the linked scope of a document. */
    void scope(Document document, ActionScope scope) {
        scopes.put(key(document.uri()), scope);
    }

    /**
     * Linked scope of the document with the given URI.
     *
     * @throws IllegalStateException if the document has not been linked
     */
    public ActionScope scopeOf(String documentUri) {
        ActionScope scope = scopes.get(key(documentUri));
        if (scope == null) {
            throw new IllegalStateException("Document not linked: " + documentUri);
        }
        return scope;
    }

    /** HTML of the imported layout, or {@code null} when the program imports none. */
    public String layoutTemplate() {
        return layoutTemplate;
    }

    void layoutTemplate(String html) {
        this.layoutTemplate = html;
    }

    public List<String> cssFiles() {
        return List.copyOf(cssFiles);
    }

    void addCssFile(String path) {
        cssFiles.add(path);
    }

    /** Stage that threw, or {@code null} while no stage has failed. */
    CompilationStage failedStage() {
        return failedStage;
    }

    void failedStage(CompilationStage stage) {
        this.failedStage = stage;
    }

    void addDiagnostics(List<Diagnostic> found) {
        diagnostics.addAll(found);
    }

    /**
     * Diagnostics collected so far: the compiled document's first, then each library's in load
     * order, each by line and column.
     */
    public List<Diagnostic> diagnostics() {
        List<String> documents = new ArrayList<>();
        documents.add(sourceUri);
        for (LibraryDocument library : libraries) {
            documents.add(library.uri());
        }
        List<Diagnostic> sorted = new ArrayList<>(diagnostics);
        sorted.sort(Diagnostic.acrossDocuments(documents));
        return sorted;
    }

    private static String key(String uri) {
        return uri == null ? "" : uri;
    }
}
