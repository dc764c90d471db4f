package io.eligian.core.library;

import io.eligian.core.ast.Document;
import io.eligian.core.ast.Library;
import io.eligian.core.ast.LibraryImport;
import io.eligian.core.ast.Program;
import io.eligian.core.ast.SourceLocation;
import io.eligian.core.error.ParseException;
import io.eligian.core.parse.SourceParser;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the transitive closure of libraries imported by a document.
 *
 * <p>Every recursive step works on its own copy of the loading path, so sibling imports never see
 * each other's state: a library imported from two places (a diamond) is loaded once, while a
 * library that reaches itself again is reported as a cycle with the full chain.
 */
public final class LibraryResolver {

    private static final Logger LOG = LoggerFactory.getLogger(LibraryResolver.class);

    private final ContentLoader contentLoader;
    private final SourceParser parser;
    private final LibraryCache cache;

    /**
     * @param contentLoader source of document text
     * @param parser parser for library documents
     * @param cache parsed-library cache, or {@code null} to parse every time
     */
    public LibraryResolver(ContentLoader contentLoader, SourceParser parser, LibraryCache cache) {
        this.contentLoader = Objects.requireNonNull(contentLoader, "contentLoader must not be null");
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.cache = cache;
    }

    /**
     * Loads all libraries imported, directly or transitively, by {@code entry}.
     *
     * @param entry the entry document; must have a URI
     * @return libraries in load order, each URI once
     * @throws ParseException for unreadable, non-library or cyclic imports
     */
    public List<LibraryDocument> resolveImports(Document entry) {
        Objects.requireNonNull(entry.uri(), "entry document must have a URI to resolve imports");
        Map<String, LibraryDocument> loaded = new LinkedHashMap<>();
        for (LibraryImport libraryImport : entry.libraryImports()) {
            String uri = LibraryPathResolver.resolve(entry.uri(), libraryImport.path());
            for (LibraryDocument doc : loadLibraryRecursive(uri, entry.uri(), Set.of(), libraryImport.location())) {
                loaded.putIfAbsent(doc.uri(), doc);
            }
        }
        LOG.debug("Libraries resolved: entry={}, libraries={}", entry.uri(), loaded.size());
        return List.copyOf(loaded.values());
    }

    /**
     * Loads one library and everything it imports.
     *
     * @param uri normalized URI of the library to load
     * @param importerUri URI of the importing document
     * @param loadingPath libraries currently being loaded on this branch, outermost first
     * @return {@code [self] + dependencies}, de-duplicated by URI
     * @throws ParseException if {@code uri} is already on the loading path, cannot be read, or is
     *     not a library
     */
    public List<LibraryDocument> loadLibraryRecursive(String uri, String importerUri, Set<String> loadingPath) {
        return loadLibraryRecursive(uri, importerUri, loadingPath, SourceLocation.start(importerUri));
    }

    private List<LibraryDocument> loadLibraryRecursive(
            String uri, String importerUri, Set<String> loadingPath, SourceLocation importLocation) {
        if (loadingPath.contains(uri)) {
            List<String> chain = new ArrayList<>(loadingPath);
            chain.add(uri);
            throw new ParseException(
                    "Circular dependency detected: " + String.join(" → ", chain),
                    importLocation,
                    "Remove circular import to break the cycle");
        }
        Set<String> path = new LinkedHashSet<>(loadingPath);
        path.add(uri);

        Library library = loadLibrary(uri, importLocation);
        Map<String, LibraryDocument> all = new LinkedHashMap<>();
        all.put(uri, new LibraryDocument(uri, library));
        for (LibraryImport nested : library.libraryImports()) {
            String nestedUri = LibraryPathResolver.resolve(uri, nested.path());
            for (LibraryDocument doc : loadLibraryRecursive(nestedUri, uri, path, nested.location())) {
                all.putIfAbsent(doc.uri(), doc);
            }
        }
        return List.copyOf(all.values());
    }

    private Library loadLibrary(String uri, SourceLocation importLocation) {
        String content;
        try {
            content = contentLoader.load(uri);
        } catch (NoSuchFileException e) {
            throw new ParseException(
                    "Failed to load library file: " + uri,
                    importLocation,
                    "Check that the file exists and the import path is correct",
                    e);
        } catch (IOException e) {
            throw new ParseException(
                    "Failed to load library file: " + uri + " (" + e.getMessage() + ")",
                    importLocation,
                    "Check that the file exists and is readable",
                    e);
        }

        if (cache != null) {
            Optional<Library> cached = cache.get(uri, content);
            if (cached.isPresent()) {
                LOG.debug("Library cache hit: uri={}", uri);
                return cached.get();
            }
        }

        Document document = parser.parse(content, uri);
        if (!(document instanceof Library)) {
            throw new ParseException(
                    "File is not a library (found " + describe(document) + " instead): " + uri,
                    importLocation,
                    "Library files must start with 'library <name>'");
        }
        Library library = (Library) document;
        if (cache != null) {
            cache.put(uri, content, library);
        }
        LOG.debug("Library loaded: uri={}, actions={}", uri, library.actions().size());
        return library;
    }

    private static String describe(Document document) {
        return document instanceof Program ? "program" : document.getClass().getSimpleName();
    }
}
