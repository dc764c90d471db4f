package io.eligian.core.library;

import java.net.URI;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Resolves import paths relative to the importing document. Backslashes are treated as
 * separators and {@code .}/{@code ..} segments are normalized, so the same file always maps to the
 * same URI string.
 */
public final class LibraryPathResolver {

    private LibraryPathResolver() {}

    /**
     * Resolves {@code importPath} against the directory of {@code importerUri}.
     *
     * @param importerUri URI or path of the importing document
     * @param importPath path as written in the import, e.g. {@code ./lib/animations.eligian}
     * @return normalized absolute path string
     */
    public static String resolve(String importerUri, String importPath) {
        String normalizedImport = importPath.replace('\\', '/');
        Path target = Paths.get(normalizedImport);
        if (!target.isAbsolute()) {
            Path importer = toPath(importerUri).toAbsolutePath();
            Path base = importer.getParent() != null ? importer.getParent() : importer;
            target = base.resolve(normalizedImport);
        }
        return normalize(target);
    }

    /** Canonical string form of a document URI or path. */
    public static String normalize(String uri) {
        return normalize(toPath(uri).toAbsolutePath());
    }

    static Path toPath(String uri) {
        if (uri.startsWith("file:")) {
            return Paths.get(URI.create(uri));
        }
        return Paths.get(uri.replace('\\', '/'));
    }

    private static String normalize(Path path) {
        return path.normalize().toString().replace('\\', '/');
    }
}
