package io.eligian.core.library;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.eligian.core.ast.Document;
import io.eligian.core.error.CompilerException;
import io.eligian.core.error.ParseException;
import io.eligian.core.parse.SourceParser;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("LibraryResolver")
class LibraryResolverTest {

    private static final String MAIN = "/project/main.eligian";

    private final Map<String, String> files = new HashMap<>();
    private final AtomicInteger loads = new AtomicInteger();
    private final SourceParser parser = new SourceParser();

    private final ContentLoader loader = uri -> {
        loads.incrementAndGet();
        String text = files.get(uri);
        if (text == null) {
            throw new NoSuchFileException(uri);
        }
        return text;
    };

    private void file(String path, String text) {
        files.put(LibraryPathResolver.normalize(path), text);
    }

    private String uri(String path) {
        return LibraryPathResolver.normalize(path);
    }

    private Document main(String text) {
        return parser.parse(text, uri(MAIN));
    }

    private LibraryResolver resolver() {
        return new LibraryResolver(loader, parser, null);
    }

    @Nested
    @DisplayName("Loading")
    class Loading {

        @Test
        @DisplayName("transitive imports are loaded, each URI once")
        void diamond() {
            file("/project/a.eligian", "library a import { shared } from \"./shared.eligian\" action fromA() [ log(1) ]");
            file("/project/b.eligian", "library b import { shared } from \"./shared.eligian\" action fromB() [ log(2) ]");
            file("/project/shared.eligian", "library shared action shared() [ log(3) ]");

            List<LibraryDocument> libraries = resolver().resolveImports(main("""
                    import { fromA } from "./a.eligian"
                    import { fromB } from "./b.eligian"
                    """));

            assertThat(libraries)
                    .extracting(LibraryDocument::uri)
                    .containsExactly(
                            uri("/project/a.eligian"), uri("/project/shared.eligian"), uri("/project/b.eligian"));
        }

        @Test
        @DisplayName("paths are resolved relative to the importing library")
        void nestedRelativePaths() {
            file(
                    "/project/libs/anim.eligian",
                    "library anim import { base } from \"../core/base.eligian\" action fade() [ log(1) ]");
            file("/project/core/base.eligian", "library base action base() [ log(2) ]");

            List<LibraryDocument> libraries =
                    resolver().resolveImports(main("import { fade } from \"./libs/anim.eligian\""));

            assertThat(libraries).extracting(LibraryDocument::uri).contains(uri("/project/core/base.eligian"));
        }

        @Test
        @DisplayName("cached libraries are reused while their content is unchanged")
        void cacheReuse() {
            file("/project/a.eligian", "library a action fromA() [ log(1) ]");
            LibraryCache cache = new LibraryCache();
            LibraryResolver cached = new LibraryResolver(loader, parser, cache);
            Document entry = main("import { fromA } from \"./a.eligian\"");

            LibraryDocument first = cached.resolveImports(entry).get(0);
            LibraryDocument second = cached.resolveImports(entry).get(0);

            assertThat(second.library()).isSameAs(first.library());
            assertThat(cache.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("libraries are read from disk by the default loader")
        void fileLoader(@TempDir Path dir) throws Exception {
            Files.writeString(dir.resolve("lib.eligian"), "library lib action hello() [ log(1) ]");
            Path mainFile = dir.resolve("main.eligian");
            Document entry = parser.parse(
                    "import { hello } from \"./lib.eligian\"", LibraryPathResolver.normalize(mainFile.toString()));

            List<LibraryDocument> libraries =
                    new LibraryResolver(new FileContentLoader(), parser, null).resolveImports(entry);

            assertThat(libraries).singleElement().satisfies(doc -> assertThat(doc.library().name()).isEqualTo("lib"));
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("a cycle is reported with the full chain")
        void cycle() {
            file("/project/a.eligian", "library a import { b } from \"./b.eligian\" action a() [ log(1) ]");
            file("/project/b.eligian", "library b import { a } from \"./a.eligian\" action b() [ log(2) ]");

            assertThatThrownBy(() -> resolver().resolveImports(main("import { a } from \"./a.eligian\"")))
                    .isInstanceOf(ParseException.class)
                    .hasMessage("Circular dependency detected: " + uri("/project/a.eligian") + " → "
                            + uri("/project/b.eligian") + " → " + uri("/project/a.eligian"))
                    .extracting(e -> ((CompilerException) e).hint())
                    .isEqualTo("Remove circular import to break the cycle");
        }

        @Test
        @DisplayName("a library importing itself is a cycle")
        void selfImport() {
            file("/project/a.eligian", "library a import { a } from \"./a.eligian\" action a() [ log(1) ]");

            assertThatThrownBy(() -> resolver().loadLibraryRecursive(uri("/project/a.eligian"), uri(MAIN), Set.of()))
                    .isInstanceOf(ParseException.class)
                    .hasMessageStartingWith("Circular dependency detected");
        }

        @Test
        @DisplayName("a missing file names the resolved path")
        void missingFile() {
            assertThatThrownBy(() -> resolver().resolveImports(main("import { x } from \"./missing.eligian\"")))
                    .isInstanceOf(ParseException.class)
                    .hasMessage("Failed to load library file: " + uri("/project/missing.eligian"));
        }

        @Test
        @DisplayName("importing a program instead of a library is rejected")
        void notALibrary() {
            file("/project/other.eligian", "action x() [ log(1) ]");

            assertThatThrownBy(() -> resolver().resolveImports(main("import { x } from \"./other.eligian\"")))
                    .isInstanceOf(ParseException.class)
                    .hasMessageStartingWith("File is not a library (found program instead)");
        }

        @Test
        @DisplayName("syntax errors inside a library carry the library's location")
        void syntaxErrorInLibrary() {
            file("/project/bad.eligian", "library bad action ( [ ]");

            assertThatThrownBy(() -> resolver().resolveImports(main("import { x } from \"./bad.eligian\"")))
                    .isInstanceOf(ParseException.class)
                    .satisfies(e -> assertThat(((ParseException) e).location().file())
                            .isEqualTo(uri("/project/bad.eligian")));
        }
    }
}
