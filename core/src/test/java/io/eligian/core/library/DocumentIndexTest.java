package io.eligian.core.library;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.eligian.core.ast.Document;
import io.eligian.core.parse.SourceParser;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DocumentIndex")
class DocumentIndexTest {

    private final SourceParser parser = new SourceParser();

    private Document parse(String path, String text) {
        return parser.parse(text, LibraryPathResolver.normalize(path));
    }

    @Test
    @DisplayName("linking before indexing is rejected")
    void linkBeforeIndex() {
        Document main = parse("/p/main.eligian", "action a() [ log(1) ]");

        assertThatThrownBy(() -> new DocumentIndex().link(main))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Documents must be indexed before they are linked");
    }

    @Test
    @DisplayName("libraries importing each other both resolve once everything is indexed")
    void mutualImports() {
        Document a = parse("/p/a.eligian", "library a import { fromB } from \"./b.eligian\" action fromA() [ fromB() ]");
        Document b = parse("/p/b.eligian", "library b import { fromA } from \"./a.eligian\" action fromB() [ log(1) ]");
        DocumentIndex index = new DocumentIndex();
        index.index(List.of(a, b));

        ActionScope scopeA = index.link(a);
        ActionScope scopeB = index.link(b);

        assertThat(scopeA.resolve("fromB")).hasValueSatisfying(
                action -> assertThat(action.documentUri()).isEqualTo(LibraryPathResolver.normalize("/p/b.eligian")));
        assertThat(scopeB.contains("fromA")).isTrue();
        assertThat(scopeA.unresolvedImports()).isEmpty();
    }

    @Test
    @DisplayName("private and missing names are reported with the library's public actions")
    void privateAndMissing() {
        Document main = parse("/p/main.eligian", "import { hidden, fadeInn } from \"./lib.eligian\"");
        Document lib = parse(
                "/p/lib.eligian", "library lib private action hidden() [ log(1) ] action fadeIn() [ log(2) ]");
        DocumentIndex index = new DocumentIndex();
        index.index(List.of(main, lib));

        List<UnresolvedImport> unresolved = index.link(main).unresolvedImports();

        assertThat(unresolved)
                .extracting(UnresolvedImport::name, UnresolvedImport::reason)
                .containsExactly(
                        org.assertj.core.groups.Tuple.tuple("hidden", UnresolvedImport.Reason.PRIVATE),
                        org.assertj.core.groups.Tuple.tuple("fadeInn", UnresolvedImport.Reason.NOT_FOUND));
        assertThat(unresolved.get(1).candidates()).containsExactly("fadeIn");
    }

    @Test
    @DisplayName("local definitions are visible before imports")
    void localFirst() {
        Document main = parse("/p/main.eligian", "action own() [ log(1) ]");
        DocumentIndex index = new DocumentIndex();
        index.index(List.of(main));

        ActionScope scope = index.link(main);

        assertThat(scope.names()).containsExactly("own");
        assertThat(index.document(main.uri())).containsSame(main);
        assertThat(index.isIndexed()).isTrue();
    }
}
