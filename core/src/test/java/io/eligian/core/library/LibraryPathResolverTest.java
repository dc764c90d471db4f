package io.eligian.core.library;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class LibraryPathResolverTest {

    @Test
    void resolvesSiblingPath() {
        assertThat(LibraryPathResolver.resolve("/a/b/main.eligian", "./lib.eligian"))
                .isEqualTo(LibraryPathResolver.normalize("/a/b/lib.eligian"));
    }

    @Test
    void collapsesParentSegments() {
        assertThat(LibraryPathResolver.resolve("/a/b/main.eligian", "../c/./lib.eligian"))
                .isEqualTo(LibraryPathResolver.normalize("/a/c/lib.eligian"));
    }

    @Test
    void acceptsBackslashes() {
        assertThat(LibraryPathResolver.resolve("/a/b/main.eligian", ".\\libs\\x.eligian"))
                .isEqualTo(LibraryPathResolver.normalize("/a/b/libs/x.eligian"));
    }

    @Test
    void sameFileAlwaysMapsToSameUri() {
        assertThat(LibraryPathResolver.normalize("/a/b/../b/x.eligian"))
                .isEqualTo(LibraryPathResolver.normalize("/a/b/x.eligian"));
        assertThat(LibraryPathResolver.normalize("file:///a/b/x.eligian"))
                .isEqualTo(LibraryPathResolver.normalize("/a/b/x.eligian"));
    }
}
