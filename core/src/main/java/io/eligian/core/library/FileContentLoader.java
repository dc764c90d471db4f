package io.eligian.core.library;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

/** Loads documents from the local file system as UTF-8. */
public final class FileContentLoader implements ContentLoader {

    @Override
    public String load(String uri) throws IOException {
        return Files.readString(LibraryPathResolver.toPath(uri), StandardCharsets.UTF_8);
    }
}
