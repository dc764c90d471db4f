package io.eligian.core.library;

import java.io.IOException;

/**
 * Reads the text of a source document by URI. The batch compiler reads from disk; an editor
 * session serves open buffers first.
 */
@FunctionalInterface
public interface ContentLoader {

    /**
     * @param uri normalized document URI as produced by {@link LibraryPathResolver}
     * @return the document text
     * @throws IOException if the document does not exist or cannot be read
     */
    String load(String uri) throws IOException;
}
