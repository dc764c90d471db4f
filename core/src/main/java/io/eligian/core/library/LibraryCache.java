package io.eligian.core.library;

import io.eligian.core.ast.Library;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide cache of parsed libraries, keyed by URI. An entry is only returned while the
 * document text is unchanged; editors call {@link #invalidate(String)} when a file changes on disk.
 *
 * <p>Thread-safe.
 */
public final class LibraryCache {

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    /** Returns the cached library for {@code uri} if it was parsed from exactly {@code content}. */
    public Optional<Library> get(String uri, String content) {
        Entry entry = entries.get(uri);
        if (entry == null || !entry.content().equals(content)) {
            return Optional.empty();
        }
        return Optional.of(entry.library());
    }

    public void put(String uri, String content, Library library) {
        entries.put(uri, new Entry(content, library));
    }

    public void invalidate(String uri) {
        entries.remove(uri);
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    private record Entry(String content, Library library) {}
}
