package io.eligian.core.workspace;

import io.eligian.core.asset.AssetLoader;
import io.eligian.core.asset.FileAssetLoader;
import io.eligian.core.compiler.CompilationPipeline;
import io.eligian.core.compiler.CompileOptions;
import io.eligian.core.compiler.CompileResult;
import io.eligian.core.compiler.CompiledConfiguration;
import io.eligian.core.library.ContentLoader;
import io.eligian.core.library.FileContentLoader;
import io.eligian.core.library.LibraryCache;
import io.eligian.core.library.LibraryPathResolver;
import io.eligian.core.registry.OperationRegistry;
import io.eligian.core.validation.Diagnostic;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Editor-side view of a set of documents. Open documents are served from memory, everything else
 * from the fallback loader, and both go through the same pipeline as batch compilation, so an
 * editor sees exactly the diagnostics {@code compile} would report.
 *
 * <p>Thread-safe: buffers live in a concurrent map and each analysis builds its own context.
 */
public final class DocumentSession {

    private static final Logger LOG = LoggerFactory.getLogger(DocumentSession.class);

    private final Map<String, String> buffers = new ConcurrentHashMap<>();
    private final LibraryCache cache = new LibraryCache();
    private final ContentLoader fallback;
    private final CompilationPipeline pipeline;

    public DocumentSession() {
        this(OperationRegistry.defaultRegistry(), new FileContentLoader(), new FileAssetLoader());
    }

    /**
     * @param registry operation registry used for validation
     * @param fallback loader for documents that are not open
     * @param assets loader for asset imports
     */
    public DocumentSession(OperationRegistry registry, ContentLoader fallback, AssetLoader assets) {
        this.fallback = Objects.requireNonNull(fallback, "fallback must not be null");
        ContentLoader buffered = uri -> {
            String text = buffers.get(LibraryPathResolver.normalize(uri));
            return text != null ? text : fallback.load(uri);
        };
        this.pipeline = CompilationPipeline.builder()
                .registry(registry)
                .contentLoader(buffered)
                .assetLoader(assets)
                .libraryCache(cache)
                .build();
    }

    public void open(String uri, String text) {
        String key = LibraryPathResolver.normalize(uri);
        buffers.put(key, Objects.requireNonNull(text, "text must not be null"));
        cache.invalidate(key);
        LOG.debug("Document opened: uri={}", key);
    }

    /** Replaces the text of an open document. */
    public void update(String uri, String text) {
        String key = LibraryPathResolver.normalize(uri);
        if (!buffers.containsKey(key)) {
            throw new IllegalStateException("Document is not open: " + key);
        }
        buffers.put(key, Objects.requireNonNull(text, "text must not be null"));
        cache.invalidate(key);
    }

    /** Closes a document; later reads fall back to the file on disk. */
    public void close(String uri) {
        String key = LibraryPathResolver.normalize(uri);
        buffers.remove(key);
        cache.invalidate(key);
        LOG.debug("Document closed: uri={}", key);
    }

    public boolean isOpen(String uri) {
        return buffers.containsKey(LibraryPathResolver.normalize(uri));
    }

    public Set<String> openDocuments() {
        return new TreeSet<>(buffers.keySet());
    }

    /**
     * Parses, resolves and validates the document at {@code uri}.
     *
     * @throws IOException if the document is neither open nor readable
     */
    public List<Diagnostic> diagnostics(String uri) throws IOException {
        String key = LibraryPathResolver.normalize(uri);
        return pipeline.analyze(text(key), key);
    }

    /** Compiles the document at {@code uri} using its current text. */
    public CompileResult<CompiledConfiguration> compile(String uri, CompileOptions options) throws IOException {
        String key = LibraryPathResolver.normalize(uri);
        return pipeline.compile(text(key), options.withSourceUri(key));
    }

    private String text(String key) throws IOException {
        String text = buffers.get(key);
        if (text != null) {
            return text;
        }
        return fallback.load(key);
    }
}
