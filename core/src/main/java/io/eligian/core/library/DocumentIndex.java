package io.eligian.core.library;

import io.eligian.core.ast.ActionDefinition;
import io.eligian.core.ast.Document;
import io.eligian.core.ast.LibraryImport;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Two-phase name resolution across an entry document and its libraries. All documents are
 * indexed first; only then can any document be linked, because a document may import from a
 * library that was loaded after it.
 *
 * <p>Not thread-safe. One index belongs to one compilation.
 */
public final class DocumentIndex {

    private final Map<String, Document> documents = new LinkedHashMap<>();
    private final Map<String, Map<String, ActionDefinition>> actionsByUri = new LinkedHashMap<>();
    private boolean indexed;

    /**
     * Phase one: records every document and the actions it defines.
     *
     * @param all the entry document and every loaded library
     */
    public void index(Collection<? extends Document> all) {
        for (Document document : all) {
            String key = key(document.uri());
            documents.put(key, document);
            Map<String, ActionDefinition> actions = new LinkedHashMap<>();
            for (ActionDefinition action : document.actions()) {
                actions.putIfAbsent(action.name(), action);
            }
            actionsByUri.put(key, actions);
        }
        indexed = true;
    }

    /**
     * Phase two: binds the imports of {@code document} against the indexed libraries.
     *
     * @throws IllegalStateException if called before {@link #index(Collection)}
     */
    public ActionScope link(Document document) {
        if (!indexed) {
            throw new IllegalStateException("Documents must be indexed before they are linked");
        }
        Map<String, ResolvedAction> visible = new LinkedHashMap<>();
        for (ActionDefinition action : document.actions()) {
            visible.putIfAbsent(action.name(), new ResolvedAction(action, document.uri()));
        }

        List<UnresolvedImport> unresolved = new ArrayList<>();
        for (LibraryImport libraryImport : document.libraryImports()) {
            String libraryUri = document.uri() == null
                    ? null
                    : LibraryPathResolver.resolve(document.uri(), libraryImport.path());
            Map<String, ActionDefinition> exported = libraryUri == null ? null : actionsByUri.get(libraryUri);
            for (String name : libraryImport.names()) {
                if (exported == null) {
                    unresolved.add(new UnresolvedImport(
                            name,
                            libraryImport.path(),
                            UnresolvedImport.Reason.LIBRARY_NOT_INDEXED,
                            libraryImport.location(),
                            List.of()));
                    continue;
                }
                ActionDefinition action = exported.get(name);
                if (action == null || action.isPrivate()) {
                    unresolved.add(new UnresolvedImport(
                            name,
                            libraryImport.path(),
                            action == null ? UnresolvedImport.Reason.NOT_FOUND : UnresolvedImport.Reason.PRIVATE,
                            libraryImport.location(),
                            publicNames(exported)));
                    continue;
                }
                visible.putIfAbsent(name, new ResolvedAction(action, libraryUri));
            }
        }
        return new ActionScope(visible, unresolved);
    }

    public Optional<Document> document(String uri) {
        return Optional.ofNullable(documents.get(key(uri)));
    }

    public boolean isIndexed() {
        return indexed;
    }

    private static List<String> publicNames(Map<String, ActionDefinition> exported) {
        List<String> names = new ArrayList<>();
        for (ActionDefinition action : exported.values()) {
            if (!action.isPrivate()) {
                names.add(action.name());
            }
        }
        return names;
    }

    private static String key(String uri) {
        return Objects.requireNonNullElse(uri, "");
    }
}
