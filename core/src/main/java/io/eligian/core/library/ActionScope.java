package io.eligian.core.library;

import io.eligian.core.ast.ActionDefinition;
import io.eligian.core.ast.Document;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Actions visible from one document: its own definitions plus the ones bound by its imports.
 * Local definitions win over imports of the same name.
 */
public final class ActionScope {

    private final Map<String, ResolvedAction> actions;
    private final List<UnresolvedImport> unresolved;

    ActionScope(Map<String, ResolvedAction> actions, List<UnresolvedImport> unresolved) {
        this.actions = Collections.unmodifiableMap(new LinkedHashMap<>(actions));
        this.unresolved = List.copyOf(unresolved);
    }

    /** Scope of a document without imports or without a URI to resolve them from. */
    public static ActionScope localOnly(Document document) {
        Map<String, ResolvedAction> local = new LinkedHashMap<>();
        for (ActionDefinition action : document.actions()) {
            local.putIfAbsent(action.name(), new ResolvedAction(action, document.uri()));
        }
        return new ActionScope(local, List.of());
    }

    public Optional<ResolvedAction> resolve(String name) {
        return Optional.ofNullable(actions.get(name));
    }

    public boolean contains(String name) {
        return actions.containsKey(name);
    }

    /** Visible action names, sorted. */
    public Set<String> names() {
        return Collections.unmodifiableSet(new TreeSet<>(actions.keySet()));
    }

    /** Visible actions in binding order: local first, then imports. */
    public List<ResolvedAction> all() {
        return List.copyOf(actions.values());
    }

    /** Import names that could not be bound while linking. */
    public List<UnresolvedImport> unresolvedImports() {
        return unresolved;
    }
}
