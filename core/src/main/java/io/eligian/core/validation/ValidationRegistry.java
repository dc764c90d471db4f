package io.eligian.core.validation;

import io.eligian.core.ast.Node;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks keyed by node type. A node is checked by every check registered for its exact class, in
 * registration order.
 *
 * <p>Immutable once built; shared by all compilations.
 */
public final class ValidationRegistry {

    private final Map<Class<? extends Node>, List<NodeCheck<? extends Node>>> checks;

    private ValidationRegistry(Map<Class<? extends Node>, List<NodeCheck<? extends Node>>> checks) {
        Map<Class<? extends Node>, List<NodeCheck<? extends Node>>> copy = new LinkedHashMap<>();
        checks.forEach((type, list) -> copy.put(type, List.copyOf(list)));
        this.checks = Collections.unmodifiableMap(copy);
    }

    /** The built-in checks for programs, libraries, actions, timelines and control flow. */
    public static ValidationRegistry defaults() {
        Builder builder = builder();
        DefaultChecks.registerAll(builder);
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Runs every check registered for the class of {@code node}. */
    @SuppressWarnings("unchecked")
    public void run(Node node, ValidationContext context) {
        for (NodeCheck<? extends Node> check : checks.getOrDefault(node.getClass(), List.of())) {
            ((NodeCheck<Node>) check).check(node, context);
        }
    }

    /** Number of checks registered for {@code type}. */
    public int checkCount(Class<? extends Node> type) {
        return checks.getOrDefault(type, List.of()).size();
    }

    /** Builder for a {@link ValidationRegistry}. */
    public static final class Builder {

        private final Map<Class<? extends Node>, List<NodeCheck<? extends Node>>> checks = new LinkedHashMap<>();

        Builder() {}

        public <T extends Node> Builder register(Class<T> type, NodeCheck<T> check) {
            checks.computeIfAbsent(type, k -> new ArrayList<>()).add(check);
            return this;
        }

        public ValidationRegistry build() {
            return new ValidationRegistry(checks);
        }
    }
}
