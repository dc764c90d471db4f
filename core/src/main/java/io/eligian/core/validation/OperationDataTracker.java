package io.eligian.core.validation;

import io.eligian.core.registry.DependencyInfo;
import io.eligian.core.registry.OperationRegistry;
import io.eligian.core.registry.OperationSignature;
import io.eligian.core.registry.OutputInfo;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Tracks which named values are present in {@code operationData} while walking an action body
 * in execution order.
 *
 * <p>Each processed operation first has its dependencies checked against the available names,
 * then contributes its outputs: non-erased outputs become available, erased outputs are dropped
 * immediately. A dropped name only comes back when a later operation outputs it again.
 *
 * <p>Not thread-safe. One instance belongs to one traversal; branches and loop bodies work on a
 * {@link #copy()}.
 */
public final class OperationDataTracker {

    /** Whether a history entry made a name available or removed it. */
    public enum Change {
        ADDED,
        REMOVED
    }

    /** One state change, in processing order. */
    public record Event(String operation, String name, Change change) {}

    private final OperationRegistry registry;
    private final Set<String> available;
    private final List<Event> history;

    public OperationDataTracker(OperationRegistry registry) {
        this(registry, new LinkedHashSet<>(), new ArrayList<>());
    }

    private OperationDataTracker(OperationRegistry registry, Set<String> available, List<Event> history) {
        this.registry = registry;
        this.available = available;
        this.history = history;
    }

    /**
     * Applies one operation.
     *
     * @param operationName the operation, in execution order
     * @return dependencies that were not available before the operation ran, in declaration order;
     *     empty for unknown operations
     */
    public Set<String> processOperation(String operationName) {
        Optional<OperationSignature> found = registry.find(operationName);
        if (found.isEmpty()) {
            return Set.of();
        }
        OperationSignature signature = found.get();

        Set<String> missing = new LinkedHashSet<>();
        for (DependencyInfo dependency : signature.dependencies()) {
            if (!available.contains(dependency.name())) {
                missing.add(dependency.name());
            }
        }

        for (OutputInfo output : signature.outputs()) {
            if (output.erased()) {
                if (available.remove(output.name())) {
                    history.add(new Event(operationName, output.name(), Change.REMOVED));
                }
            } else if (available.add(output.name())) {
                history.add(new Event(operationName, output.name(), Change.ADDED));
            }
        }
        return Collections.unmodifiableSet(missing);
    }

    /**
     * Returns the operation that most recently removed {@code name}, if the name is currently
     * absent because of an erasure.
     */
    public Optional<String> findErasurePoint(String name) {
        for (int i = history.size() - 1; i >= 0; i--) {
            Event event = history.get(i);
            if (event.name().equals(name)) {
                return event.change() == Change.REMOVED ? Optional.of(event.operation()) : Optional.empty();
            }
        }
        return Optional.empty();
    }

    /** Independent copy of the current state, for validating a branch or loop body. */
    public OperationDataTracker copy() {
        return new OperationDataTracker(registry, new LinkedHashSet<>(available), new ArrayList<>(history));
    }

    public boolean isAvailable(String name) {
        return available.contains(name);
    }

    /** Snapshot of the currently available names, in the order they became available. */
    public Set<String> available() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(available));
    }

    /** Snapshot of all state changes so far. */
    public List<Event> history() {
        return List.copyOf(history);
    }
}
