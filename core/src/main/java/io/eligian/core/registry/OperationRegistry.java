package io.eligian.core.registry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable table of operation signatures keyed by operation name.
 *
 * <p>Thread-safe: all fields are final and collections are unmodifiable. A single instance is
 * shared by every compilation in the process.
 */
public final class OperationRegistry {

    /** Classpath location of the bundled operation table. */
    public static final String DEFAULT_RESOURCE = "eligian/operations.yaml";

    private final Map<String, OperationSignature> operations;

    private OperationRegistry(Map<String, OperationSignature> operations) {
        this.operations = Collections.unmodifiableMap(new LinkedHashMap<>(operations));
    }

    /**
     * Returns the registry bundled with the compiler, loaded once from {@link #DEFAULT_RESOURCE}.
     *
     * @throws RegistryLoadException if the bundled file is missing or invalid
     */
    public static OperationRegistry defaultRegistry() {
        return DefaultHolder.INSTANCE;
    }

    /** Creates an empty registry. */
    public static OperationRegistry empty() {
        return new OperationRegistry(Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Looks up an operation by exact (case-sensitive) name.
     *
     * @return the signature, or empty if no operation has this name
     */
    public Optional<OperationSignature> find(String name) {
        return Optional.ofNullable(operations.get(name));
    }

    public boolean contains(String name) {
        return operations.containsKey(name);
    }

    /** All operation names, sorted alphabetically. */
    public Set<String> names() {
        return Collections.unmodifiableSet(new TreeSet<>(operations.keySet()));
    }

    /** All signatures in registration order. */
    public List<OperationSignature> all() {
        return List.copyOf(operations.values());
    }

    /** Names of the operations that produce {@code outputName} as a non-erased output, sorted. */
    public List<String> providersOf(String outputName) {
        List<String> providers = new ArrayList<>();
        for (OperationSignature signature : operations.values()) {
            if (signature.provides(outputName)) {
                providers.add(signature.name());
            }
        }
        Collections.sort(providers);
        return providers;
    }

    public int size() {
        return operations.size();
    }

    /** Builder for constructing a {@link OperationRegistry} incrementally. */
    public static final class Builder {

        private final Map<String, OperationSignature> operations = new LinkedHashMap<>();

        Builder() {}

        /**
         * Registers a signature. A later registration with the same name replaces the earlier one.
         *
         * @return this builder (fluent)
         */
        public Builder add(OperationSignature signature) {
            operations.put(signature.name(), signature);
            return this;
        }

        public Builder addAll(OperationRegistry other) {
            operations.putAll(other.operations);
            return this;
        }

        public OperationRegistry build() {
            return new OperationRegistry(operations);
        }
    }

    private static final class DefaultHolder {
        private static final OperationRegistry INSTANCE = new OperationRegistryLoader().loadResource(DEFAULT_RESOURCE);
    }
}
