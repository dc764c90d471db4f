package io.eligian.core.registry;

/** A named runtime value an operation expects to find in {@code operationData}. */
public record DependencyInfo(String name, TypeTag type) {}
