package io.eligian.core.registry;

/**
 * A named runtime value an operation writes to {@code operationData}.
 *
 * @param name output name
 * @param type value type
 * @param erased {@code true} if the value is single-use and dropped right after this operation
 */
public record OutputInfo(String name, TypeTag type, boolean erased) {}
