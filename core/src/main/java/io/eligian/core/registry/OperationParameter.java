package io.eligian.core.registry;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * A positional parameter of an operation. Positional arguments are matched to parameters in
 * declaration order and emitted as named {@code operationData} entries.
 *
 * @param name parameter name, the key in {@code operationData}
 * @param type allowed argument type
 * @param required whether the argument must be supplied
 * @param erased whether the value is removed from {@code operationData} once the operation ran
 * @param defaultValue value used when an optional argument is omitted, or {@code null}
 * @param description human-readable description, may be {@code null}
 */
public record OperationParameter(
        String name, TypeTag type, boolean required, boolean erased, JsonNode defaultValue, String description) {

    public OperationParameter {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
    }

    public static OperationParameter required(String name, TypeTag type) {
        return new OperationParameter(name, type, true, false, null, null);
    }

    public static OperationParameter optional(String name, TypeTag type) {
        return new OperationParameter(name, type, false, false, null, null);
    }
}
